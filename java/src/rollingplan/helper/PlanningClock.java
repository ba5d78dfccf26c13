package rollingplan.helper;

import java.time.Duration;
import java.time.Instant;

/**
 * 规划时钟
 *
 * 提供当前（仿真）时刻并负责轮询等待，便于测试中替换为手动推进的时钟。
 */
public interface PlanningClock {

    Instant now();

    /**
     * 阻塞等待指定时长
     *
     * @param duration 等待时长
     * @throws InterruptedException 等待被中断
     */
    void sleep(Duration duration) throws InterruptedException;

    /**
     * 系统时钟
     */
    static PlanningClock system() {
        return SystemPlanningClock.INSTANCE;
    }
}
