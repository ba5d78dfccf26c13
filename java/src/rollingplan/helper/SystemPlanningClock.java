package rollingplan.helper;

import java.time.Duration;
import java.time.Instant;

/**
 * 基于系统时间的规划时钟
 */
final class SystemPlanningClock implements PlanningClock {

    static final SystemPlanningClock INSTANCE = new SystemPlanningClock();

    private SystemPlanningClock() {
    }

    @Override
    public Instant now() {
        return Instant.now();
    }

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis());
        }
    }
}
