package rollingplan.platform;

import rollingplan.model.Target;
import rollingplan.model.TrackingTask;

/**
 * 跟踪平台的非拥有引用
 *
 * 平台本身由外部注册表管理。接收任务后平台通常会在外部协同运行时中开启讨论组。
 */
public interface PlatformHandle {

    String getId();

    /**
     * 接收跟踪任务
     *
     * @param task 任务信息
     * @param target 任务对应的目标
     * @throws DispatchException 平台无法接收任务
     */
    void receiveTask(TrackingTask task, Target target) throws DispatchException;
}
