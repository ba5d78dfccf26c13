package rollingplan.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * 分发给平台的跟踪任务
 */
public class TrackingTask implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String taskId;
    private final String targetId;
    private final String platformId;
    private final double priority;
    private final Instant windowStart;
    private final Instant windowEnd;

    public TrackingTask(String taskId, String targetId, String platformId,
                        double priority, Instant windowStart, Instant windowEnd) {
        this.taskId = taskId;
        this.targetId = targetId;
        this.platformId = platformId;
        this.priority = priority;
        this.windowStart = windowStart;
        this.windowEnd = windowEnd;
    }

    /**
     * 为目标-平台对创建任务，窗口为目标的发射时间到预计结束时间
     */
    public static TrackingTask forTarget(Target target, String platformId) {
        return new TrackingTask(
            "track_" + target.getId() + "_" + platformId,
            target.getId(),
            platformId,
            target.getPriority(),
            target.getLaunchTime(),
            target.getEstimatedEndTime()
        );
    }

    public String getTaskId() {
        return taskId;
    }

    public String getTargetId() {
        return targetId;
    }

    public String getPlatformId() {
        return platformId;
    }

    public double getPriority() {
        return priority;
    }

    public Instant getWindowStart() {
        return windowStart;
    }

    public Instant getWindowEnd() {
        return windowEnd;
    }

    @Override
    public String toString() {
        return String.format("TrackingTask[%s: %s -> %s, priority=%.2f, %s to %s]",
            taskId, targetId, platformId, priority, windowStart, windowEnd);
    }
}
