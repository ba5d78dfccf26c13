package rollingplan.geometry;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;

/**
 * 可见窗口数据类
 *
 * 表示目标轨迹上与平台距离持续不超过阈值的一段连续采样区间
 */
public class VisibilityWindow implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int startIndex;
    private final int endIndex;
    private final Instant startTime;
    private final Instant endTime;
    private final double minDistance;      // 公里
    private final double durationSeconds;

    public VisibilityWindow(int startIndex, int endIndex,
                            Instant startTime, Instant endTime,
                            double minDistance) {
        this.startIndex = startIndex;
        this.endIndex = endIndex;
        this.startTime = startTime;
        this.endTime = endTime;
        this.minDistance = minDistance;
        this.durationSeconds = (startTime == null || endTime == null)
            ? 0.0
            : Duration.between(startTime, endTime).toMillis() / 1000.0;
    }

    // Getters
    public int getStartIndex() {
        return startIndex;
    }

    public int getEndIndex() {
        return endIndex;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public double getMinDistance() {
        return minDistance;
    }

    public double getDurationSeconds() {
        return durationSeconds;
    }

    /**
     * 窗口包含的采样点数
     */
    public int getSampleCount() {
        return endIndex - startIndex + 1;
    }

    @Override
    public String toString() {
        return String.format("VisibilityWindow[%d..%d, %s to %s, %.1fs, min %.1fkm]",
            startIndex, endIndex, startTime, endTime, durationSeconds, minDistance);
    }
}
