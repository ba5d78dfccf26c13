package rollingplan.distribution;

import rollingplan.geometry.VisibilityWindow;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 目标-平台距离计算结果
 *
 * 每个周期重新计算，创建后不再修改
 */
public class DistanceResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String targetId;
    private final String platformId;
    private final double minDistance;      // 公里
    private final double avgDistance;      // 公里
    private final Instant closestTime;
    private final List<VisibilityWindow> visibilityWindows;
    private final double confidence;

    public DistanceResult(String targetId, String platformId,
                          double minDistance, double avgDistance,
                          Instant closestTime,
                          List<VisibilityWindow> visibilityWindows,
                          double confidence) {
        this.targetId = targetId;
        this.platformId = platformId;
        this.minDistance = minDistance;
        this.avgDistance = avgDistance;
        this.closestTime = closestTime;
        this.visibilityWindows = visibilityWindows == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(visibilityWindows));
        this.confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    /**
     * 不可达结果（计算失败或无位置信息）
     */
    public static DistanceResult unreachable(String targetId, String platformId, Instant time) {
        return new DistanceResult(targetId, platformId,
            Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY,
            time, Collections.emptyList(), 0.0);
    }

    // Getters
    public String getTargetId() {
        return targetId;
    }

    public String getPlatformId() {
        return platformId;
    }

    public double getMinDistance() {
        return minDistance;
    }

    public double getAvgDistance() {
        return avgDistance;
    }

    public Instant getClosestTime() {
        return closestTime;
    }

    public List<VisibilityWindow> getVisibilityWindows() {
        return visibilityWindows;
    }

    public double getConfidence() {
        return confidence;
    }

    /**
     * 置信度加权得分：置信度越低，有效距离最多放大到2倍
     */
    public double getWeightedScore() {
        return minDistance * (2.0 - confidence);
    }

    public boolean isReachable() {
        return Double.isFinite(minDistance);
    }

    @Override
    public String toString() {
        return String.format("DistanceResult[%s -> %s, min=%.2fkm, avg=%.2fkm, windows=%d, confidence=%.2f]",
            targetId, platformId, minDistance, avgDistance, visibilityWindows.size(), confidence);
    }
}
