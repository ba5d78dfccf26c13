package rollingplan.geometry;

import java.util.List;

/**
 * 距离序列统计
 *
 * 计算距离计算结果的置信度：距离稳定性与可见窗口覆盖度的平均值。
 */
public final class DistanceStatistics {

    /** 方差归一化因子（公里²） */
    private static final double VARIANCE_SCALE = 1_000_000.0;

    /** 满分所需的可见窗口数 */
    private static final double FULL_COVERAGE_WINDOWS = 3.0;

    private DistanceStatistics() {
    }

    /**
     * 计算置信度
     *
     * @param distances 距离列表（公里）
     * @param windows 可见窗口列表
     * @return 置信度 [0, 1]，输入为空时为0
     */
    public static double confidence(List<Double> distances, List<VisibilityWindow> windows) {
        if (distances == null || distances.isEmpty()) {
            return 0.0;
        }

        double variance = variance(distances);
        double stability = Double.isFinite(variance)
            ? Math.max(0.0, 1.0 - variance / VARIANCE_SCALE)
            : 0.0;

        int windowCount = windows == null ? 0 : windows.size();
        double coverage = Math.min(1.0, windowCount / FULL_COVERAGE_WINDOWS);

        double confidence = (stability + coverage) / 2.0;
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    /**
     * 总体方差
     */
    public static double variance(List<Double> values) {
        if (values == null || values.isEmpty()) {
            return 0.0;
        }
        double mean = mean(values);
        if (!Double.isFinite(mean)) {
            return Double.POSITIVE_INFINITY;
        }
        double sum = 0.0;
        for (double v : values) {
            double d = v - mean;
            sum += d * d;
        }
        return sum / values.size();
    }

    /**
     * 平均值，空列表为 +∞
     */
    public static double mean(List<Double> values) {
        if (values == null || values.isEmpty()) {
            return Double.POSITIVE_INFINITY;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }
}
