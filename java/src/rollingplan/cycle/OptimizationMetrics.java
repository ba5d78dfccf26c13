package rollingplan.cycle;

import java.io.Serializable;
import java.util.OptionalDouble;

/**
 * 周期优化指标
 */
public class OptimizationMetrics implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double coverage;              // 已分配目标 / 目标总数
    private final double resourceUtilization;   // 有任务的平台 / 平台总数
    private final Double meanGdop;              // 无法计算时为null
    private final int gdopSampleCount;

    public OptimizationMetrics(double coverage, double resourceUtilization, Double meanGdop, int gdopSampleCount) {
        this.coverage = coverage;
        this.resourceUtilization = resourceUtilization;
        this.meanGdop = meanGdop;
        this.gdopSampleCount = gdopSampleCount;
    }

    public static OptimizationMetrics empty() {
        return new OptimizationMetrics(0.0, 0.0, null, 0);
    }

    public double getCoverage() {
        return coverage;
    }

    public double getResourceUtilization() {
        return resourceUtilization;
    }

    public OptionalDouble getMeanGdop() {
        return meanGdop == null ? OptionalDouble.empty() : OptionalDouble.of(meanGdop);
    }

    /**
     * 参与GDOP平均的目标数
     */
    public int getGdopSampleCount() {
        return gdopSampleCount;
    }

    @Override
    public String toString() {
        return "OptimizationMetrics{" +
                "coverage=" + String.format("%.3f", coverage) +
                ", resourceUtilization=" + String.format("%.3f", resourceUtilization) +
                ", meanGdop=" + (meanGdop == null ? "n/a" : String.format("%.3f", meanGdop)) +
                '}';
    }
}
