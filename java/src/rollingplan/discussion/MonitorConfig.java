package rollingplan.discussion;

import java.io.Serializable;
import java.time.Duration;

/**
 * 讨论组等待配置
 *
 * 最长等待时间 = min(每轮基础时间 × 最大迭代轮次 × 安全系数, 绝对上限)，
 * 默认 min(60s × 5 × 1.5, 600s) = 450s。
 */
public class MonitorConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private Duration baseTimePerIteration = Duration.ofSeconds(60);
    private int maxIterations = 5;
    private double safetyMargin = 1.5;
    private Duration absoluteCap = Duration.ofSeconds(600);
    private Duration pollInterval = Duration.ofSeconds(5);

    public MonitorConfig() {
    }

    /**
     * 计算最长等待时间
     */
    public Duration computeMaxWait() {
        double estimatedMillis = baseTimePerIteration.toMillis() * (double) maxIterations * safetyMargin;
        long capMillis = absoluteCap.toMillis();
        return Duration.ofMillis((long) Math.min(estimatedMillis, capMillis));
    }

    public Duration getBaseTimePerIteration() {
        return baseTimePerIteration;
    }

    public void setBaseTimePerIteration(Duration baseTimePerIteration) {
        this.baseTimePerIteration = baseTimePerIteration;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    public double getSafetyMargin() {
        return safetyMargin;
    }

    public void setSafetyMargin(double safetyMargin) {
        this.safetyMargin = safetyMargin;
    }

    public Duration getAbsoluteCap() {
        return absoluteCap;
    }

    public void setAbsoluteCap(Duration absoluteCap) {
        this.absoluteCap = absoluteCap;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    @Override
    public String toString() {
        return "MonitorConfig{" +
                "baseTimePerIteration=" + baseTimePerIteration.getSeconds() + "s" +
                ", maxIterations=" + maxIterations +
                ", safetyMargin=" + safetyMargin +
                ", absoluteCap=" + absoluteCap.getSeconds() + "s" +
                ", pollInterval=" + pollInterval.getSeconds() + "s" +
                ", maxWait=" + computeMaxWait().getSeconds() + "s" +
                '}';
    }
}
