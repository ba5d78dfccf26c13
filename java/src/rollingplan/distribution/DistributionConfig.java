package rollingplan.distribution;

import java.io.Serializable;

/**
 * 分发配置
 *
 * 控制距离矩阵计算与分发的参数
 */
public class DistributionConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private double visibilityThresholdKm = 2000.0;   // 可见阈值（公里）
    private double earthRadiusKm = 6371.0;           // 地球半径（公里）
    private boolean useParallel = true;              // 是否并行计算距离矩阵
    private int parallelism = 0;                     // 线程数，0表示按CPU核数
    private int maxBatchSize = 100;                  // 每批最多处理的目标数
    private boolean trackPlatformMotion = false;     // 按轨迹点时刻查询平台位置

    public DistributionConfig() {
    }

    // Getters and Setters
    public double getVisibilityThresholdKm() {
        return visibilityThresholdKm;
    }

    public void setVisibilityThresholdKm(double visibilityThresholdKm) {
        this.visibilityThresholdKm = visibilityThresholdKm;
    }

    public double getEarthRadiusKm() {
        return earthRadiusKm;
    }

    public void setEarthRadiusKm(double earthRadiusKm) {
        this.earthRadiusKm = earthRadiusKm;
    }

    public boolean isUseParallel() {
        return useParallel;
    }

    public void setUseParallel(boolean useParallel) {
        this.useParallel = useParallel;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    public void setMaxBatchSize(int maxBatchSize) {
        this.maxBatchSize = maxBatchSize;
    }

    public boolean isTrackPlatformMotion() {
        return trackPlatformMotion;
    }

    public void setTrackPlatformMotion(boolean trackPlatformMotion) {
        this.trackPlatformMotion = trackPlatformMotion;
    }

    @Override
    public String toString() {
        return "DistributionConfig{" +
                "visibilityThresholdKm=" + visibilityThresholdKm +
                ", earthRadiusKm=" + earthRadiusKm +
                ", useParallel=" + useParallel +
                ", parallelism=" + parallelism +
                ", maxBatchSize=" + maxBatchSize +
                ", trackPlatformMotion=" + trackPlatformMotion +
                '}';
    }
}
