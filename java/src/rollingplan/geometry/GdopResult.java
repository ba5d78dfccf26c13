package rollingplan.geometry;

import java.io.Serializable;

/**
 * GDOP计算结果
 *
 * 计算失败时不抛出异常，而是返回 {@link #isSuccess()} 为false的结果，
 * 调用方必须先检查成功标志。
 */
public class GdopResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final boolean success;
    private final String errorMessage;
    private final int platformCount;
    private final double gdop;
    private final double pdop;
    private final double hdop;
    private final double vdop;
    private final double tdop;
    private final double conditionNumber;
    private final boolean pseudoInverseUsed;
    private final GeometryQuality quality;

    private GdopResult(boolean success, String errorMessage, int platformCount,
                       double gdop, double pdop, double hdop, double vdop, double tdop,
                       double conditionNumber, boolean pseudoInverseUsed) {
        this.success = success;
        this.errorMessage = errorMessage;
        this.platformCount = platformCount;
        this.gdop = gdop;
        this.pdop = pdop;
        this.hdop = hdop;
        this.vdop = vdop;
        this.tdop = tdop;
        this.conditionNumber = conditionNumber;
        this.pseudoInverseUsed = pseudoInverseUsed;
        this.quality = success ? GeometryQuality.of(gdop) : GeometryQuality.BAD;
    }

    static GdopResult success(int platformCount, double gdop, double pdop, double hdop,
                              double vdop, double tdop, double conditionNumber,
                              boolean pseudoInverseUsed) {
        return new GdopResult(true, null, platformCount, gdop, pdop, hdop, vdop, tdop,
                              conditionNumber, pseudoInverseUsed);
    }

    static GdopResult failure(String errorMessage, int platformCount) {
        double inf = Double.POSITIVE_INFINITY;
        return new GdopResult(false, errorMessage, platformCount, inf, inf, inf, inf, inf,
                              Double.NaN, false);
    }

    // Getters
    public boolean isSuccess() {
        return success;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public int getPlatformCount() {
        return platformCount;
    }

    public double getGdop() {
        return gdop;
    }

    public double getPdop() {
        return pdop;
    }

    public double getHdop() {
        return hdop;
    }

    public double getVdop() {
        return vdop;
    }

    public double getTdop() {
        return tdop;
    }

    /**
     * 设计矩阵条件数
     */
    public double getConditionNumber() {
        return conditionNumber;
    }

    public boolean isPseudoInverseUsed() {
        return pseudoInverseUsed;
    }

    public GeometryQuality getQuality() {
        return quality;
    }

    @Override
    public String toString() {
        if (!success) {
            return "GdopResult{failed: " + errorMessage + ", platforms=" + platformCount + '}';
        }
        return String.format(
            "GdopResult{gdop=%.3f, pdop=%.3f, hdop=%.3f, vdop=%.3f, tdop=%.3f, quality=%s, platforms=%d}",
            gdop, pdop, hdop, vdop, tdop, quality, platformCount
        );
    }
}
