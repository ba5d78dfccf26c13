package rollingplan.geometry;

/**
 * 几何分布质量等级（按GDOP分档）
 */
public enum GeometryQuality {
    EXCELLENT,   // 优秀 GDOP <= 1
    GOOD,        // 良好 GDOP <= 2
    FAIR,        // 一般 GDOP <= 5
    POOR,        // 较差 GDOP <= 10
    BAD;         // 很差

    public static GeometryQuality of(double gdop) {
        if (gdop <= 1.0) {
            return EXCELLENT;
        } else if (gdop <= 2.0) {
            return GOOD;
        } else if (gdop <= 5.0) {
            return FAIR;
        } else if (gdop <= 10.0) {
            return POOR;
        }
        return BAD;
    }
}
