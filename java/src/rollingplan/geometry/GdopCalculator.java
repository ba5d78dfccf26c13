package rollingplan.geometry;

import org.hipparchus.exception.MathRuntimeException;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.linear.DecompositionSolver;
import org.hipparchus.linear.LUDecomposition;
import org.hipparchus.linear.MatrixUtils;
import org.hipparchus.linear.RealMatrix;
import org.hipparchus.linear.SingularValueDecomposition;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * GDOP（几何精度衰减因子）计算器
 *
 * GDOP = √(q11 + q22 + q33 + q44)，其中 q 为权系数矩阵 Q = (AᵀA)⁻¹ 的对角线元素，
 * A 为由视线单位向量与时间列组成的设计矩阵。GDOP越小，几何分布越好。
 */
public class GdopCalculator {

    private static final Logger logger = Logger.getLogger(GdopCalculator.class.getName());

    /** 计算GDOP所需的最少平台数 */
    public static final int MIN_PLATFORMS = 4;

    /** 超过此条件数时改用伪逆 */
    private static final double MAX_CONDITION_NUMBER = 1e12;

    /** 平台与观测者距离过近的判定阈值 */
    private static final double MIN_RANGE = 1e-6;

    /**
     * 计算GDOP（笛卡尔坐标输入）
     *
     * @param platformPositions 平台位置列表
     * @param observerPosition 观测者位置
     * @return GDOP计算结果，失败时 success=false
     */
    public GdopResult calculate(List<Vector3D> platformPositions, Vector3D observerPosition) {
        int count = platformPositions == null ? 0 : platformPositions.size();
        if (count < MIN_PLATFORMS) {
            logger.warning(String.format("平台数量不足: %d < %d", count, MIN_PLATFORMS));
            return GdopResult.failure("平台数量不足，至少需要" + MIN_PLATFORMS + "个平台", count);
        }
        if (observerPosition == null || !isFinite(observerPosition)) {
            return GdopResult.failure("观测者位置非法", count);
        }

        try {
            // 1. 构建设计矩阵A（方向余弦 + 时间项）
            RealMatrix design = buildDesignMatrix(platformPositions, observerPosition);
            if (design == null) {
                return GdopResult.failure("设计矩阵构建失败", count);
            }
            double designCondition = new SingularValueDecomposition(design).getConditionNumber();

            // 2. 计算权系数矩阵 Q = (AᵀA)⁻¹
            RealMatrix normal = design.transpose().multiply(design);
            WeightMatrix weights = computeWeightMatrix(normal);
            if (weights == null) {
                return GdopResult.failure("权系数矩阵计算失败（可能是矩阵奇异）", count);
            }

            double q11 = weights.matrix.getEntry(0, 0);
            double q22 = weights.matrix.getEntry(1, 1);
            double q33 = weights.matrix.getEntry(2, 2);
            double q44 = weights.matrix.getEntry(3, 3);

            // 3. 检查权系数
            for (double q : new double[]{q11, q22, q33, q44}) {
                if (!Double.isFinite(q) || q < 0) {
                    logger.warning(String.format("权系数异常: q11=%.4f, q22=%.4f, q33=%.4f, q44=%.4f",
                        q11, q22, q33, q44));
                    return GdopResult.failure("权系数异常", count);
                }
            }

            double gdopSquared = q11 + q22 + q33 + q44;
            if (gdopSquared < 0) {
                return GdopResult.failure("GDOP平方值为负", count);
            }

            GdopResult result = GdopResult.success(
                count,
                Math.sqrt(gdopSquared),
                dop(q11 + q22 + q33),
                dop(q11 + q22),
                dop(q33),
                dop(q44),
                designCondition,
                weights.pseudoInverse
            );
            logger.fine(() -> "GDOP计算完成: " + result);
            return result;

        } catch (MathRuntimeException e) {
            logger.log(Level.WARNING, "GDOP计算失败", e);
            return GdopResult.failure(e.getMessage(), count);
        }
    }

    /**
     * 计算GDOP（地理坐标输入，球形地球模型）
     *
     * @param platformPositions 平台地理位置
     * @param observerPosition 观测者地理位置
     * @return GDOP计算结果
     */
    public GdopResult calculateGeodetic(List<GeoPosition> platformPositions, GeoPosition observerPosition) {
        if (platformPositions == null || observerPosition == null) {
            return GdopResult.failure("输入为空", platformPositions == null ? 0 : platformPositions.size());
        }
        List<Vector3D> cartesian = new ArrayList<>(platformPositions.size());
        for (GeoPosition p : platformPositions) {
            cartesian.add(SphericalGeometry.toCartesian(p));
        }
        return calculate(cartesian, SphericalGeometry.toCartesian(observerPosition));
    }

    /**
     * 构建设计矩阵A
     */
    private RealMatrix buildDesignMatrix(List<Vector3D> platforms, Vector3D observer) {
        RealMatrix design = MatrixUtils.createRealMatrix(platforms.size(), 4);

        for (int i = 0; i < platforms.size(); i++) {
            Vector3D platform = platforms.get(i);
            if (platform == null || !isFinite(platform)) {
                logger.warning("平台" + i + "位置非法");
                return null;
            }
            Vector3D lineOfSight = platform.subtract(observer);
            double range = lineOfSight.getNorm();

            if (range < MIN_RANGE) {
                // 保留零行
                logger.warning(String.format("平台%d距离观测者过近: %.3e", i, range));
                continue;
            }

            design.setEntry(i, 0, lineOfSight.getX() / range);
            design.setEntry(i, 1, lineOfSight.getY() / range);
            design.setEntry(i, 2, lineOfSight.getZ() / range);
            design.setEntry(i, 3, 1.0);
        }
        return design;
    }

    /**
     * 求逆；条件数过大或奇异时回退到伪逆
     */
    private WeightMatrix computeWeightMatrix(RealMatrix normal) {
        SingularValueDecomposition svd = new SingularValueDecomposition(normal);
        double condition = svd.getConditionNumber();

        if (!(condition <= MAX_CONDITION_NUMBER)) {
            logger.warning(String.format("矩阵条件数过大: %.2e，使用伪逆", condition));
            return pseudoInverse(svd);
        }

        DecompositionSolver solver = new LUDecomposition(normal).getSolver();
        if (!solver.isNonSingular()) {
            logger.warning("法矩阵奇异，使用伪逆作为备用方案");
            return pseudoInverse(svd);
        }
        try {
            return new WeightMatrix(solver.getInverse(), false);
        } catch (MathRuntimeException e) {
            logger.log(Level.WARNING, "求逆失败，使用伪逆作为备用方案", e);
            return pseudoInverse(svd);
        }
    }

    private WeightMatrix pseudoInverse(SingularValueDecomposition svd) {
        try {
            return new WeightMatrix(svd.getSolver().getInverse(), true);
        } catch (MathRuntimeException e) {
            logger.log(Level.SEVERE, "伪逆矩阵计算也失败", e);
            return null;
        }
    }

    private static double dop(double sum) {
        return (Double.isFinite(sum) && sum >= 0) ? Math.sqrt(sum) : Double.POSITIVE_INFINITY;
    }

    private static boolean isFinite(Vector3D v) {
        return Double.isFinite(v.getX()) && Double.isFinite(v.getY()) && Double.isFinite(v.getZ());
    }

    /**
     * 权系数矩阵及其求解方式
     */
    private static class WeightMatrix {
        private final RealMatrix matrix;
        private final boolean pseudoInverse;

        WeightMatrix(RealMatrix matrix, boolean pseudoInverse) {
            this.matrix = matrix;
            this.pseudoInverse = pseudoInverse;
        }
    }
}
