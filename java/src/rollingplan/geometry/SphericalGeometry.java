package rollingplan.geometry;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;

import java.util.logging.Logger;

/**
 * 球面几何计算
 *
 * 无状态的数值原语：Haversine地面距离（叠加高度差）与地理坐标到笛卡尔坐标的转换。
 * 输入异常时返回 {@code +∞}，不向调用方抛出异常。
 */
public final class SphericalGeometry {

    private static final Logger logger = Logger.getLogger(SphericalGeometry.class.getName());

    /** 平均地球半径（公里） */
    public static final double EARTH_RADIUS_KM = 6371.0;

    private SphericalGeometry() {
    }

    /**
     * 计算球面距离（Haversine公式 + 高度差勾股合成）
     *
     * @param a 位置1
     * @param b 位置2
     * @return 距离（公里），输入非法时为 +∞
     */
    public static double sphericalDistance(GeoPosition a, GeoPosition b) {
        return sphericalDistance(a, b, EARTH_RADIUS_KM);
    }

    /**
     * 使用指定球体半径计算球面距离
     *
     * @param a 位置1
     * @param b 位置2
     * @param earthRadiusKm 球体半径（公里）
     * @return 距离（公里），输入非法时为 +∞
     */
    public static double sphericalDistance(GeoPosition a, GeoPosition b, double earthRadiusKm) {
        if (a == null || b == null || !a.isFinite() || !b.isFinite()) {
            logger.fine(() -> "球面距离输入非法: " + a + ", " + b);
            return Double.POSITIVE_INFINITY;
        }

        double lat1 = FastMath.toRadians(a.getLatitude());
        double lat2 = FastMath.toRadians(b.getLatitude());
        double dLat = lat2 - lat1;
        double dLon = FastMath.toRadians(b.getLongitude() - a.getLongitude());

        double sinHalfLat = FastMath.sin(dLat / 2);
        double sinHalfLon = FastMath.sin(dLon / 2);
        double h = sinHalfLat * sinHalfLat
                + FastMath.cos(lat1) * FastMath.cos(lat2) * sinHalfLon * sinHalfLon;
        // 数值误差可能使h略大于1
        double c = 2 * FastMath.asin(FastMath.sqrt(FastMath.min(1.0, h)));

        double ground = earthRadiusKm * c;
        double heightDiff = FastMath.abs(b.getAltitude() - a.getAltitude());

        return FastMath.sqrt(ground * ground + heightDiff * heightDiff);
    }

    /**
     * 地理坐标转地心笛卡尔坐标（球形地球，公里）
     *
     * @param position 地理位置
     * @return 地心坐标向量
     */
    public static Vector3D toCartesian(GeoPosition position) {
        double radius = EARTH_RADIUS_KM + position.getAltitude();
        return new Vector3D(
            FastMath.toRadians(position.getLongitude()),
            FastMath.toRadians(position.getLatitude())
        ).scalarMultiply(radius);
    }
}
