package rollingplan.geometry;

import java.io.Serializable;
import java.util.Objects;

/**
 * 地理位置
 *
 * 纬度、经度（度），高度（公里）。目标轨迹点与平台位置共用此类型。
 */
public class GeoPosition implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double latitude;    // 度
    private final double longitude;   // 度
    private final double altitude;    // 公里

    public GeoPosition(double latitude, double longitude) {
        this(latitude, longitude, 0.0);
    }

    public GeoPosition(double latitude, double longitude, double altitude) {
        this.latitude = latitude;
        this.longitude = longitude;
        this.altitude = altitude;
    }

    // Getters
    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    public double getAltitude() {
        return altitude;
    }

    /**
     * 所有分量均为有限值
     */
    public boolean isFinite() {
        return Double.isFinite(latitude) && Double.isFinite(longitude) && Double.isFinite(altitude);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GeoPosition)) {
            return false;
        }
        GeoPosition that = (GeoPosition) o;
        return Double.compare(latitude, that.latitude) == 0
                && Double.compare(longitude, that.longitude) == 0
                && Double.compare(altitude, that.altitude) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(latitude, longitude, altitude);
    }

    @Override
    public String toString() {
        return String.format("GeoPosition{lat=%.4f, lon=%.4f, alt=%.1fkm}",
            latitude, longitude, altitude);
    }
}
