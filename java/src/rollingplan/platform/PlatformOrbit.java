package rollingplan.platform;

import java.io.Serializable;

/**
 * 平台轨道参数
 *
 * 开普勒根数，历元为位置预报的参考时刻
 */
public class PlatformOrbit implements Serializable {

    private static final long serialVersionUID = 1L;

    private String platformId;
    private double semiMajorAxis;   // 米
    private double eccentricity;
    private double inclination;     // 度
    private double raan;            // 度
    private double argOfPerigee;    // 度
    private double meanAnomaly;     // 度

    public PlatformOrbit() {
    }

    public PlatformOrbit(String platformId, double semiMajorAxis, double eccentricity,
                         double inclination, double raan, double argOfPerigee,
                         double meanAnomaly) {
        this.platformId = platformId;
        this.semiMajorAxis = semiMajorAxis;
        this.eccentricity = eccentricity;
        this.inclination = inclination;
        this.raan = raan;
        this.argOfPerigee = argOfPerigee;
        this.meanAnomaly = meanAnomaly;
    }

    // Getters and Setters
    public String getPlatformId() {
        return platformId;
    }

    public void setPlatformId(String platformId) {
        this.platformId = platformId;
    }

    public double getSemiMajorAxis() {
        return semiMajorAxis;
    }

    public void setSemiMajorAxis(double semiMajorAxis) {
        this.semiMajorAxis = semiMajorAxis;
    }

    public double getEccentricity() {
        return eccentricity;
    }

    public void setEccentricity(double eccentricity) {
        this.eccentricity = eccentricity;
    }

    public double getInclination() {
        return inclination;
    }

    public void setInclination(double inclination) {
        this.inclination = inclination;
    }

    public double getRaan() {
        return raan;
    }

    public void setRaan(double raan) {
        this.raan = raan;
    }

    public double getArgOfPerigee() {
        return argOfPerigee;
    }

    public void setArgOfPerigee(double argOfPerigee) {
        this.argOfPerigee = argOfPerigee;
    }

    public double getMeanAnomaly() {
        return meanAnomaly;
    }

    public void setMeanAnomaly(double meanAnomaly) {
        this.meanAnomaly = meanAnomaly;
    }

    @Override
    public String toString() {
        return "PlatformOrbit{" +
                "platformId='" + platformId + '\'' +
                ", a=" + semiMajorAxis +
                ", e=" + eccentricity +
                ", i=" + inclination +
                ", raan=" + raan +
                ", omega=" + argOfPerigee +
                ", M=" + meanAnomaly +
                '}';
    }
}
