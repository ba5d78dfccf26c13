package rollingplan.platform;

import rollingplan.geometry.GeoPosition;

import java.time.Instant;

/**
 * 平台位置预报（外部黑盒）
 */
public interface PlatformPositionOracle {

    /**
     * 获取平台在指定时刻的位置
     *
     * @param platformId 平台ID
     * @param time 时刻
     * @return 位置；未知平台返回null
     */
    GeoPosition positionOf(String platformId, Instant time);
}
