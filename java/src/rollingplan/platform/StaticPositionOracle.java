package rollingplan.platform;

import rollingplan.geometry.GeoPosition;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 固定位置预报：平台位置不随时间变化
 */
public class StaticPositionOracle implements PlatformPositionOracle {

    private final Map<String, GeoPosition> positions = new ConcurrentHashMap<>();

    public StaticPositionOracle() {
    }

    public StaticPositionOracle(Map<String, GeoPosition> positions) {
        this.positions.putAll(positions);
    }

    public void setPosition(String platformId, GeoPosition position) {
        positions.put(platformId, position);
    }

    @Override
    public GeoPosition positionOf(String platformId, Instant time) {
        return positions.get(platformId);
    }
}
