package rollingplan.model;

import rollingplan.geometry.GeoPosition;

import java.io.Serializable;
import java.time.Instant;

/**
 * 轨迹采样点
 */
public class TrajectorySample implements Serializable {

    private static final long serialVersionUID = 1L;

    private final GeoPosition position;
    private final Instant time;

    public TrajectorySample(GeoPosition position, Instant time) {
        this.position = position;
        this.time = time;
    }

    public GeoPosition getPosition() {
        return position;
    }

    public Instant getTime() {
        return time;
    }

    @Override
    public String toString() {
        return "TrajectorySample{" + position + " @ " + time + '}';
    }
}
