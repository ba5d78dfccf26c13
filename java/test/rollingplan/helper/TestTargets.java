package rollingplan.helper;

import rollingplan.geometry.GeoPosition;
import rollingplan.model.Target;
import rollingplan.model.TrajectorySample;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 测试用目标构造
 */
public final class TestTargets {

    public static final Instant EPOCH = Instant.parse("2025-07-01T00:00:00Z");

    private TestTargets() {
    }

    /**
     * 轨迹采样间隔60秒的目标，采样点依次为给定位置
     */
    public static Target target(String id, GeoPosition... samples) {
        return target(id, EPOCH, samples);
    }

    public static Target target(String id, Instant launchTime, GeoPosition... samples) {
        List<TrajectorySample> trajectory = trajectory(launchTime, samples);
        double flightSeconds = Math.max(60.0, 60.0 * (samples.length - 1));
        return new Target(
            id,
            samples[0],
            samples[samples.length - 1],
            launchTime,
            flightSeconds,
            trajectory,
            1.0,
            "medium"
        );
    }

    public static List<TrajectorySample> trajectory(Instant start, GeoPosition... samples) {
        List<TrajectorySample> trajectory = new ArrayList<>();
        for (int i = 0; i < samples.length; i++) {
            trajectory.add(new TrajectorySample(samples[i], start.plusSeconds(60L * i)));
        }
        return trajectory;
    }
}
