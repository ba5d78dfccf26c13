package rollingplan.model;

import rollingplan.geometry.GeoPosition;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 探测到的运动目标
 *
 * 在一个规划周期内创建后不可变，归属于检测到它的周期。
 */
public class Target implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final GeoPosition launchPosition;
    private final GeoPosition impactPosition;
    private final Instant launchTime;
    private final double flightDurationSeconds;
    private final List<TrajectorySample> trajectory;
    private final double priority;
    private final String threatLevel;

    public Target(String id,
                  GeoPosition launchPosition,
                  GeoPosition impactPosition,
                  Instant launchTime,
                  double flightDurationSeconds,
                  List<TrajectorySample> trajectory,
                  double priority,
                  String threatLevel) {
        this.id = Objects.requireNonNull(id, "id");
        this.launchPosition = launchPosition;
        this.impactPosition = impactPosition;
        this.launchTime = Objects.requireNonNull(launchTime, "launchTime");
        this.flightDurationSeconds = flightDurationSeconds;
        this.priority = priority;
        this.threatLevel = threatLevel;

        // 轨迹按时间排序并拷贝，保证不可变
        List<TrajectorySample> samples = new ArrayList<>();
        if (trajectory != null) {
            samples.addAll(trajectory);
        }
        samples.sort(Comparator.comparing(TrajectorySample::getTime));
        this.trajectory = Collections.unmodifiableList(samples);
    }

    // Getters
    public String getId() {
        return id;
    }

    public GeoPosition getLaunchPosition() {
        return launchPosition;
    }

    public GeoPosition getImpactPosition() {
        return impactPosition;
    }

    public Instant getLaunchTime() {
        return launchTime;
    }

    public double getFlightDurationSeconds() {
        return flightDurationSeconds;
    }

    /**
     * 预计结束时间（发射时间 + 飞行时长）
     */
    public Instant getEstimatedEndTime() {
        return launchTime.plusMillis(Math.round(flightDurationSeconds * 1000.0));
    }

    public List<TrajectorySample> getTrajectory() {
        return trajectory;
    }

    public double getPriority() {
        return priority;
    }

    public String getThreatLevel() {
        return threatLevel;
    }

    @Override
    public String toString() {
        return "Target{" +
                "id='" + id + '\'' +
                ", launchTime=" + launchTime +
                ", flightDuration=" + flightDurationSeconds +
                ", samples=" + trajectory.size() +
                ", priority=" + priority +
                ", threatLevel='" + threatLevel + '\'' +
                '}';
    }
}
