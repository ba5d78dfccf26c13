package rollingplan.geometry;

import rollingplan.model.TrajectorySample;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * 基于距离阈值的可见窗口扫描
 *
 * 按时间顺序扫描目标轨迹，距离不超过阈值的连续采样点构成一个窗口。
 * 扫描结束时仍处于可见状态的窗口在最后一个采样点处关闭。
 */
public final class VisibilityScanner {

    /** 默认可见阈值（公里） */
    public static final double DEFAULT_THRESHOLD_KM = 2000.0;

    private VisibilityScanner() {
    }

    /**
     * 扫描可见窗口
     *
     * @param trajectory 按时间排序的轨迹采样点
     * @param platformPositionFn 平台位置函数（时间 → 位置）
     * @param thresholdKm 距离阈值（公里）
     * @return 窗口列表，按轨迹顺序排列；每次调用返回新列表
     */
    public static List<VisibilityWindow> visibilityWindows(
            List<TrajectorySample> trajectory,
            Function<Instant, GeoPosition> platformPositionFn,
            double thresholdKm) {
        return visibilityWindows(trajectory, platformPositionFn, thresholdKm, SphericalGeometry.EARTH_RADIUS_KM);
    }

    /**
     * 使用指定球体半径扫描可见窗口
     *
     * @param trajectory 按时间排序的轨迹采样点
     * @param platformPositionFn 平台位置函数（时间 → 位置）
     * @param thresholdKm 距离阈值（公里）
     * @param earthRadiusKm 球体半径（公里）
     * @return 窗口列表
     */
    public static List<VisibilityWindow> visibilityWindows(
            List<TrajectorySample> trajectory,
            Function<Instant, GeoPosition> platformPositionFn,
            double thresholdKm,
            double earthRadiusKm) {

        List<VisibilityWindow> windows = new ArrayList<>();
        if (trajectory == null || trajectory.isEmpty()) {
            return windows;
        }

        int windowStart = -1;
        double minInWindow = Double.POSITIVE_INFINITY;

        for (int i = 0; i < trajectory.size(); i++) {
            TrajectorySample sample = trajectory.get(i);
            double distance = SphericalGeometry.sphericalDistance(
                sample.getPosition(),
                platformPositionFn.apply(sample.getTime()),
                earthRadiusKm
            );
            boolean visible = distance <= thresholdKm;

            if (visible) {
                if (windowStart < 0) {
                    // 可见窗口开始
                    windowStart = i;
                    minInWindow = distance;
                } else {
                    minInWindow = Math.min(minInWindow, distance);
                }
            } else if (windowStart >= 0) {
                // 可见窗口结束
                windows.add(close(trajectory, windowStart, i - 1, minInWindow));
                windowStart = -1;
                minInWindow = Double.POSITIVE_INFINITY;
            }
        }

        // 处理最后一个窗口
        if (windowStart >= 0) {
            windows.add(close(trajectory, windowStart, trajectory.size() - 1, minInWindow));
        }

        return windows;
    }

    private static VisibilityWindow close(List<TrajectorySample> trajectory,
                                          int start, int end, double minDistance) {
        return new VisibilityWindow(
            start,
            end,
            trajectory.get(start).getTime(),
            trajectory.get(end).getTime(),
            minDistance
        );
    }
}
