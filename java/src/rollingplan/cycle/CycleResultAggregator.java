package rollingplan.cycle;

import rollingplan.discussion.CompletionReason;
import rollingplan.discussion.MonitorReport;
import rollingplan.distribution.Assignment;
import rollingplan.geometry.GdopCalculator;
import rollingplan.geometry.GdopResult;
import rollingplan.geometry.GeoPosition;
import rollingplan.geometry.SphericalGeometry;
import rollingplan.model.Target;
import rollingplan.model.TrajectorySample;
import rollingplan.platform.PlatformPositionOracle;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * 周期结果汇总
 *
 * 平台摘要只使用监控结果中的结构化信息（参与平台、解散原因、是否被强制清理）。
 */
public class CycleResultAggregator {

    private static final Logger logger = Logger.getLogger(CycleResultAggregator.class.getName());

    private final PlatformPositionOracle positionOracle;
    private final GdopCalculator gdopCalculator;

    /**
     * @param positionOracle 平台位置（计算GDOP用），为null时不计算GDOP
     */
    public CycleResultAggregator(PlatformPositionOracle positionOracle) {
        this(positionOracle, new GdopCalculator());
    }

    public CycleResultAggregator(PlatformPositionOracle positionOracle, GdopCalculator gdopCalculator) {
        this.positionOracle = positionOracle;
        this.gdopCalculator = gdopCalculator;
    }

    /**
     * 汇总周期结果
     *
     * @param targets 本周期目标
     * @param assignment 分配结果
     * @param platformIds 本周期可用平台
     * @param monitorReport 讨论组等待结果
     * @param time 平台位置查询时刻
     * @return 结果
     */
    public CycleResults aggregate(List<Target> targets, Assignment assignment, Collection<String> platformIds,
                                  MonitorReport monitorReport, Instant time) {
        Map<String, PlatformSummary> summaries = summarize(assignment, platformIds, monitorReport);
        OptimizationMetrics metrics = computeMetrics(targets, assignment, platformIds, time);

        logger.info("结果汇总: " + summaries.size() + " 个平台, " + metrics);
        return new CycleResults(assignment, summaries, metrics, monitorReport);
    }

    private Map<String, PlatformSummary> summarize(Assignment assignment, Collection<String> platformIds,
                                                   MonitorReport monitorReport) {
        Map<String, PlatformSummary> summaries = new LinkedHashMap<>();
        Map<String, Set<String>> participants = monitorReport.getParticipants();

        Set<String> involved = new TreeSet<>(assignment.getPlatformIds());
        for (Set<String> members : participants.values()) {
            for (String member : members) {
                if (platformIds.contains(member)) {
                    involved.add(member);
                }
            }
        }

        for (String platformId : involved) {
            List<String> sessionIds = new ArrayList<>();
            boolean anyForced = false;
            boolean consensus = false;

            for (Map.Entry<String, Set<String>> entry : participants.entrySet()) {
                if (!entry.getValue().contains(platformId)) {
                    continue;
                }
                String sessionId = entry.getKey();
                sessionIds.add(sessionId);
                if (monitorReport.wasForceCleaned(sessionId)) {
                    anyForced = true;
                }
                CompletionReason reason = monitorReport.getReason(sessionId);
                if (reason != null && reason.isConsensus()) {
                    consensus = true;
                }
            }

            boolean discussionCompleted = !sessionIds.isEmpty() && !anyForced;
            summaries.put(platformId, new PlatformSummary(
                platformId,
                new ArrayList<>(assignment.getTargets(platformId)),
                sessionIds,
                discussionCompleted,
                consensus
            ));
        }
        return summaries;
    }

    /**
     * 计算优化指标
     *
     * GDOP：以目标轨迹上离所分配平台最近的点为观测点，所有平台当前位置为几何构型，
     * 平台不足4个或位置不可用时不计算。
     */
    OptimizationMetrics computeMetrics(List<Target> targets, Assignment assignment,
                                       Collection<String> platformIds, Instant time) {
        if (targets.isEmpty()) {
            return OptimizationMetrics.empty();
        }

        double coverage = (double) assignment.getAssignedCount() / targets.size();
        double utilization = platformIds.isEmpty()
            ? 0.0
            : (double) assignment.getPlatformIds().size() / platformIds.size();

        if (positionOracle == null || platformIds.size() < GdopCalculator.MIN_PLATFORMS) {
            return new OptimizationMetrics(coverage, utilization, null, 0);
        }

        Map<String, GeoPosition> positions = new LinkedHashMap<>();
        for (String platformId : new TreeSet<>(platformIds)) {
            GeoPosition position = positionOracle.positionOf(platformId, time);
            if (position != null) {
                positions.put(platformId, position);
            }
        }

        double gdopSum = 0.0;
        int samples = 0;
        for (Target target : targets) {
            GeoPosition observer = observationPoint(target, positions.get(assignment.getPlatformFor(target.getId())));
            if (observer == null) {
                continue;
            }
            GdopResult result = gdopCalculator.calculateGeodetic(new ArrayList<>(positions.values()), observer);
            if (result.isSuccess()) {
                gdopSum += result.getGdop();
                samples++;
            } else {
                logger.fine(() -> "目标 " + target.getId() + " GDOP计算失败: " + result.getErrorMessage());
            }
        }

        Double meanGdop = samples > 0 ? gdopSum / samples : null;
        return new OptimizationMetrics(coverage, utilization, meanGdop, samples);
    }

    /**
     * 目标轨迹上距平台最近的采样点；无平台时取发射点
     */
    private GeoPosition observationPoint(Target target, GeoPosition platformPosition) {
        if (platformPosition == null || target.getTrajectory().isEmpty()) {
            return target.getLaunchPosition();
        }
        GeoPosition closest = null;
        double closestDistance = Double.POSITIVE_INFINITY;
        for (TrajectorySample sample : target.getTrajectory()) {
            double distance = SphericalGeometry.sphericalDistance(sample.getPosition(), platformPosition);
            if (distance < closestDistance) {
                closestDistance = distance;
                closest = sample.getPosition();
            }
        }
        return closest;
    }
}
