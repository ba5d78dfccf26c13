package rollingplan.distribution;

import rollingplan.geometry.DistanceStatistics;
import rollingplan.geometry.GeoPosition;
import rollingplan.geometry.SphericalGeometry;
import rollingplan.geometry.VisibilityScanner;
import rollingplan.geometry.VisibilityWindow;
import rollingplan.helper.PlanningClock;
import rollingplan.model.Target;
import rollingplan.model.TrackingTask;
import rollingplan.model.TrajectorySample;
import rollingplan.platform.DispatchException;
import rollingplan.platform.PlatformHandle;
import rollingplan.platform.PlatformPositionOracle;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 基于距离的任务分发器
 *
 * 负责：
 * 1. 计算所有目标到所有平台的距离矩阵（可并行、分批）
 * 2. 按置信度加权距离为每个目标选择最近的平台
 * 3. 将任务逐个发送给平台（尽力而为，失败只记录不重试）
 */
public class DistanceBasedTaskDistributor implements TaskDistributor {

    private static final Logger logger = Logger.getLogger(DistanceBasedTaskDistributor.class.getName());

    private final PlatformPositionOracle positionOracle;
    private final PlanningClock clock;
    private final DistributionConfig config;

    private volatile DistributionReport lastReport = new DistributionReport();

    public DistanceBasedTaskDistributor(PlatformPositionOracle positionOracle, PlanningClock clock) {
        this(positionOracle, clock, new DistributionConfig());
    }

    public DistanceBasedTaskDistributor(PlatformPositionOracle positionOracle,
                                        PlanningClock clock,
                                        DistributionConfig config) {
        this.positionOracle = positionOracle;
        this.clock = clock;
        this.config = config;
    }

    /**
     * 将目标分发给最近的平台（主入口）
     *
     * @param targets 目标列表
     * @param platforms 平台ID到平台引用的映射
     * @return 分配结果
     * @throws NoPlatformsRegisteredException 没有平台
     */
    @Override
    public Assignment distribute(List<Target> targets, Map<String, PlatformHandle> platforms)
            throws NoPlatformsRegisteredException {

        if (platforms == null || platforms.isEmpty()) {
            throw new NoPlatformsRegisteredException("没有已注册的平台，无法分发任务");
        }

        DistributionReport report = new DistributionReport();
        if (targets == null || targets.isEmpty()) {
            logger.warning("目标列表为空，跳过分发");
            report.setCounts(0, platforms.size(), 0);
            lastReport = report;
            return Assignment.empty();
        }

        long startNs = System.nanoTime();
        logger.info(String.format("开始分发 %d 个目标到 %d 个平台", targets.size(), platforms.size()));

        // 1. 距离矩阵（平台按ID升序）
        Set<String> platformIds = new TreeSet<>(platforms.keySet());
        DistanceMatrix matrix = buildDistanceMatrix(targets, platformIds, clock.now(), report);

        // 2. 基于距离优势分配
        Assignment assignment = assign(targets, matrix);
        logDistributionResults(assignment);

        // 3. 发送任务
        dispatchTasks(assignment, targets, platforms, report);

        report.setCounts(targets.size(), platformIds.size(), targets.size() * platformIds.size());
        report.setAssignmentCounts(assignment.getAssignedCount(), assignment.getUnassignedTargetIds().size());
        report.setComputationTimeMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs));
        lastReport = report;

        logger.info("分发完成: " + report);
        return assignment;
    }

    /**
     * 计算距离矩阵
     *
     * @param targets 目标列表
     * @param platformIds 平台ID
     * @param time 平台位置的查询时刻
     * @return 距离矩阵
     */
    public DistanceMatrix buildDistanceMatrix(List<Target> targets, Collection<String> platformIds, Instant time) {
        return buildDistanceMatrix(targets, new TreeSet<>(platformIds), time, new DistributionReport());
    }

    private DistanceMatrix buildDistanceMatrix(List<Target> targets, Set<String> platformIds,
                                               Instant time, DistributionReport report) {
        DistanceMatrix matrix = new DistanceMatrix();
        for (Target target : targets) {
            matrix.addRow(target.getId());
        }
        if (platformIds.isEmpty()) {
            return matrix;
        }

        int pairs = targets.size() * platformIds.size();
        if (config.isUseParallel() && pairs > 1) {
            computeParallel(targets, platformIds, time, report, matrix);
        } else {
            computeSequential(targets, platformIds, time, report, matrix);
        }

        logger.info(String.format("完成距离矩阵计算: %d×%d", targets.size(), platformIds.size()));
        return matrix;
    }

    /**
     * 串行计算
     */
    private void computeSequential(List<Target> targets, Set<String> platformIds, Instant time,
                                   DistributionReport report, DistanceMatrix matrix) {
        for (Target target : targets) {
            for (String platformId : platformIds) {
                matrix.put(computeSafely(target, platformId, time, report));
            }
        }
    }

    /**
     * 并行计算（按批次提交，每批最多 maxBatchSize 个目标）
     */
    private void computeParallel(List<Target> targets, Set<String> platformIds, Instant time,
                                 DistributionReport report, DistanceMatrix matrix) {
        int pairs = targets.size() * platformIds.size();
        int threads = config.getParallelism() > 0
            ? config.getParallelism()
            : Math.min(pairs, Runtime.getRuntime().availableProcessors());
        int batchSize = Math.max(1, config.getMaxBatchSize());

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, threads));
        try {
            for (int from = 0; from < targets.size(); from += batchSize) {
                List<Target> batch = targets.subList(from, Math.min(targets.size(), from + batchSize));

                List<Future<DistanceResult>> futures = new ArrayList<>();
                for (Target target : batch) {
                    for (String platformId : platformIds) {
                        futures.add(executor.submit(() -> computeSafely(target, platformId, time, report)));
                    }
                }

                // 等待本批完成
                for (Future<DistanceResult> f : futures) {
                    try {
                        matrix.put(f.get());
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new IllegalStateException("Distance matrix computation interrupted", e);
                    } catch (ExecutionException e) {
                        throw new IllegalStateException("Distance matrix computation failed", e.getCause());
                    }
                }
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private DistanceResult computeSafely(Target target, String platformId, Instant time,
                                         DistributionReport report) {
        try {
            return computeDistance(target, platformId, time, report);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "计算目标 " + target.getId() + " 与平台 " + platformId + " 距离失败", e);
            report.addError(target.getId(), platformId,
                DistributionReport.DistributionError.COMPUTATION_ERROR, e.getMessage());
            return DistanceResult.unreachable(target.getId(), platformId, time);
        }
    }

    /**
     * 计算单个目标与平台的距离
     */
    private DistanceResult computeDistance(Target target, String platformId, Instant time,
                                           DistributionReport report) {
        Function<Instant, GeoPosition> platformPosition;
        if (config.isTrackPlatformMotion()) {
            platformPosition = t -> positionOracle.positionOf(platformId, t);
        } else {
            GeoPosition snapshot = positionOracle.positionOf(platformId, time);
            if (snapshot == null) {
                logger.warning("无法获取平台 " + platformId + " 的位置");
                report.addError(target.getId(), platformId,
                    DistributionReport.DistributionError.POSITION_UNAVAILABLE, "position unavailable");
                return DistanceResult.unreachable(target.getId(), platformId, time);
            }
            platformPosition = t -> snapshot;
        }

        List<TrajectorySample> trajectory = target.getTrajectory();
        List<Double> distances = new ArrayList<>(trajectory.size());
        double closestDistance = Double.POSITIVE_INFINITY;
        Instant closestTime = time;

        for (TrajectorySample sample : trajectory) {
            double distance = SphericalGeometry.sphericalDistance(
                sample.getPosition(),
                platformPosition.apply(sample.getTime()),
                config.getEarthRadiusKm()
            );
            distances.add(distance);

            if (distance < closestDistance) {
                closestDistance = distance;
                closestTime = sample.getTime();
            }
        }

        List<VisibilityWindow> windows = VisibilityScanner.visibilityWindows(
            trajectory, platformPosition, config.getVisibilityThresholdKm(), config.getEarthRadiusKm()
        );

        DistanceResult result = new DistanceResult(
            target.getId(),
            platformId,
            closestDistance,
            DistanceStatistics.mean(distances),
            closestTime,
            windows,
            DistanceStatistics.confidence(distances, windows)
        );
        logger.fine(() -> "距离计算: " + result);
        return result;
    }

    /**
     * 基于置信度加权距离执行分配
     *
     * 得分 = 最小距离 × (2 − 置信度)。平台按ID升序遍历，得分相同时ID最小的平台胜出。
     *
     * @param targets 目标列表
     * @param matrix 距离矩阵
     * @return 分配结果
     */
    public Assignment assign(List<Target> targets, DistanceMatrix matrix) {
        Assignment assignment = new Assignment();

        for (Target target : targets) {
            String targetId = target.getId();
            Map<String, DistanceResult> row = matrix.getRow(targetId);

            if (row.isEmpty()) {
                logger.warning("目标 " + targetId + " 未找到距离计算结果");
                assignment.markUnassigned(targetId);
                continue;
            }

            String bestPlatformId = null;
            double bestScore = Double.POSITIVE_INFINITY;
            double bestConfidence = 0.0;

            for (Map.Entry<String, DistanceResult> entry : row.entrySet()) {
                double score = entry.getValue().getWeightedScore();
                if (score < bestScore) {
                    bestScore = score;
                    bestPlatformId = entry.getKey();
                    bestConfidence = entry.getValue().getConfidence();
                }
            }

            if (bestPlatformId == null) {
                logger.warning("目标 " + targetId + " 没有可用平台（所有得分均为无穷大）");
                assignment.markUnassigned(targetId);
                continue;
            }

            assignment.assign(bestPlatformId, targetId);
            logger.info(String.format("目标 %s 分配给平台 %s (得分: %.2fkm, 置信度: %.2f)",
                targetId, bestPlatformId, bestScore, bestConfidence));
        }

        return assignment;
    }

    /**
     * 记录分发结果
     */
    private void logDistributionResults(Assignment assignment) {
        logger.info("分发结果统计:");
        logger.info("   已分配目标数: " + assignment.getAssignedCount());
        logger.info("   参与平台数: " + assignment.getPlatformIds().size());
        for (Map.Entry<String, Set<String>> entry : assignment.asMap().entrySet()) {
            logger.info(String.format("   平台 %s: %d 个目标 %s",
                entry.getKey(), entry.getValue().size(), entry.getValue()));
        }
        if (!assignment.getUnassignedTargetIds().isEmpty()) {
            logger.warning("   未分配目标: " + assignment.getUnassignedTargetIds());
        }
    }

    /**
     * 将任务发送给平台
     */
    private void dispatchTasks(Assignment assignment, List<Target> targets,
                               Map<String, PlatformHandle> platforms, DistributionReport report) {
        Map<String, Target> targetsById = new LinkedHashMap<>();
        for (Target target : targets) {
            targetsById.put(target.getId(), target);
        }

        for (Map.Entry<String, Set<String>> entry : assignment.asMap().entrySet()) {
            String platformId = entry.getKey();
            PlatformHandle platform = platforms.get(platformId);

            for (String targetId : entry.getValue()) {
                report.incrementDispatchAttempts();
                if (platform == null) {
                    logger.warning("未找到平台: " + platformId);
                    report.addError(targetId, platformId,
                        DistributionReport.DistributionError.DISPATCH_ERROR, "platform not found");
                    continue;
                }

                Target target = targetsById.get(targetId);
                try {
                    TrackingTask task = TrackingTask.forTarget(target, platformId);
                    logger.info("发送任务 " + task.getTaskId() + " 给平台 " + platformId);
                    platform.receiveTask(task, target);
                } catch (DispatchException | RuntimeException e) {
                    logger.log(Level.WARNING, "发送任务给平台 " + platformId + " 失败", e);
                    report.addError(targetId, platformId,
                        DistributionReport.DistributionError.DISPATCH_ERROR, e.getMessage());
                }
            }
        }
    }

    /**
     * 最近一次分发的统计信息
     */
    public DistributionReport getLastReport() {
        return lastReport;
    }

    public DistributionConfig getConfig() {
        return config;
    }
}
