package rollingplan.cycle;

import rollingplan.discussion.CompletionPolicy;
import rollingplan.discussion.DiscussionMonitor;
import rollingplan.discussion.MonitorConfig;
import rollingplan.discussion.MonitorReport;
import rollingplan.discussion.SessionStore;
import rollingplan.discussion.SessionStoreException;
import rollingplan.distribution.Assignment;
import rollingplan.distribution.NoPlatformsRegisteredException;
import rollingplan.distribution.TaskDistributor;
import rollingplan.event.PlanningEvent;
import rollingplan.event.PlanningEventBus;
import rollingplan.helper.PlanningClock;
import rollingplan.model.PlanningException;
import rollingplan.model.Target;
import rollingplan.platform.PlatformHandle;
import rollingplan.platform.PlatformRegistry;
import rollingplan.report.PlanningGanttData;
import rollingplan.report.ReportSink;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 滚动任务规划周期管理器
 *
 * 负责：
 * 1. 管理规划周期的生命周期和状态转换
 * 2. 同一时刻只有一个周期在执行，新周期开始前强制完成未结束的旧周期
 * 3. 依次执行收集目标、分发任务、等待讨论、收集结果、生成报告各阶段
 *
 * 停止或抢占只在阶段边界生效：阶段执行者发现周期已终止时直接退出，不覆盖状态。
 */
public class RollingPlanningCycleManager implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(RollingPlanningCycleManager.class.getName());

    private final PlatformRegistry platformRegistry;
    private final TaskDistributor distributor;
    private final SessionStore sessionStore;
    private final DiscussionMonitor monitor;
    private final CycleResultAggregator aggregator;
    private final ReportSink reportSink;
    private final MetaTaskGenerator metaTaskGenerator;
    private final PlanningClock clock;
    private final PlanningEventBus eventBus;
    private final CycleConfig cycleConfig;
    private final MonitorConfig monitorConfig;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger cycleCounter = new AtomicInteger(0);
    private final List<CycleInfo> cycleHistory = new CopyOnWriteArrayList<>();
    private final ExecutorService cycleExecutor;

    private volatile CycleInfo currentCycle;
    private volatile Instant lastCycleStartTime;
    private volatile String reportSessionId;

    private RollingPlanningCycleManager(Builder builder) {
        this.platformRegistry = Objects.requireNonNull(builder.platformRegistry, "platformRegistry");
        this.distributor = Objects.requireNonNull(builder.distributor, "distributor");
        this.sessionStore = Objects.requireNonNull(builder.sessionStore, "sessionStore");
        this.clock = builder.clock != null ? builder.clock : PlanningClock.system();
        this.eventBus = builder.eventBus != null ? builder.eventBus : new PlanningEventBus();
        this.monitor = builder.monitor != null
            ? builder.monitor
            : new DiscussionMonitor(sessionStore, clock, new CompletionPolicy(), eventBus);
        this.aggregator = builder.aggregator != null ? builder.aggregator : new CycleResultAggregator(null);
        this.reportSink = builder.reportSink;
        this.metaTaskGenerator = builder.metaTaskGenerator;
        this.cycleConfig = builder.cycleConfig != null ? builder.cycleConfig : new CycleConfig();
        this.monitorConfig = builder.monitorConfig != null ? builder.monitorConfig : new MonitorConfig();
        this.cycleExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "rolling-planning-cycle");
            thread.setDaemon(true);
            return thread;
        });

        logger.info("滚动任务规划周期管理器初始化完成: " + cycleConfig + ", " + monitorConfig);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 启动滚动规划
     *
     * @return false 表示已在运行中
     */
    public boolean start() {
        if (!running.compareAndSet(false, true)) {
            logger.warning("滚动规划已在运行中");
            return false;
        }
        lastCycleStartTime = null;

        logger.info("启动滚动任务规划");
        logger.info("   规划间隔: " + cycleConfig.getPlanningInterval().getSeconds() + "s");
        logger.info("   最大周期数: " + cycleConfig.getMaxPlanningCycles());
        return true;
    }

    /**
     * 检查并执行规划周期
     *
     * @param detectedTargets 本次检测到的目标
     * @return 执行的周期；未运行、未到规划时间或达到最大周期数时为空
     */
    public Optional<CycleInfo> checkAndExecuteCycle(List<Target> detectedTargets) {
        if (!running.get()) {
            logger.warning("滚动规划未启动");
            return Optional.empty();
        }

        Instant now = clock.now();
        Instant lastStart = lastCycleStartTime;
        if (lastStart != null && now.isBefore(lastStart.plus(cycleConfig.getPlanningInterval()))) {
            return Optional.empty();
        }

        if (cycleCounter.get() >= cycleConfig.getMaxPlanningCycles()) {
            logger.info("达到最大规划周期数 " + cycleConfig.getMaxPlanningCycles() + "，停止滚动规划");
            stop();
            return Optional.empty();
        }

        // 确保当前没有活跃的规划周期
        CycleInfo previous = currentCycle;
        if (previous != null && !previous.getState().isTerminal()) {
            logger.warning("当前规划周期 " + previous.getCycleId() + " 尚未完成，强制完成");
            forceCompleteCycle(previous);
        }

        // 等待被抢占的周期退出当前阶段
        cycleLock.lock();
        try {
            if (!running.get()) {
                return Optional.empty();
            }
            if (cycleCounter.get() >= cycleConfig.getMaxPlanningCycles()) {
                logger.info("达到最大规划周期数 " + cycleConfig.getMaxPlanningCycles() + "，停止滚动规划");
                stop();
                return Optional.empty();
            }

            int cycleNumber = cycleCounter.incrementAndGet();
            Instant startTime = clock.now();
            CycleInfo cycle = new CycleInfo(cycleNumber, startTime,
                detectedTargets == null ? Collections.emptyList() : detectedTargets);
            currentCycle = cycle;
            lastCycleStartTime = startTime;

            executeCycle(cycle);
            return Optional.of(cycle);
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * 在周期线程上异步执行 {@link #checkAndExecuteCycle}，不阻塞检测数据输入
     */
    public CompletableFuture<Optional<CycleInfo>> submitCycle(List<Target> detectedTargets) {
        try {
            return CompletableFuture.supplyAsync(() -> checkAndExecuteCycle(detectedTargets), cycleExecutor);
        } catch (RejectedExecutionException e) {
            logger.log(Level.WARNING, "周期执行器已关闭，忽略本次检测", e);
            return CompletableFuture.completedFuture(Optional.empty());
        }
    }

    private void executeCycle(CycleInfo cycle) {
        logger.info(String.format("开始执行规划周期 %d: %s", cycle.getCycleNumber(), cycle.getCycleId()));
        logger.info("   检测到目标数量: " + cycle.getDetectedTargets().size());
        publishState(cycle);

        boolean success;
        try {
            success = executeCyclePhases(cycle);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "执行规划周期阶段时发生未预期异常", e);
            cycle.fail(e.toString(), clock.now());
            success = false;
        }

        if (success) {
            if (cycle.complete(clock.now())) {
                logger.info("规划周期 " + cycle.getCycleNumber() + " 执行完成");
            } else {
                logger.info("规划周期 " + cycle.getCycleNumber() + " 已被提前结束: " + cycle.getState());
            }
        } else if (cycle.getState() == PlanningCycleState.ERROR) {
            logger.severe("规划周期 " + cycle.getCycleNumber() + " 执行失败: " + cycle.getErrorMessage());
        }

        publishState(cycle);
        archive(cycle);
    }

    /**
     * 执行规划周期的各个阶段
     *
     * @return 是否成功（被抢占而提前退出也返回true）
     */
    private boolean executeCyclePhases(CycleInfo cycle) {
        String phase = "collecting_targets";
        boolean dispatched = false;
        boolean monitored = false;
        try {
            // 阶段1: 收集目标
            if (!enterPhase(cycle, PlanningCycleState.COLLECTING_TARGETS)) {
                return true;
            }
            logger.info("阶段1: 收集目标 - 周期 " + cycle.getCycleNumber());
            List<Target> targets = cycle.getDetectedTargets();
            if (targets.isEmpty()) {
                logger.info("未检测到目标，跳过本周期");
                return true;
            }
            generateMetaTasks(cycle, targets);

            // 阶段2: 分发任务
            phase = "distributing_tasks";
            if (!enterPhase(cycle, PlanningCycleState.DISTRIBUTING_TASKS)) {
                return true;
            }
            logger.info("阶段2: 分发任务 - 周期 " + cycle.getCycleNumber());
            Map<String, PlatformHandle> platforms = platformRegistry.getAllPlatforms();
            if (platforms == null || platforms.isEmpty()) {
                throw new NoPlatformsRegisteredException("未找到可用的平台");
            }
            dispatched = true;
            Assignment assignment = distributor.distribute(targets, platforms);
            cycle.setAssignment(assignment);

            // 阶段3: 等待讨论组完成
            phase = "discussing";
            if (!enterPhase(cycle, PlanningCycleState.DISCUSSING)) {
                return true;
            }
            logger.info("阶段3: 等待讨论组完成 - 周期 " + cycle.getCycleNumber());
            MonitorReport monitorReport = monitor.awaitCompletion(
                cycle.getCycleId(),
                listActiveSessions(),
                monitorConfig.computeMaxWait(),
                monitorConfig.getPollInterval()
            );
            monitored = true;
            if (monitorReport.isInterrupted()) {
                cycle.fail("讨论组等待被中断", clock.now());
                return false;
            }

            // 阶段4: 收集结果
            phase = "gathering_results";
            if (!enterPhase(cycle, PlanningCycleState.GATHERING_RESULTS)) {
                return true;
            }
            logger.info("阶段4: 收集结果 - 周期 " + cycle.getCycleNumber());
            cycle.setResults(aggregator.aggregate(
                targets, assignment, platforms.keySet(), monitorReport, clock.now()));

            // 阶段5: 生成报告
            phase = "generating_reports";
            if (!enterPhase(cycle, PlanningCycleState.GENERATING_REPORTS)) {
                return true;
            }
            logger.info("阶段5: 生成甘特图 - 周期 " + cycle.getCycleNumber());
            generateReports(cycle);

            return true;

        } catch (Exception e) {
            logger.log(Level.SEVERE, "执行规划周期阶段 " + phase + " 失败", e);
            cycle.fail(e.getMessage() != null ? e.getMessage() : e.toString(), clock.now());
            return false;
        } finally {
            if (dispatched && !monitored) {
                cleanupUnmonitoredSessions(cycle);
            }
        }
    }

    /**
     * 清理分发后未进入监控的讨论组
     *
     * 周期在分发期间被抢占或停止时，平台仍可能在强制清理之后打开讨论组，
     * 必须在释放周期锁之前清理，否则下一周期会接管这些讨论组
     */
    private void cleanupUnmonitoredSessions(CycleInfo cycle) {
        List<String> leftover = listActiveSessions();
        if (leftover.isEmpty()) {
            return;
        }
        logger.warning("周期 " + cycle.getCycleId() + " 未监控讨论组即终止，强制清理 "
            + leftover.size() + " 个遗留讨论组");
        monitor.forceCleanup(leftover);
    }

    private boolean enterPhase(CycleInfo cycle, PlanningCycleState phase) {
        if (!cycle.enterPhase(phase)) {
            logger.info("周期 " + cycle.getCycleId() + " 已终止 (" + cycle.getState() + ")，停止执行后续阶段");
            return false;
        }
        publishState(cycle);
        return true;
    }

    private List<String> listActiveSessions() {
        try {
            return sessionStore.listActiveSessions();
        } catch (SessionStoreException e) {
            logger.log(Level.WARNING, "获取活跃讨论组失败，跳过等待", e);
            return Collections.emptyList();
        }
    }

    /**
     * 生成元任务集（失败只记录）
     */
    private void generateMetaTasks(CycleInfo cycle, List<Target> targets) {
        if (metaTaskGenerator == null) {
            logger.fine("元任务生成器未设置，跳过元任务集生成");
            return;
        }
        try {
            logger.info("为 " + targets.size() + " 个目标生成元任务集");
            MetaTaskReference reference = metaTaskGenerator.generate(cycle.getCycleId(), cycle.getStartTime(), targets);
            if (reference != null) {
                cycle.getMetadata().setMetaTask(reference);
                logger.info("成功生成元任务集: " + reference);
            } else {
                logger.warning("元任务集生成失败，继续使用原始目标数据");
            }
        } catch (PlanningException | RuntimeException e) {
            logger.log(Level.WARNING, "生成元任务集失败，继续使用原始目标数据", e);
        }
    }

    /**
     * 生成和保存甘特图（失败只记录，不影响周期结果）
     */
    private void generateReports(CycleInfo cycle) {
        if (reportSink == null || !cycleConfig.isGenerateReports()) {
            return;
        }

        Map<String, Object> ganttData;
        try {
            ganttData = PlanningGanttData.build(
                cycle.getCycleId(),
                cycle.getCycleNumber(),
                cycle.getStartTime(),
                cycle.getEndTime(),
                cycle.getAssignment(),
                cycle.getDetectedTargets(),
                clock.now()
            );
            if (ganttData == null) {
                return;
            }

            String sessionId = ensureReportSession();
            cycle.getMetadata().setReportSessionId(sessionId);

            Path dataFile = reportSink.saveData(ganttData, "planning_cycle_" + cycle.getCycleNumber());
            cycle.getMetadata().putReportFile(CycleMetadata.PLANNING_DATA, dataFile.toString());
        } catch (IOException | RuntimeException e) {
            logger.log(Level.WARNING, "保存规划数据失败", e);
            return;
        }

        try {
            Path chartFile = reportSink.renderChart(ganttData);
            cycle.getMetadata().putReportFile(CycleMetadata.PLANNING_CHART, chartFile.toString());
            logger.info("甘特图已保存: " + cycle.getMetadata().getReportFiles().size() + " 个文件");
        } catch (IOException | RuntimeException e) {
            logger.log(Level.WARNING, "甘特图生成失败", e);
        }
    }

    private synchronized String ensureReportSession() throws IOException {
        if (reportSessionId == null) {
            reportSessionId = reportSink.createSession(cycleConfig.getReportSessionName());
            logger.info("创建甘特图会话: " + reportSessionId);
        }
        return reportSessionId;
    }

    /**
     * 强制完成规划周期并清理其讨论组
     */
    private void forceCompleteCycle(CycleInfo cycle) {
        if (!cycle.forceComplete(clock.now())) {
            return;
        }
        logger.warning("强制完成规划周期: " + cycle.getCycleId());

        List<String> cleaned = new ArrayList<>(monitor.forceCleanupTracked());
        List<String> remaining = new ArrayList<>(listActiveSessions());
        remaining.removeAll(cleaned);
        if (!remaining.isEmpty()) {
            cleaned.addAll(monitor.forceCleanup(remaining));
        }
        if (!cleaned.isEmpty()) {
            logger.info("已关闭周期 " + cycle.getCycleId() + " 的 " + cleaned.size() + " 个讨论组");
        }

        publishState(cycle);
        archive(cycle);
    }

    /**
     * 停止滚动规划：强制完成当前周期，关闭所有讨论组，不再接受新周期
     */
    public void stop() {
        logger.info("停止滚动任务规划");
        running.set(false);

        CycleInfo cycle = currentCycle;
        if (cycle != null && !cycle.getState().isTerminal()) {
            forceCompleteCycle(cycle);
        } else {
            List<String> open = listActiveSessions();
            if (!open.isEmpty()) {
                monitor.forceCleanup(open);
            }
        }

        logger.info("滚动规划统计:");
        logger.info("   总周期数: " + cycleCounter.get());
        logger.info("   成功周期: " + countHistory(PlanningCycleState.COMPLETED));
        logger.info("   失败周期: " + countHistory(PlanningCycleState.ERROR));
    }

    /**
     * 停止并关闭周期执行器
     */
    @Override
    public void close() {
        stop();
        cycleExecutor.shutdown();
        try {
            if (!cycleExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cycleExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cycleExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void archive(CycleInfo cycle) {
        if (cycle.markArchived()) {
            cycleHistory.add(cycle);
        }
    }

    private void publishState(CycleInfo cycle) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("cycleNumber", cycle.getCycleNumber());
        payload.put("state", cycle.getState().getWireName());
        if (cycle.getErrorMessage() != null) {
            payload.put("error", cycle.getErrorMessage());
        }
        eventBus.publish(new PlanningEvent(PlanningEvent.CYCLE_STATE, cycle.getCycleId(), payload, clock.now()));
    }

    private long countHistory(PlanningCycleState state) {
        return cycleHistory.stream().filter(c -> c.getState() == state).count();
    }

    public boolean isRunning() {
        return running.get();
    }

    public Optional<CycleInfo> getCurrentCycle() {
        return Optional.ofNullable(currentCycle);
    }

    public int getCycleCounter() {
        return cycleCounter.get();
    }

    /**
     * 周期历史（按结束顺序，每个周期只出现一次）
     */
    public List<CycleInfo> getCycleHistory() {
        return Collections.unmodifiableList(new ArrayList<>(cycleHistory));
    }

    public PlanningEventBus getEventBus() {
        return eventBus;
    }

    public CycleConfig getCycleConfig() {
        return cycleConfig;
    }

    /**
     * 周期管理器构建器
     */
    public static class Builder {

        private PlatformRegistry platformRegistry;
        private TaskDistributor distributor;
        private SessionStore sessionStore;
        private DiscussionMonitor monitor;
        private CycleResultAggregator aggregator;
        private ReportSink reportSink;
        private MetaTaskGenerator metaTaskGenerator;
        private PlanningClock clock;
        private PlanningEventBus eventBus;
        private CycleConfig cycleConfig;
        private MonitorConfig monitorConfig;

        private Builder() {
        }

        public Builder platformRegistry(PlatformRegistry platformRegistry) {
            this.platformRegistry = platformRegistry;
            return this;
        }

        public Builder distributor(TaskDistributor distributor) {
            this.distributor = distributor;
            return this;
        }

        public Builder sessionStore(SessionStore sessionStore) {
            this.sessionStore = sessionStore;
            return this;
        }

        /**
         * 讨论组监控；未设置时使用会话存储、时钟和事件通道构建默认监控
         */
        public Builder monitor(DiscussionMonitor monitor) {
            this.monitor = monitor;
            return this;
        }

        public Builder aggregator(CycleResultAggregator aggregator) {
            this.aggregator = aggregator;
            return this;
        }

        public Builder reportSink(ReportSink reportSink) {
            this.reportSink = reportSink;
            return this;
        }

        public Builder metaTaskGenerator(MetaTaskGenerator metaTaskGenerator) {
            this.metaTaskGenerator = metaTaskGenerator;
            return this;
        }

        public Builder clock(PlanningClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder eventBus(PlanningEventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        public Builder cycleConfig(CycleConfig cycleConfig) {
            this.cycleConfig = cycleConfig;
            return this;
        }

        public Builder monitorConfig(MonitorConfig monitorConfig) {
            this.monitorConfig = monitorConfig;
            return this;
        }

        public RollingPlanningCycleManager build() {
            return new RollingPlanningCycleManager(this);
        }
    }
}
