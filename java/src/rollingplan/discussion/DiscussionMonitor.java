package rollingplan.discussion;

import rollingplan.event.PlanningEvent;
import rollingplan.event.PlanningEventBus;
import rollingplan.helper.PlanningClock;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 讨论组生命周期监控
 *
 * 按固定间隔轮询外部托管的讨论组，对已完成的讨论组执行解散；
 * 超过最长等待时间后强制清理剩余讨论组。
 */
public class DiscussionMonitor {

    private static final Logger logger = Logger.getLogger(DiscussionMonitor.class.getName());

    private final SessionStore sessionStore;
    private final PlanningClock clock;
    private final CompletionPolicy completionPolicy;
    private final PlanningEventBus eventBus;

    // 正在等待中的讨论组，供停止/抢占时强制清理
    private final Set<String> trackedSessions = ConcurrentHashMap.newKeySet();

    public DiscussionMonitor(SessionStore sessionStore, PlanningClock clock) {
        this(sessionStore, clock, new CompletionPolicy(), new PlanningEventBus());
    }

    public DiscussionMonitor(SessionStore sessionStore, PlanningClock clock,
                             CompletionPolicy completionPolicy, PlanningEventBus eventBus) {
        this.sessionStore = sessionStore;
        this.clock = clock;
        this.completionPolicy = completionPolicy;
        this.eventBus = eventBus;
    }

    public MonitorReport awaitCompletion(Collection<String> activeSessionIds,
                                         Duration maxWait, Duration pollInterval) {
        return awaitCompletion(null, activeSessionIds, maxWait, pollInterval);
    }

    /**
     * 等待讨论组完成
     *
     * @param cycleId 所属周期ID（用于事件），可为null
     * @param activeSessionIds 需要等待的讨论组
     * @param maxWait 最长等待时间
     * @param pollInterval 轮询间隔
     * @return 等待结果；返回时所有讨论组均已解散或强制清理
     */
    public MonitorReport awaitCompletion(String cycleId, Collection<String> activeSessionIds,
                                         Duration maxWait, Duration pollInterval) {
        MonitorReport report = new MonitorReport();
        if (activeSessionIds == null || activeSessionIds.isEmpty()) {
            logger.info("没有活跃讨论组，无需等待");
            return report;
        }

        Set<String> remaining = new LinkedHashSet<>(activeSessionIds);
        for (String sessionId : remaining) {
            report.track(sessionId);
        }
        trackedSessions.addAll(remaining);

        Instant start = clock.now();
        logger.info(String.format("等待 %d 个讨论组完成, 最长等待: %ds, 检查间隔: %ds",
            remaining.size(), maxWait.getSeconds(), pollInterval.getSeconds()));

        try {
            while (Duration.between(start, clock.now()).compareTo(maxWait) < 0) {
                report.incrementPollCount();
                pollOnce(cycleId, remaining, report);

                if (remaining.isEmpty()) {
                    logger.info("所有讨论组已完成并解散");
                    break;
                }

                logProgress(cycleId, remaining, Duration.between(start, clock.now()));
                clock.sleep(pollInterval);
            }

            if (!remaining.isEmpty()) {
                logger.warning(String.format("等待超时，强制清理剩余 %d 个讨论组", remaining.size()));
                cleanup(cycleId, remaining, report);
            }
        } catch (InterruptedException e) {
            logger.warning("等待讨论组时被中断，强制清理剩余 " + remaining.size() + " 个讨论组");
            report.setInterrupted(true);
            cleanup(cycleId, remaining, report);
            Thread.currentThread().interrupt();
        } finally {
            trackedSessions.removeAll(report.getTrackedSessionIds());
            report.setElapsed(Duration.between(start, clock.now()));
        }

        logger.info(String.format("讨论组等待完成，总耗时: %.1fs, %s",
            report.getElapsed().toMillis() / 1000.0, report));
        return report;
    }

    /**
     * 一次轮询：判定并解散已完成的讨论组，从remaining中移除
     */
    private void pollOnce(String cycleId, Set<String> remaining, MonitorReport report) {
        Set<String> active = listActive();
        Instant now = clock.now();

        Iterator<String> it = remaining.iterator();
        while (it.hasNext()) {
            String sessionId = it.next();

            SessionProgress progress;
            try {
                progress = sessionStore.getProgress(sessionId);
            } catch (SessionStoreException | RuntimeException e) {
                // 出错时认为已完成，避免无限等待
                logger.log(Level.WARNING, "获取讨论组 " + sessionId + " 进度失败，视为已完成", e);
                it.remove();
                report.recordDissolved(sessionId, CompletionReason.PROGRESS_UNAVAILABLE);
                continue;
            }
            report.recordParticipants(sessionId, progress.getParticipants());

            if (progress.getStatus() == SessionStatus.FORCE_CLEANED) {
                it.remove();
                report.recordForceCleaned(sessionId);
                continue;
            }

            SessionAssessment assessment = completionPolicy.assess(progress, now);
            if (assessment.isCompleted()) {
                dissolve(sessionId, progress);
                it.remove();
                report.recordDissolved(sessionId, assessment.getReason());
                publish(PlanningEvent.DISCUSSION_DISSOLVED, cycleId, sessionPayload(progress, assessment.getReason()));
            } else if (active != null && !active.contains(sessionId)) {
                logger.info("讨论组 " + sessionId + " 已不在活跃列表中");
                it.remove();
                report.recordDissolved(sessionId, CompletionReason.CLOSED_EXTERNALLY);
            }
        }
    }

    private Set<String> listActive() {
        try {
            return new HashSet<>(sessionStore.listActiveSessions());
        } catch (SessionStoreException | RuntimeException e) {
            logger.log(Level.WARNING, "获取活跃讨论组失败", e);
            return null;
        }
    }

    /**
     * 解散讨论组（失败只记录，不重试）
     */
    private void dissolve(String sessionId, SessionProgress progress) {
        try {
            boolean success = sessionStore.completeSession(sessionId);
            if (success) {
                logger.info("讨论组 " + sessionId + " 已解散");
            } else if (!progress.getStatus().isTerminal()) {
                logger.warning("讨论组 " + sessionId + " 解散失败");
            }
        } catch (SessionStoreException | RuntimeException e) {
            logger.log(Level.SEVERE, "解散讨论组 " + sessionId + " 时出错", e);
        }
    }

    private void logProgress(String cycleId, Set<String> remaining, Duration elapsed) {
        List<String> summaries = new ArrayList<>();
        for (String sessionId : remaining) {
            try {
                summaries.add(sessionStore.getProgress(sessionId).summary());
            } catch (SessionStoreException | RuntimeException e) {
                logger.log(Level.FINE, "获取讨论组进度摘要失败: " + sessionId, e);
                summaries.add(sessionId + "(?)");
            }
        }

        logger.info(String.format("等待中... 剩余讨论组: %d, 已等待: %.1fs",
            remaining.size(), elapsed.toMillis() / 1000.0));
        logger.info("迭代进度: " + String.join(", ", summaries));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("remaining", remaining.size());
        payload.put("elapsedSeconds", elapsed.toMillis() / 1000.0);
        payload.put("sessions", summaries);
        publish(PlanningEvent.DISCUSSION_PROGRESS, cycleId, payload);
    }

    /**
     * 强制清理指定讨论组
     *
     * @param sessionIds 讨论组ID
     * @return 已清理的讨论组ID
     */
    public List<String> forceCleanup(Collection<String> sessionIds) {
        MonitorReport report = new MonitorReport();
        cleanup(null, new LinkedHashSet<>(sessionIds), report);
        return report.getForceCleanedSessionIds();
    }

    /**
     * 强制清理当前正在等待的所有讨论组（停止或抢占时调用）
     */
    public List<String> forceCleanupTracked() {
        List<String> snapshot = new ArrayList<>(trackedSessions);
        if (snapshot.isEmpty()) {
            return snapshot;
        }
        return forceCleanup(snapshot);
    }

    private void cleanup(String cycleId, Set<String> sessionIds, MonitorReport report) {
        if (sessionIds.isEmpty()) {
            return;
        }
        logger.warning("强制清理 " + sessionIds.size() + " 个讨论组");

        for (String sessionId : sessionIds) {
            try {
                sessionStore.completeSession(sessionId);
                logger.info("强制清理讨论组: " + sessionId);
            } catch (SessionStoreException | RuntimeException e) {
                logger.log(Level.SEVERE, "强制清理讨论组 " + sessionId + " 失败", e);
            }

            try {
                sessionStore.forceUpdateStatus(sessionId, SessionStatus.FORCE_CLEANED);
                sessionStore.removeSession(sessionId);
            } catch (SessionStoreException | RuntimeException e) {
                logger.log(Level.WARNING, "清理讨论组状态失败 " + sessionId, e);
            }

            report.recordForceCleaned(sessionId);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("sessionId", sessionId);
            payload.put("status", SessionStatus.FORCE_CLEANED.getWireName());
            publish(PlanningEvent.DISCUSSION_FORCE_CLEANED, cycleId, payload);
        }
        sessionIds.clear();
    }

    private Map<String, Object> sessionPayload(SessionProgress progress, CompletionReason reason) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sessionId", progress.getSessionId());
        payload.put("iteration", progress.getIteration());
        payload.put("maxIteration", progress.getMaxIteration());
        payload.put("quality", progress.getQuality());
        payload.put("reason", reason.name());
        return payload;
    }

    private void publish(String eventType, String cycleId, Map<String, Object> payload) {
        eventBus.publish(new PlanningEvent(eventType, cycleId, payload, clock.now()));
    }

    /**
     * 当前正在等待的讨论组
     */
    public Set<String> getTrackedSessions() {
        return new LinkedHashSet<>(trackedSessions);
    }

    public CompletionPolicy getCompletionPolicy() {
        return completionPolicy;
    }
}
