package rollingplan.discussion;

import rollingplan.helper.PlanningClock;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * 内存会话存储
 *
 * 活跃登记与状态表分开保存：讨论组从活跃登记中移除后，最终状态仍可查询。
 * 平台运行时通过 {@link #openSession} 和 {@link #recordIteration} 上报讨论进度。
 * 状态表只在 {@link #purgeSession} 或 {@link #purgeFinished} 时缩小，长期运行的调用方需定期清除。
 */
public class InMemorySessionStore implements SessionStore {

    private static final Logger logger = Logger.getLogger(InMemorySessionStore.class.getName());

    public static final int DEFAULT_MAX_ITERATION = 5;

    private final PlanningClock clock;
    private final Set<String> activeRegistry = ConcurrentHashMap.newKeySet();
    private final Map<String, SessionProgress> states = new ConcurrentHashMap<>();

    public InMemorySessionStore() {
        this(PlanningClock.system());
    }

    public InMemorySessionStore(PlanningClock clock) {
        this.clock = clock;
    }

    /**
     * 创建讨论组，创建时间取当前时钟
     */
    public SessionProgress openSession(String sessionId, Set<String> participants, int maxIteration) {
        return openSession(sessionId, participants, maxIteration, clock.now());
    }

    /**
     * 创建讨论组
     *
     * @param sessionId 讨论组ID
     * @param participants 参与平台
     * @param maxIteration 最大迭代轮次
     * @param createdAt 创建时间，null表示未知
     * @return 初始进度
     */
    public SessionProgress openSession(String sessionId, Set<String> participants,
                                       int maxIteration, Instant createdAt) {
        SessionProgress progress = new SessionProgress(sessionId, participants, 0, maxIteration,
            0.0, SessionStatus.ACTIVE, createdAt);
        states.put(sessionId, progress);
        activeRegistry.add(sessionId);
        logger.info("创建讨论组: " + sessionId + " 参与平台: " + progress.getParticipants());
        return progress;
    }

    /**
     * 记录一轮迭代
     *
     * @throws SessionStoreException 讨论组不存在
     */
    public SessionProgress recordIteration(String sessionId, int iteration, double quality)
            throws SessionStoreException {
        SessionProgress updated = states.computeIfPresent(sessionId,
            (id, current) -> current.withIteration(iteration, quality));
        if (updated == null) {
            throw new SessionStoreException("Unknown session: " + sessionId);
        }
        logger.fine(() -> "讨论组迭代: " + updated.summary());
        return updated;
    }

    @Override
    public List<String> listActiveSessions() {
        List<String> active = new ArrayList<>();
        for (String sessionId : activeRegistry) {
            SessionProgress progress = states.get(sessionId);
            if (progress != null && progress.getStatus() == SessionStatus.ACTIVE) {
                active.add(sessionId);
            }
        }
        active.sort(null);
        return active;
    }

    @Override
    public SessionProgress getProgress(String sessionId) throws SessionStoreException {
        SessionProgress progress = states.get(sessionId);
        if (progress == null) {
            throw new SessionStoreException("Unknown session: " + sessionId);
        }
        return progress;
    }

    @Override
    public boolean completeSession(String sessionId) {
        if (!activeRegistry.remove(sessionId)) {
            return false;
        }
        states.computeIfPresent(sessionId, (id, current) -> current.withStatus(SessionStatus.DISSOLVED));
        logger.info("讨论组 " + sessionId + " 已解散");
        return true;
    }

    @Override
    public void forceUpdateStatus(String sessionId, SessionStatus status) throws SessionStoreException {
        SessionProgress updated = states.computeIfPresent(sessionId, (id, current) -> current.withStatus(status));
        if (updated == null) {
            throw new SessionStoreException("Unknown session: " + sessionId);
        }
    }

    @Override
    public boolean removeSession(String sessionId) {
        return activeRegistry.remove(sessionId);
    }

    /**
     * 讨论组最终状态；未知讨论组返回null
     */
    public SessionStatus getStatus(String sessionId) {
        SessionProgress progress = states.get(sessionId);
        return progress == null ? null : progress.getStatus();
    }

    /**
     * 彻底删除讨论组，包括其最终状态
     *
     * @return 讨论组是否存在
     */
    public boolean purgeSession(String sessionId) {
        activeRegistry.remove(sessionId);
        return states.remove(sessionId) != null;
    }

    /**
     * 删除所有已不在活跃登记中且不再处于活跃状态的讨论组
     *
     * @return 删除的数量
     */
    public int purgeFinished() {
        int purged = 0;
        for (Map.Entry<String, SessionProgress> entry : states.entrySet()) {
            String sessionId = entry.getKey();
            if (activeRegistry.contains(sessionId) || entry.getValue().getStatus() == SessionStatus.ACTIVE) {
                continue;
            }
            if (states.remove(sessionId, entry.getValue())) {
                purged++;
            }
        }
        if (purged > 0) {
            logger.info("清除 " + purged + " 个已结束讨论组的状态");
        }
        return purged;
    }

    public int size() {
        return states.size();
    }
}
