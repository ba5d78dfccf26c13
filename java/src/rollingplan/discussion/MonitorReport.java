package rollingplan.discussion;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 一次讨论组等待的结果
 */
public class MonitorReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<String> trackedSessionIds = new ArrayList<>();
    private final List<String> dissolvedSessionIds = new ArrayList<>();
    private final List<String> forceCleanedSessionIds = new ArrayList<>();
    private final Map<String, CompletionReason> reasons = new LinkedHashMap<>();
    private final Map<String, Set<String>> participants = new LinkedHashMap<>();
    private int pollCount;
    private Duration elapsed = Duration.ZERO;
    private boolean interrupted;

    public MonitorReport() {
    }

    /**
     * 没有任何讨论组时的结果
     */
    public static MonitorReport empty() {
        return new MonitorReport();
    }

    synchronized void track(String sessionId) {
        if (!trackedSessionIds.contains(sessionId)) {
            trackedSessionIds.add(sessionId);
        }
    }

    synchronized void recordParticipants(String sessionId, Set<String> platformIds) {
        participants.put(sessionId, Collections.unmodifiableSet(new LinkedHashSet<>(platformIds)));
    }

    synchronized void recordDissolved(String sessionId, CompletionReason reason) {
        dissolvedSessionIds.add(sessionId);
        reasons.put(sessionId, reason);
    }

    synchronized void recordForceCleaned(String sessionId) {
        forceCleanedSessionIds.add(sessionId);
    }

    synchronized void incrementPollCount() {
        pollCount++;
    }

    synchronized void setElapsed(Duration elapsed) {
        this.elapsed = elapsed;
    }

    synchronized void setInterrupted(boolean interrupted) {
        this.interrupted = interrupted;
    }

    public synchronized List<String> getTrackedSessionIds() {
        return Collections.unmodifiableList(new ArrayList<>(trackedSessionIds));
    }

    public synchronized List<String> getDissolvedSessionIds() {
        return Collections.unmodifiableList(new ArrayList<>(dissolvedSessionIds));
    }

    public synchronized List<String> getForceCleanedSessionIds() {
        return Collections.unmodifiableList(new ArrayList<>(forceCleanedSessionIds));
    }

    public synchronized Map<String, CompletionReason> getReasons() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(reasons));
    }

    public synchronized CompletionReason getReason(String sessionId) {
        return reasons.get(sessionId);
    }

    /**
     * 讨论组ID → 参与平台（读取到进度时记录）
     */
    public synchronized Map<String, Set<String>> getParticipants() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(participants));
    }

    public synchronized boolean wasForceCleaned(String sessionId) {
        return forceCleanedSessionIds.contains(sessionId);
    }

    public synchronized int getPollCount() {
        return pollCount;
    }

    public synchronized Duration getElapsed() {
        return elapsed;
    }

    public synchronized boolean isInterrupted() {
        return interrupted;
    }

    @Override
    public synchronized String toString() {
        return "MonitorReport{" +
                "tracked=" + trackedSessionIds.size() +
                ", dissolved=" + dissolvedSessionIds.size() +
                ", forceCleaned=" + forceCleanedSessionIds.size() +
                ", polls=" + pollCount +
                ", elapsed=" + elapsed.toMillis() / 1000.0 + "s" +
                (interrupted ? ", interrupted" : "") +
                '}';
    }
}
