package rollingplan.discussion;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 讨论组进度快照
 *
 * 由会话存储返回，不可变。createdAt 为null时不做超时判断。
 */
public class SessionProgress implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String sessionId;
    private final Set<String> participants;
    private final int iteration;
    private final int maxIteration;
    private final double quality;          // [0, 1]
    private final SessionStatus status;
    private final Instant createdAt;

    public SessionProgress(String sessionId, Set<String> participants,
                           int iteration, int maxIteration, double quality,
                           SessionStatus status, Instant createdAt) {
        this.sessionId = sessionId;
        this.participants = participants == null
            ? Collections.emptySet()
            : Collections.unmodifiableSet(new LinkedHashSet<>(participants));
        this.iteration = iteration;
        this.maxIteration = maxIteration;
        this.quality = quality;
        this.status = status == null ? SessionStatus.ACTIVE : status;
        this.createdAt = createdAt;
    }

    public SessionProgress withIteration(int newIteration, double newQuality) {
        return new SessionProgress(sessionId, participants, newIteration, maxIteration,
            newQuality, status, createdAt);
    }

    public SessionProgress withStatus(SessionStatus newStatus) {
        return new SessionProgress(sessionId, participants, iteration, maxIteration,
            quality, newStatus, createdAt);
    }

    public String getSessionId() {
        return sessionId;
    }

    /**
     * 参与讨论的平台ID
     */
    public Set<String> getParticipants() {
        return participants;
    }

    public int getIteration() {
        return iteration;
    }

    public int getMaxIteration() {
        return maxIteration;
    }

    public double getQuality() {
        return quality;
    }

    public SessionStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * 进度摘要，如 {@code session1(2/5, Q:0.63)}
     */
    public String summary() {
        String shortId = sessionId.length() > 8 ? sessionId.substring(0, 8) : sessionId;
        return String.format("%s(%d/%d, Q:%.2f)", shortId, iteration, maxIteration, quality);
    }

    @Override
    public String toString() {
        return "SessionProgress{" +
                "sessionId='" + sessionId + '\'' +
                ", participants=" + participants +
                ", iteration=" + iteration + "/" + maxIteration +
                ", quality=" + String.format("%.3f", quality) +
                ", status=" + status +
                '}';
    }
}
