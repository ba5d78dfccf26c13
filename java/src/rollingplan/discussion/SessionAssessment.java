package rollingplan.discussion;

import java.time.Duration;

/**
 * 单个讨论组的完成判定结果
 */
public class SessionAssessment {

    private static final SessionAssessment PENDING = new SessionAssessment(false, null, null);

    private final boolean completed;
    private final CompletionReason reason;
    private final Duration elapsed;

    private SessionAssessment(boolean completed, CompletionReason reason, Duration elapsed) {
        this.completed = completed;
        this.reason = reason;
        this.elapsed = elapsed;
    }

    public static SessionAssessment pending() {
        return PENDING;
    }

    public static SessionAssessment completed(CompletionReason reason, Duration elapsed) {
        return new SessionAssessment(true, reason, elapsed);
    }

    public boolean isCompleted() {
        return completed;
    }

    /**
     * 完成原因；未完成时为null
     */
    public CompletionReason getReason() {
        return reason;
    }

    /**
     * 讨论组已运行时长；创建时间未知时为null
     */
    public Duration getElapsed() {
        return elapsed;
    }

    @Override
    public String toString() {
        return completed ? "completed(" + reason + ")" : "pending";
    }
}
