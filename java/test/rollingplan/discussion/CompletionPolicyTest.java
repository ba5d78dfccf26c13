package rollingplan.discussion;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import rollingplan.helper.TestTargets;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CompletionPolicyTest {

    private final CompletionPolicy policy = new CompletionPolicy();
    private final Instant now = TestTargets.EPOCH;

    private SessionProgress progress(int iteration, int maxIteration, double quality,
                                     SessionStatus status, long ageSeconds) {
        return new SessionProgress("session-1", Set.of("A", "B"), iteration, maxIteration, quality,
            status, now.minusSeconds(ageSeconds));
    }

    @Test
    void freshSessionIsPending() {
        SessionAssessment assessment = policy.assess(progress(1, 5, 0.4, SessionStatus.ACTIVE, 30), now);

        assertFalse(assessment.isCompleted());
        assertNull(assessment.getReason());
    }

    @Test
    void explicitCompletionComesFirst() {
        SessionAssessment assessment = policy.assess(progress(5, 5, 0.95, SessionStatus.COMPLETED, 1000), now);

        assertEquals(CompletionReason.EXPLICIT_COMPLETION, assessment.getReason());
    }

    @Test
    @DisplayName("max iterations wins over quality when both hold")
    void maxIterationsBeforeQuality() {
        assertEquals(CompletionReason.MAX_ITERATIONS,
            policy.assess(progress(5, 5, 0.9, SessionStatus.ACTIVE, 0), now).getReason());
    }

    @Test
    void qualityThresholdIsInclusive() {
        assertEquals(CompletionReason.QUALITY_THRESHOLD,
            policy.assess(progress(0, 5, 0.85, SessionStatus.ACTIVE, 0), now).getReason());
        assertFalse(policy.assess(progress(0, 5, 0.849, SessionStatus.ACTIVE, 0), now).isCompleted());
    }

    @Test
    void dissolvedOrFailedIsTerminal() {
        assertEquals(CompletionReason.TERMINAL_STATUS,
            policy.assess(progress(1, 5, 0.1, SessionStatus.DISSOLVED, 0), now).getReason());
        assertEquals(CompletionReason.TERMINAL_STATUS,
            policy.assess(progress(1, 5, 0.1, SessionStatus.FAILED, 0), now).getReason());
    }

    @Test
    void softTimeoutNeedsMinimumIterations() {
        assertEquals(CompletionReason.SOFT_TIMEOUT,
            policy.assess(progress(3, 5, 0.1, SessionStatus.ACTIVE, 601), now).getReason());
        assertFalse(policy.assess(progress(2, 5, 0.1, SessionStatus.ACTIVE, 700), now).isCompleted());
    }

    @Test
    void softTimeoutIsStrictlyGreater() {
        assertFalse(policy.assess(progress(3, 5, 0.1, SessionStatus.ACTIVE, 600), now).isCompleted());
    }

    @Test
    void hardTimeoutIgnoresIterations() {
        SessionAssessment assessment = policy.assess(progress(0, 5, 0.0, SessionStatus.ACTIVE, 901), now);

        assertEquals(CompletionReason.HARD_TIMEOUT, assessment.getReason());
        assertEquals(Duration.ofSeconds(901), assessment.getElapsed());
    }

    @Test
    void unknownCreationTimeDisablesTimeouts() {
        SessionProgress unknownAge = new SessionProgress("s", Set.of("A"), 4, 5, 0.1, SessionStatus.ACTIVE, null);

        assertFalse(policy.assess(unknownAge, now).isCompleted());
    }

    @Test
    void thresholdsAreConfigurable() {
        policy.setQualityThreshold(0.5);
        policy.setHardTimeout(Duration.ofSeconds(60));

        assertEquals(CompletionReason.QUALITY_THRESHOLD,
            policy.assess(progress(0, 5, 0.5, SessionStatus.ACTIVE, 0), now).getReason());
        assertEquals(CompletionReason.HARD_TIMEOUT,
            policy.assess(progress(0, 5, 0.1, SessionStatus.ACTIVE, 61), now).getReason());
    }

    @Test
    void consensusReasons() {
        assertTrue(CompletionReason.QUALITY_THRESHOLD.isConsensus());
        assertTrue(CompletionReason.MAX_ITERATIONS.isConsensus());
        assertFalse(CompletionReason.HARD_TIMEOUT.isConsensus());
        assertFalse(CompletionReason.PROGRESS_UNAVAILABLE.isConsensus());
    }
}
