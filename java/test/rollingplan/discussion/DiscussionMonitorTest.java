package rollingplan.discussion;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import rollingplan.event.PlanningEvent;
import rollingplan.event.PlanningEventBus;
import rollingplan.helper.ManualClock;
import rollingplan.helper.TestTargets;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class DiscussionMonitorTest {

    private static final Duration MAX_WAIT = Duration.ofSeconds(450);
    private static final Duration POLL = Duration.ofSeconds(5);

    private ManualClock clock;
    private InMemorySessionStore store;
    private PlanningEventBus eventBus;
    private DiscussionMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(TestTargets.EPOCH);
        store = new InMemorySessionStore(clock);
        eventBus = new PlanningEventBus();
        monitor = new DiscussionMonitor(store, clock, new CompletionPolicy(), eventBus);
    }

    // ── completion ───────────────────────────────────────────────────

    @Nested
    @DisplayName("completion heuristics")
    class Completion {

        @Test
        @DisplayName("iteration == maxIteration completes on the next poll regardless of quality")
        void maxIterationCompletes() throws Exception {
            store.openSession("s1", Set.of("A"), 5);
            store.recordIteration("s1", 5, 0.1);

            MonitorReport report = monitor.awaitCompletion(Collections.singletonList("s1"), MAX_WAIT, POLL);

            assertEquals(Collections.singletonList("s1"), report.getDissolvedSessionIds());
            assertEquals(CompletionReason.MAX_ITERATIONS, report.getReason("s1"));
            assertEquals(1, report.getPollCount());
            assertEquals(SessionStatus.DISSOLVED, store.getStatus("s1"));
            assertTrue(store.listActiveSessions().isEmpty());
        }

        @Test
        @DisplayName("quality >= 0.85 completes even at iteration 0")
        void qualityCompletesAtIterationZero() throws Exception {
            store.openSession("s1", Set.of("A"), 5);
            store.recordIteration("s1", 0, 0.85);

            MonitorReport report = monitor.awaitCompletion(Collections.singletonList("s1"), MAX_WAIT, POLL);

            assertEquals(CompletionReason.QUALITY_THRESHOLD, report.getReason("s1"));
            assertTrue(report.getForceCleanedSessionIds().isEmpty());
        }

        @Test
        void progressBetweenPollsIsObserved() {
            store.openSession("s1", Set.of("A"), 3);
            clock.setOnSleep(() -> {
                try {
                    SessionProgress p = store.getProgress("s1");
                    store.recordIteration("s1", p.getIteration() + 1, 0.5);
                } catch (SessionStoreException e) {
                    throw new IllegalStateException(e);
                }
            });

            MonitorReport report = monitor.awaitCompletion(Collections.singletonList("s1"), MAX_WAIT, POLL);

            assertEquals(CompletionReason.MAX_ITERATIONS, report.getReason("s1"));
            assertEquals(4, report.getPollCount());
            assertEquals(Duration.ofSeconds(15), report.getElapsed());
        }

        @Test
        void softTimeoutWithEnoughIterations() throws Exception {
            store.openSession("s1", Set.of("A"), 5, TestTargets.EPOCH.minusSeconds(601));
            store.recordIteration("s1", 3, 0.2);

            MonitorReport report = monitor.awaitCompletion(Collections.singletonList("s1"), MAX_WAIT, POLL);

            assertEquals(CompletionReason.SOFT_TIMEOUT, report.getReason("s1"));
        }

        @Test
        void hardTimeoutRegardlessOfIterations() {
            store.openSession("s1", Set.of("A"), 5, TestTargets.EPOCH.minusSeconds(901));

            MonitorReport report = monitor.awaitCompletion(Collections.singletonList("s1"), MAX_WAIT, POLL);

            assertEquals(CompletionReason.HARD_TIMEOUT, report.getReason("s1"));
        }

        @Test
        void sessionsCompleteIndependently() throws Exception {
            store.openSession("s1", Set.of("A"), 5);
            store.openSession("s2", Set.of("B"), 2);
            store.recordIteration("s1", 0, 0.9);
            clock.setOnSleep(() -> {
                try {
                    store.recordIteration("s2", 2, 0.3);
                } catch (SessionStoreException e) {
                    throw new IllegalStateException(e);
                }
            });

            MonitorReport report = monitor.awaitCompletion(Arrays.asList("s1", "s2"), MAX_WAIT, POLL);

            assertEquals(Arrays.asList("s1", "s2"), report.getDissolvedSessionIds());
            assertEquals(2, report.getPollCount());
            assertEquals(Set.of("A"), report.getParticipants().get("s1"));
        }
    }

    // ── bounded wait ─────────────────────────────────────────────────

    @Nested
    @DisplayName("bounded wait and forced cleanup")
    class BoundedWait {

        @Test
        @DisplayName("a never-completing session is force-cleaned within 30s ± 5s")
        void forceCleanedAfterMaxWait() throws Exception {
            store.openSession("s1", Set.of("A"), 5);

            MonitorReport report = monitor.awaitCompletion(
                Collections.singletonList("s1"), Duration.ofSeconds(30), Duration.ofSeconds(5));

            assertEquals(Collections.singletonList("s1"), report.getForceCleanedSessionIds());
            assertTrue(report.getDissolvedSessionIds().isEmpty());
            long elapsed = report.getElapsed().getSeconds();
            assertTrue(elapsed >= 25 && elapsed <= 35, "elapsed " + elapsed);
            assertEquals(SessionStatus.FORCE_CLEANED, store.getStatus("s1"));
            assertEquals("force_cleaned", store.getProgress("s1").getStatus().getWireName());
            assertTrue(store.listActiveSessions().isEmpty());
        }

        @Test
        @DisplayName("an interrupt stops polling, cleans up and keeps the interrupt flag")
        void interruptForceCleans() {
            store.openSession("s1", Set.of("A"), 5);
            clock.interruptAfterSleeps(0);

            MonitorReport report = monitor.awaitCompletion(Collections.singletonList("s1"), MAX_WAIT, POLL);

            assertTrue(Thread.interrupted());
            assertTrue(report.isInterrupted());
            assertEquals(Collections.singletonList("s1"), report.getForceCleanedSessionIds());
            assertEquals(SessionStatus.FORCE_CLEANED, store.getStatus("s1"));
        }

        @Test
        void forceCleanupTrackedEndsWait() {
            store.openSession("s1", Set.of("A"), 5);
            store.openSession("s2", Set.of("B"), 5);
            clock.setOnSleep(() -> monitor.forceCleanupTracked());

            MonitorReport report = monitor.awaitCompletion(Arrays.asList("s1", "s2"), MAX_WAIT, POLL);

            assertEquals(2, report.getPollCount());
            assertEquals(Arrays.asList("s1", "s2"), report.getForceCleanedSessionIds());
            assertTrue(monitor.getTrackedSessions().isEmpty());
        }

        @Test
        void externallyRemovedSessionStopsBeingWaitedFor() {
            store.openSession("s1", Set.of("A"), 5);
            store.removeSession("s1");

            MonitorReport report = monitor.awaitCompletion(Collections.singletonList("s1"), MAX_WAIT, POLL);

            assertEquals(CompletionReason.CLOSED_EXTERNALLY, report.getReason("s1"));
        }

        @Test
        void noSessionsMeansNoWait() {
            MonitorReport report = monitor.awaitCompletion(Collections.emptyList(), MAX_WAIT, POLL);

            assertEquals(0, report.getPollCount());
            assertEquals(0, clock.getSleepCount());
        }
    }

    // ── store failures ───────────────────────────────────────────────

    @Nested
    @DisplayName("session store failures")
    class StoreFailures {

        @Test
        @DisplayName("a failing progress query counts as completed")
        void progressFailureCountsAsCompleted() throws Exception {
            SessionStore failing = mock(SessionStore.class);
            when(failing.listActiveSessions()).thenReturn(Collections.singletonList("s1"));
            when(failing.getProgress("s1")).thenThrow(new SessionStoreException("runtime gone"));
            DiscussionMonitor m = new DiscussionMonitor(failing, clock);

            MonitorReport report = m.awaitCompletion(Collections.singletonList("s1"), MAX_WAIT, POLL);

            assertEquals(CompletionReason.PROGRESS_UNAVAILABLE, report.getReason("s1"));
            assertEquals(1, report.getPollCount());
        }

        @Test
        void dissolveFailureIsNotRetried() throws Exception {
            SessionStore failing = mock(SessionStore.class);
            when(failing.listActiveSessions()).thenReturn(Collections.singletonList("s1"));
            when(failing.getProgress("s1")).thenReturn(new SessionProgress("s1", Set.of("A"), 5, 5, 0.9,
                SessionStatus.ACTIVE, TestTargets.EPOCH));
            when(failing.completeSession(anyString())).thenThrow(new SessionStoreException("busy"));
            DiscussionMonitor m = new DiscussionMonitor(failing, clock);

            MonitorReport report = m.awaitCompletion(Collections.singletonList("s1"), MAX_WAIT, POLL);

            assertEquals(Collections.singletonList("s1"), report.getDissolvedSessionIds());
            verify(failing, times(1)).completeSession("s1");
        }

        @Test
        void forceCleanupContinuesAfterStatusFailure() throws Exception {
            SessionStore failing = mock(SessionStore.class);
            doThrow(new SessionStoreException("gone")).when(failing).forceUpdateStatus("s1", SessionStatus.FORCE_CLEANED);
            DiscussionMonitor m = new DiscussionMonitor(failing, clock);

            List<String> cleaned = m.forceCleanup(Arrays.asList("s1", "s2"));

            assertEquals(Arrays.asList("s1", "s2"), cleaned);
            verify(failing).forceUpdateStatus("s2", SessionStatus.FORCE_CLEANED);
            verify(failing).removeSession("s2");
        }
    }

    // ── events ───────────────────────────────────────────────────────

    @Test
    void publishesProgressAndDissolveEvents() throws Exception {
        List<PlanningEvent> events = new ArrayList<>();
        eventBus.subscribe(events::add);
        store.openSession("s1", Set.of("A"), 2);
        clock.setOnSleep(() -> {
            try {
                store.recordIteration("s1", 2, 0.4);
            } catch (SessionStoreException e) {
                throw new IllegalStateException(e);
            }
        });

        monitor.awaitCompletion("planning_cycle_1", Collections.singletonList("s1"), MAX_WAIT, POLL);

        assertEquals(PlanningEvent.DISCUSSION_PROGRESS, events.get(0).getEventType());
        assertEquals(1, events.get(0).getPayload().get("remaining"));
        PlanningEvent last = events.get(events.size() - 1);
        assertEquals(PlanningEvent.DISCUSSION_DISSOLVED, last.getEventType());
        assertEquals("planning_cycle_1", last.getCycleId());
        assertEquals("MAX_ITERATIONS", last.getPayload().get("reason"));
    }
}
