package rollingplan.event;

import org.junit.jupiter.api.Test;
import rollingplan.helper.TestTargets;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PlanningEventBusTest {

    private static PlanningEvent event(String type) {
        return new PlanningEvent(type, "planning_cycle_1", Collections.singletonMap("k", 1), TestTargets.EPOCH);
    }

    @Test
    void subscribersReceiveEventsInOrder() {
        PlanningEventBus bus = new PlanningEventBus();
        List<String> received = new ArrayList<>();
        bus.subscribe(e -> received.add(e.getEventType()));

        bus.publish(event(PlanningEvent.CYCLE_STATE));
        bus.publish(event(PlanningEvent.DISCUSSION_PROGRESS));

        assertEquals(List.of(PlanningEvent.CYCLE_STATE, PlanningEvent.DISCUSSION_PROGRESS), received);
    }

    @Test
    void typedSubscriptionFilters() {
        PlanningEventBus bus = new PlanningEventBus();
        List<PlanningEvent> received = new ArrayList<>();
        bus.subscribe(PlanningEvent.DISCUSSION_DISSOLVED, received::add);

        bus.publish(event(PlanningEvent.CYCLE_STATE));
        bus.publish(event(PlanningEvent.DISCUSSION_DISSOLVED));

        assertEquals(1, received.size());
        assertEquals("planning_cycle_1", received.get(0).getCycleId());
    }

    @Test
    void unsubscribeStopsDelivery() {
        PlanningEventBus bus = new PlanningEventBus();
        List<PlanningEvent> received = new ArrayList<>();
        PlanningEventBus.Subscription subscription = bus.subscribe(received::add);

        subscription.unsubscribe();
        bus.publish(event(PlanningEvent.CYCLE_STATE));

        assertTrue(received.isEmpty());
        assertEquals(0, bus.getSubscriberCount());
    }

    @Test
    void failingSubscriberDoesNotAffectOthers() {
        PlanningEventBus bus = new PlanningEventBus();
        List<PlanningEvent> received = new ArrayList<>();
        bus.subscribe(e -> {
            throw new IllegalStateException("subscriber bug");
        });
        bus.subscribe(received::add);

        assertDoesNotThrow(() -> bus.publish(event(PlanningEvent.CYCLE_STATE)));
        assertEquals(1, received.size());
    }

    @Test
    void payloadIsCopied() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("state", "discussing");
        PlanningEvent e = new PlanningEvent(PlanningEvent.CYCLE_STATE, null, payload, TestTargets.EPOCH);
        payload.put("state", "completed");

        assertEquals("discussing", e.getPayload().get("state"));
        assertThrows(UnsupportedOperationException.class, () -> e.getPayload().put("x", 1));
    }
}
