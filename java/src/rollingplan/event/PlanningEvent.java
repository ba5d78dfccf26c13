package rollingplan.event;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 规划过程中发布的事件（周期状态变化、讨论组进度等）
 */
public class PlanningEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String CYCLE_STATE = "cycle.state";
    public static final String DISCUSSION_PROGRESS = "discussion.progress";
    public static final String DISCUSSION_DISSOLVED = "discussion.dissolved";
    public static final String DISCUSSION_FORCE_CLEANED = "discussion.force_cleaned";

    private final String eventType;
    private final String cycleId;
    private final Map<String, Object> payload;
    private final Instant timestamp;

    public PlanningEvent(String eventType, String cycleId, Map<String, Object> payload, Instant timestamp) {
        this.eventType = eventType;
        this.cycleId = cycleId;
        this.payload = payload == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        this.timestamp = timestamp;
    }

    public String getEventType() {
        return eventType;
    }

    /**
     * 所属周期ID，与周期无关的事件为null
     */
    public String getCycleId() {
        return cycleId;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "PlanningEvent{" + eventType + ", cycle=" + cycleId + ", payload=" + payload + '}';
    }
}
