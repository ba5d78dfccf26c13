package rollingplan.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import rollingplan.helper.ManualClock;
import rollingplan.helper.TestTargets;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileReportSinkTest {

    @TempDir
    Path baseDir;

    private JsonFileReportSink sink;
    private final ObjectMapper mapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        sink = new JsonFileReportSink(baseDir, new ManualClock(TestTargets.EPOCH));
    }

    private static Map<String, Object> ganttData() {
        Map<String, Object> task = new LinkedHashMap<>();
        task.put("task_id", "A_T1");
        task.put("category", "A");
        task.put("target_id", "T1");
        task.put("start", "2025-07-01T00:00:00Z");
        task.put("end", "2025-07-01T00:10:00Z");
        task.put("priority", 1.0);
        task.put("threat_level", "high, imminent");

        List<Object> tasks = new ArrayList<>();
        tasks.add(task);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(PlanningGanttData.CHART_NAME, "planning_cycle_1");
        data.put(PlanningGanttData.TASKS, tasks);
        return data;
    }

    @Test
    void createSessionLaysOutDirectories() throws Exception {
        String sessionId = sink.createSession("rolling_planning");

        Path sessionDir = sink.getCurrentSessionDir();
        assertEquals(8, sessionId.length());
        assertEquals("20250701_000000_rolling_planning_" + sessionId, sessionDir.getFileName().toString());
        assertTrue(Files.isDirectory(sessionDir.resolve(JsonFileReportSink.PLANNING_RESULTS_DIR)));
        assertTrue(Files.isDirectory(sessionDir.resolve(JsonFileReportSink.GANTT_CHARTS_DIR)));

        JsonNode info = mapper.readTree(sessionDir.resolve(JsonFileReportSink.SESSION_INFO_FILE).toFile());
        assertEquals(sessionId, info.get("session_id").asText());
        assertEquals("active", info.get("status").asText());
    }

    @Test
    void saveDataWrapsPayloadWithMetadata() throws Exception {
        String sessionId = sink.createSession("rolling_planning");

        Path file = sink.saveData(ganttData(), "planning_cycle_1");

        assertEquals("planning_cycle_1.json", file.getFileName().toString());
        JsonNode document = mapper.readTree(file.toFile());
        assertEquals(sessionId, document.get("metadata").get("session_id").asText());
        assertEquals("planning_cycle_1", document.get("data").get(PlanningGanttData.CHART_NAME).asText());
        assertEquals("A_T1", document.get("data").get(PlanningGanttData.TASKS).get(0).get("task_id").asText());
    }

    @Test
    void renderChartWritesCsvTimeline() throws Exception {
        sink.createSession("rolling_planning");

        Path file = sink.renderChart(ganttData());

        assertEquals("planning_cycle_1.csv", file.getFileName().toString());
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertEquals("task_id,category,target_id,start,end,priority,threat_level", lines.get(0));
        assertEquals("A_T1,A,T1,2025-07-01T00:00:00Z,2025-07-01T00:10:00Z,1.0,\"high, imminent\"", lines.get(1));
    }

    @Test
    void writingWithoutSessionFails() {
        assertThrows(IllegalStateException.class, () -> sink.saveData(Collections.emptyMap(), "x"));
        assertThrows(IllegalStateException.class, () -> sink.renderChart(ganttData()));
    }
}
