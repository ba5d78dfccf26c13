package rollingplan.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import rollingplan.helper.PlanningClock;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * 基于文件的结果输出
 *
 * 会话目录：&lt;时间戳&gt;_&lt;会话名&gt;_&lt;会话ID&gt;/{planning_results, gantt_charts}。
 * 数据保存为JSON，图表生成为CSV时间线。
 */
public class JsonFileReportSink implements ReportSink {

    private static final Logger logger = Logger.getLogger(JsonFileReportSink.class.getName());

    private static final DateTimeFormatter DIR_FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    static final String PLANNING_RESULTS_DIR = "planning_results";
    static final String GANTT_CHARTS_DIR = "gantt_charts";
    static final String SESSION_INFO_FILE = "session_info.json";

    private static final String[] CSV_COLUMNS = {
        "task_id", "category", "target_id", "start", "end", "priority", "threat_level"
    };

    private final Path baseOutputDir;
    private final PlanningClock clock;
    private final ObjectWriter writer;

    private volatile String currentSessionId;
    private volatile Path currentSessionDir;

    public JsonFileReportSink(Path baseOutputDir, PlanningClock clock) {
        this.baseOutputDir = baseOutputDir;
        this.clock = clock;
        this.writer = new ObjectMapper().writerWithDefaultPrettyPrinter();
    }

    @Override
    public synchronized String createSession(String sessionName) throws IOException {
        String sessionId = UUID.randomUUID().toString().substring(0, 8);
        String name = sessionName == null || sessionName.isEmpty() ? "simulation" : sessionName;
        String dirName = DIR_FORMAT.format(clock.now()) + "_" + name + "_" + sessionId;

        Path sessionDir = baseOutputDir.resolve(dirName);
        Files.createDirectories(sessionDir.resolve(PLANNING_RESULTS_DIR));
        Files.createDirectories(sessionDir.resolve(GANTT_CHARTS_DIR));

        Map<String, Object> sessionInfo = new LinkedHashMap<>();
        sessionInfo.put("session_id", sessionId);
        sessionInfo.put("session_name", name);
        sessionInfo.put("created_time", clock.now().toString());
        sessionInfo.put("directory", sessionDir.toString());
        sessionInfo.put("status", "active");
        writer.writeValue(sessionDir.resolve(SESSION_INFO_FILE).toFile(), sessionInfo);

        currentSessionId = sessionId;
        currentSessionDir = sessionDir;
        logger.info("创建输出会话: " + sessionId + ", 目录: " + sessionDir);
        return sessionId;
    }

    @Override
    public Path saveData(Map<String, Object> data, String label) throws IOException {
        Path sessionDir = requireSession();
        Path file = sessionDir.resolve(PLANNING_RESULTS_DIR).resolve(label + ".json");

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("session_id", currentSessionId);
        metadata.put("created_time", clock.now().toString());
        metadata.put("version", "1.0");

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("metadata", metadata);
        document.put("data", data);
        writer.writeValue(file.toFile(), document);

        logger.info("保存规划数据到: " + file);
        return file;
    }

    @Override
    public Path renderChart(Map<String, Object> ganttData) throws IOException {
        Path sessionDir = requireSession();
        Object chartName = ganttData.get(PlanningGanttData.CHART_NAME);
        String fileName = (chartName != null ? chartName.toString() : "gantt_" + DIR_FORMAT.format(clock.now()))
            + ".csv";
        Path file = sessionDir.resolve(GANTT_CHARTS_DIR).resolve(fileName);

        Object tasks = ganttData.get(PlanningGanttData.TASKS);
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            out.write(String.join(",", CSV_COLUMNS));
            out.newLine();
            if (tasks instanceof List) {
                for (Object task : (List<?>) tasks) {
                    if (task instanceof Map) {
                        out.write(csvRow((Map<?, ?>) task));
                        out.newLine();
                    }
                }
            }
        }

        logger.info("规划甘特图已保存: " + file);
        return file;
    }

    private static String csvRow(Map<?, ?> task) {
        StringBuilder row = new StringBuilder();
        for (int i = 0; i < CSV_COLUMNS.length; i++) {
            if (i > 0) {
                row.append(',');
            }
            Object value = task.get(CSV_COLUMNS[i]);
            row.append(csvField(value == null ? "" : value.toString()));
        }
        return row.toString();
    }

    private static String csvField(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return '"' + value.replace("\"", "\"\"") + '"';
        }
        return value;
    }

    private Path requireSession() {
        Path sessionDir = currentSessionDir;
        if (sessionDir == null) {
            throw new IllegalStateException("没有活动的输出会话");
        }
        return sessionDir;
    }

    public String getCurrentSessionId() {
        return currentSessionId;
    }

    public Path getCurrentSessionDir() {
        return currentSessionDir;
    }
}
