package rollingplan.report;

import rollingplan.distribution.Assignment;
import rollingplan.model.Target;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 规划甘特图数据
 *
 * 每个已分配的目标生成一个条目，时间范围为目标发射时间到预计结束时间。
 * 输出为Map结构，直接交给 {@link ReportSink}。
 */
public final class PlanningGanttData {

    private static final Logger logger = Logger.getLogger(PlanningGanttData.class.getName());

    public static final String CHART_NAME = "chart_name";
    public static final String TASKS = "tasks";

    private PlanningGanttData() {
    }

    /**
     * 生成甘特图数据
     *
     * @return 甘特图数据；没有已分配任务时返回null
     */
    public static Map<String, Object> build(String cycleId, int cycleNumber,
                                            Instant cycleStart, Instant cycleEnd,
                                            Assignment assignment, List<Target> targets,
                                            Instant generationTime) {
        Map<String, Target> targetsById = new LinkedHashMap<>();
        for (Target target : targets) {
            targetsById.put(target.getId(), target);
        }

        List<Map<String, Object>> tasks = new ArrayList<>();
        for (Map.Entry<String, Set<String>> entry : assignment.asMap().entrySet()) {
            String platformId = entry.getKey();
            for (String targetId : entry.getValue()) {
                Target target = targetsById.get(targetId);
                if (target == null) {
                    continue;
                }

                Map<String, Object> taskMetadata = new LinkedHashMap<>();
                taskMetadata.put("cycle_number", cycleNumber);
                taskMetadata.put("platform_id", platformId);
                taskMetadata.put("target_id", targetId);

                Map<String, Object> task = new LinkedHashMap<>();
                task.put("task_id", platformId + "_" + targetId);
                task.put("category", platformId);
                task.put("target_id", targetId);
                task.put("start", target.getLaunchTime().toString());
                task.put("end", target.getEstimatedEndTime().toString());
                task.put("priority", target.getPriority());
                task.put("threat_level", target.getThreatLevel());
                task.put("metadata", taskMetadata);
                tasks.add(task);
            }
        }

        if (tasks.isEmpty()) {
            logger.warning("没有任务数据，无法生成规划甘特图");
            return null;
        }

        Map<String, Object> cycleInfo = new LinkedHashMap<>();
        cycleInfo.put("cycle_id", cycleId);
        cycleInfo.put("cycle_number", cycleNumber);
        cycleInfo.put("start_time", cycleStart.toString());
        cycleInfo.put("end_time", cycleEnd != null ? cycleEnd.toString() : null);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("total_targets", targets.size());
        metadata.put("total_platforms", assignment.getPlatformIds().size());
        metadata.put("generation_time", generationTime.toString());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("title", "规划周期 " + cycleNumber + " - 任务分配甘特图");
        data.put(CHART_NAME, "planning_cycle_" + cycleNumber);
        data.put("cycle_info", cycleInfo);
        data.put(TASKS, tasks);
        data.put("metadata", metadata);
        return data;
    }
}
