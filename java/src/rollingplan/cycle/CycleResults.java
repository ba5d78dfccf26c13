package rollingplan.cycle;

import rollingplan.discussion.MonitorReport;
import rollingplan.distribution.Assignment;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 周期结果汇总
 */
public class CycleResults implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Assignment assignment;
    private final Map<String, PlatformSummary> platformSummaries;
    private final OptimizationMetrics metrics;
    private final MonitorReport monitorReport;

    public CycleResults(Assignment assignment, Map<String, PlatformSummary> platformSummaries,
                        OptimizationMetrics metrics, MonitorReport monitorReport) {
        this.assignment = assignment;
        this.platformSummaries = Collections.unmodifiableMap(new LinkedHashMap<>(platformSummaries));
        this.metrics = metrics;
        this.monitorReport = monitorReport;
    }

    public Assignment getAssignment() {
        return assignment;
    }

    public Map<String, PlatformSummary> getPlatformSummaries() {
        return platformSummaries;
    }

    public OptimizationMetrics getMetrics() {
        return metrics;
    }

    public MonitorReport getMonitorReport() {
        return monitorReport;
    }

    @Override
    public String toString() {
        return "CycleResults{" +
                "platforms=" + platformSummaries.keySet() +
                ", metrics=" + metrics +
                ", monitor=" + monitorReport +
                '}';
    }
}
