package rollingplan.cycle;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 周期元数据
 *
 * 固定字段覆盖已知用途，其它信息放入 extras。
 */
public class CycleMetadata implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String PLANNING_DATA = "planning_data";
    public static final String PLANNING_CHART = "planning_chart";

    private MetaTaskReference metaTask;
    private final Map<String, String> reportFiles = new LinkedHashMap<>();
    private boolean forceCompleted;
    private String reportSessionId;
    private final Map<String, Object> extras = new LinkedHashMap<>();

    public synchronized MetaTaskReference getMetaTask() {
        return metaTask;
    }

    public synchronized void setMetaTask(MetaTaskReference metaTask) {
        this.metaTask = metaTask;
    }

    /**
     * 报告文件：类型 → 路径
     */
    public synchronized Map<String, String> getReportFiles() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(reportFiles));
    }

    public synchronized void putReportFile(String kind, String path) {
        reportFiles.put(kind, path);
    }

    public synchronized boolean isForceCompleted() {
        return forceCompleted;
    }

    synchronized void setForceCompleted(boolean forceCompleted) {
        this.forceCompleted = forceCompleted;
    }

    public synchronized String getReportSessionId() {
        return reportSessionId;
    }

    public synchronized void setReportSessionId(String reportSessionId) {
        this.reportSessionId = reportSessionId;
    }

    public synchronized Map<String, Object> getExtras() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }

    public synchronized void putExtra(String key, Object value) {
        extras.put(key, value);
    }

    @Override
    public synchronized String toString() {
        return "CycleMetadata{" +
                "metaTask=" + metaTask +
                ", reportFiles=" + reportFiles +
                ", forceCompleted=" + forceCompleted +
                ", reportSessionId='" + reportSessionId + '\'' +
                ", extras=" + extras.keySet() +
                '}';
    }
}
