package rollingplan.cycle;

import java.io.Serializable;
import java.time.Duration;

/**
 * 滚动规划周期配置
 */
public class CycleConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // 0 表示上一周期结束后立即开始下一轮
    private Duration planningInterval = Duration.ZERO;
    private int maxPlanningCycles = 100;
    private boolean generateReports = true;
    private String reportSessionName = "rolling_planning";
    private boolean computeGdop = true;

    public CycleConfig() {
    }

    public Duration getPlanningInterval() {
        return planningInterval;
    }

    public void setPlanningInterval(Duration planningInterval) {
        this.planningInterval = planningInterval;
    }

    public int getMaxPlanningCycles() {
        return maxPlanningCycles;
    }

    public void setMaxPlanningCycles(int maxPlanningCycles) {
        this.maxPlanningCycles = maxPlanningCycles;
    }

    public boolean isGenerateReports() {
        return generateReports;
    }

    public void setGenerateReports(boolean generateReports) {
        this.generateReports = generateReports;
    }

    public String getReportSessionName() {
        return reportSessionName;
    }

    public void setReportSessionName(String reportSessionName) {
        this.reportSessionName = reportSessionName;
    }

    public boolean isComputeGdop() {
        return computeGdop;
    }

    public void setComputeGdop(boolean computeGdop) {
        this.computeGdop = computeGdop;
    }

    @Override
    public String toString() {
        return "CycleConfig{" +
                "planningInterval=" + planningInterval.getSeconds() + "s" +
                ", maxPlanningCycles=" + maxPlanningCycles +
                ", generateReports=" + generateReports +
                ", reportSessionName='" + reportSessionName + '\'' +
                ", computeGdop=" + computeGdop +
                '}';
    }
}
