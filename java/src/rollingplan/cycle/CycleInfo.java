package rollingplan.cycle;

import rollingplan.distribution.Assignment;
import rollingplan.model.Target;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 规划周期信息
 *
 * 只由周期管理器修改。COMPLETED 和 ERROR 为终止状态，进入后不再变化。
 */
public class CycleInfo {

    private static final DateTimeFormatter ID_FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final String cycleId;
    private final int cycleNumber;
    private final Instant startTime;
    private final List<Target> detectedTargets;
    private final CycleMetadata metadata = new CycleMetadata();
    private final AtomicBoolean archived = new AtomicBoolean(false);

    private Instant endTime;
    private PlanningCycleState state = PlanningCycleState.INITIALIZING;
    private Assignment assignment = Assignment.empty();
    private CycleResults results;
    private String errorMessage;

    CycleInfo(int cycleNumber, Instant startTime, List<Target> detectedTargets) {
        this.cycleId = cycleIdFor(cycleNumber, startTime);
        this.cycleNumber = cycleNumber;
        this.startTime = startTime;
        this.detectedTargets = detectedTargets == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(detectedTargets));
    }

    /**
     * 周期ID：planning_cycle_&lt;序号&gt;_&lt;yyyyMMdd_HHmmss&gt;（UTC）
     */
    static String cycleIdFor(int cycleNumber, Instant startTime) {
        return "planning_cycle_" + cycleNumber + "_" + ID_FORMAT.format(startTime);
    }

    /**
     * 进入下一阶段
     *
     * @return false 表示周期已终止（被抢占或停止），调用方应停止执行后续阶段
     */
    synchronized boolean enterPhase(PlanningCycleState phase) {
        if (state.isTerminal()) {
            return false;
        }
        state = phase;
        return true;
    }

    synchronized boolean complete(Instant time) {
        if (state.isTerminal()) {
            return false;
        }
        state = PlanningCycleState.COMPLETED;
        endTime = time;
        return true;
    }

    synchronized boolean forceComplete(Instant time) {
        if (!complete(time)) {
            return false;
        }
        metadata.setForceCompleted(true);
        return true;
    }

    synchronized boolean fail(String message, Instant time) {
        if (state.isTerminal()) {
            return false;
        }
        state = PlanningCycleState.ERROR;
        errorMessage = message;
        endTime = time;
        return true;
    }

    /**
     * 标记已写入历史（只成功一次）
     */
    boolean markArchived() {
        return archived.compareAndSet(false, true);
    }

    synchronized void setAssignment(Assignment assignment) {
        this.assignment = assignment;
    }

    synchronized void setResults(CycleResults results) {
        this.results = results;
    }

    public String getCycleId() {
        return cycleId;
    }

    public int getCycleNumber() {
        return cycleNumber;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public synchronized Instant getEndTime() {
        return endTime;
    }

    public synchronized PlanningCycleState getState() {
        return state;
    }

    public List<Target> getDetectedTargets() {
        return detectedTargets;
    }

    public synchronized Assignment getAssignment() {
        return assignment;
    }

    /**
     * 结果汇总；未进入收集结果阶段时为null
     */
    public synchronized CycleResults getResults() {
        return results;
    }

    public synchronized String getErrorMessage() {
        return errorMessage;
    }

    public CycleMetadata getMetadata() {
        return metadata;
    }

    @Override
    public synchronized String toString() {
        return "CycleInfo{" +
                "cycleId='" + cycleId + '\'' +
                ", state=" + state +
                ", targets=" + detectedTargets.size() +
                (errorMessage != null ? ", error='" + errorMessage + '\'' : "") +
                '}';
    }
}
