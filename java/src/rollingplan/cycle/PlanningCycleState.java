package rollingplan.cycle;

/**
 * 规划周期状态
 *
 * IDLE → INITIALIZING → COLLECTING_TARGETS → DISTRIBUTING_TASKS → DISCUSSING →
 * GATHERING_RESULTS → GENERATING_REPORTS → COMPLETED，任一状态可转入 ERROR。
 */
public enum PlanningCycleState {

    IDLE("idle"),
    INITIALIZING("initializing"),
    COLLECTING_TARGETS("collecting_targets"),
    DISTRIBUTING_TASKS("distributing_tasks"),
    DISCUSSING("discussing"),
    GATHERING_RESULTS("gathering_results"),
    GENERATING_REPORTS("generating_reports"),
    COMPLETED("completed"),
    ERROR("error");

    private final String wireName;

    PlanningCycleState(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
