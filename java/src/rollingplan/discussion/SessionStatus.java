package rollingplan.discussion;

/**
 * 讨论组状态
 *
 * 对外（日志、报告、事件）使用小写名称。
 */
public enum SessionStatus {

    ACTIVE("active"),
    COMPLETED("completed"),
    DISSOLVED("dissolved"),
    FAILED("failed"),
    FORCE_CLEANED("force_cleaned");

    private final String wireName;

    SessionStatus(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * 是否已结束（不再需要监控）
     */
    public boolean isTerminal() {
        return this != ACTIVE;
    }

    /**
     * 根据小写名称解析
     *
     * @param wireName 小写名称
     * @return 状态
     * @throws IllegalArgumentException 未知名称
     */
    public static SessionStatus fromWireName(String wireName) {
        for (SessionStatus status : values()) {
            if (status.wireName.equals(wireName)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown session status: " + wireName);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
