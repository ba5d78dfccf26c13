package rollingplan.discussion;

/**
 * 讨论组被判定为完成的原因
 */
public enum CompletionReason {

    /** 讨论组明确标记为完成 */
    EXPLICIT_COMPLETION,
    /** 达到最大迭代次数 */
    MAX_ITERATIONS,
    /** 质量分数达到优秀标准 */
    QUALITY_THRESHOLD,
    /** 已解散或失败 */
    TERMINAL_STATUS,
    /** 超过软超时且已进行足够轮次 */
    SOFT_TIMEOUT,
    /** 超过硬超时 */
    HARD_TIMEOUT,
    /** 进度读取失败，按完成处理以免无限等待 */
    PROGRESS_UNAVAILABLE,
    /** 已被外部移出活跃登记 */
    CLOSED_EXTERNALLY;

    /**
     * 是否代表讨论形成了结论（而不是被超时或异常截断）
     */
    public boolean isConsensus() {
        return this == EXPLICIT_COMPLETION || this == MAX_ITERATIONS || this == QUALITY_THRESHOLD;
    }
}
