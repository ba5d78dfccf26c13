package rollingplan.discussion;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.logging.Logger;

/**
 * 讨论组完成判定策略
 *
 * 按以下顺序判定，任一条件满足即视为完成：
 * 1. 明确标记为完成
 * 2. 达到最大迭代次数
 * 3. 质量分数 ≥ 质量阈值
 * 4. 已解散或失败
 * 5. 运行超过软超时且迭代轮次 ≥ 最少轮次
 * 6. 运行超过硬超时
 */
public class CompletionPolicy implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Logger logger = Logger.getLogger(CompletionPolicy.class.getName());

    private double qualityThreshold = 0.85;
    private Duration softTimeout = Duration.ofSeconds(600);
    private int softTimeoutMinIterations = 3;
    private Duration hardTimeout = Duration.ofSeconds(900);

    public CompletionPolicy() {
    }

    /**
     * 判定讨论组是否完成
     *
     * @param progress 进度快照
     * @param now 当前时刻
     * @return 判定结果
     */
    public SessionAssessment assess(SessionProgress progress, Instant now) {
        String sessionId = progress.getSessionId();
        Duration elapsed = progress.getCreatedAt() == null || now == null
            ? null
            : Duration.between(progress.getCreatedAt(), now);

        if (progress.getStatus() == SessionStatus.COMPLETED) {
            logger.info("讨论组 " + sessionId + " 明确标记为完成");
            return SessionAssessment.completed(CompletionReason.EXPLICIT_COMPLETION, elapsed);
        }

        if (progress.getIteration() >= progress.getMaxIteration()) {
            logger.info("讨论组 " + sessionId + " 完成所有 " + progress.getMaxIteration() + " 轮迭代");
            return SessionAssessment.completed(CompletionReason.MAX_ITERATIONS, elapsed);
        }

        if (progress.getQuality() >= qualityThreshold) {
            logger.info(String.format("讨论组 %s 达到优秀质量标准 (%.3f)", sessionId, progress.getQuality()));
            return SessionAssessment.completed(CompletionReason.QUALITY_THRESHOLD, elapsed);
        }

        if (progress.getStatus().isTerminal()) {
            return SessionAssessment.completed(CompletionReason.TERMINAL_STATUS, elapsed);
        }

        if (elapsed == null) {
            return SessionAssessment.pending();
        }

        if (elapsed.compareTo(softTimeout) > 0 && progress.getIteration() >= softTimeoutMinIterations) {
            logger.warning(String.format("讨论组 %s 超时但已完成 %d 轮迭代，标记为完成",
                sessionId, progress.getIteration()));
            return SessionAssessment.completed(CompletionReason.SOFT_TIMEOUT, elapsed);
        }

        if (elapsed.compareTo(hardTimeout) > 0) {
            logger.warning(String.format("讨论组 %s 运行超过 %ds，强制标记为完成",
                sessionId, hardTimeout.getSeconds()));
            return SessionAssessment.completed(CompletionReason.HARD_TIMEOUT, elapsed);
        }

        return SessionAssessment.pending();
    }

    public double getQualityThreshold() {
        return qualityThreshold;
    }

    public void setQualityThreshold(double qualityThreshold) {
        this.qualityThreshold = qualityThreshold;
    }

    public Duration getSoftTimeout() {
        return softTimeout;
    }

    public void setSoftTimeout(Duration softTimeout) {
        this.softTimeout = softTimeout;
    }

    public int getSoftTimeoutMinIterations() {
        return softTimeoutMinIterations;
    }

    public void setSoftTimeoutMinIterations(int softTimeoutMinIterations) {
        this.softTimeoutMinIterations = softTimeoutMinIterations;
    }

    public Duration getHardTimeout() {
        return hardTimeout;
    }

    public void setHardTimeout(Duration hardTimeout) {
        this.hardTimeout = hardTimeout;
    }

    @Override
    public String toString() {
        return "CompletionPolicy{" +
                "qualityThreshold=" + qualityThreshold +
                ", softTimeout=" + softTimeout.getSeconds() + "s" +
                ", softTimeoutMinIterations=" + softTimeoutMinIterations +
                ", hardTimeout=" + hardTimeout.getSeconds() + "s" +
                '}';
    }
}
