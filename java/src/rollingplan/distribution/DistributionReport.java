package rollingplan.distribution;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 分发统计信息
 *
 * 记录一次分发的规模、耗时、分配情况与错误
 */
public class DistributionReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private long computationTimeMs;
    private int nTargets;
    private int nPlatforms;
    private int nPairs;
    private int nAssigned;
    private int nUnassigned;
    private int dispatchAttempts;
    private int dispatchFailures;
    private final List<DistributionError> errors = new ArrayList<>();

    public DistributionReport() {
    }

    void setComputationTimeMs(long computationTimeMs) {
        this.computationTimeMs = computationTimeMs;
    }

    void setCounts(int nTargets, int nPlatforms, int nPairs) {
        this.nTargets = nTargets;
        this.nPlatforms = nPlatforms;
        this.nPairs = nPairs;
    }

    void setAssignmentCounts(int nAssigned, int nUnassigned) {
        this.nAssigned = nAssigned;
        this.nUnassigned = nUnassigned;
    }

    synchronized void incrementDispatchAttempts() {
        dispatchAttempts++;
    }

    synchronized void addError(String targetId, String platformId, String errorType, String errorMessage) {
        errors.add(new DistributionError(targetId, platformId, errorType, errorMessage));
        if (DistributionError.DISPATCH_ERROR.equals(errorType)) {
            dispatchFailures++;
        }
    }

    // Getters
    public long getComputationTimeMs() {
        return computationTimeMs;
    }

    public int getNTargets() {
        return nTargets;
    }

    public int getNPlatforms() {
        return nPlatforms;
    }

    public int getNPairs() {
        return nPairs;
    }

    public int getNAssigned() {
        return nAssigned;
    }

    public int getNUnassigned() {
        return nUnassigned;
    }

    public synchronized int getDispatchAttempts() {
        return dispatchAttempts;
    }

    public synchronized int getDispatchFailures() {
        return dispatchFailures;
    }

    public synchronized List<DistributionError> getErrors() {
        return Collections.unmodifiableList(new ArrayList<>(errors));
    }

    @Override
    public String toString() {
        return String.format(
            "DistributionReport{time=%dms, targets=%d, platforms=%d, pairs=%d, assigned=%d, unassigned=%d, dispatch=%d/%d failed, errors=%d}",
            computationTimeMs, nTargets, nPlatforms, nPairs, nAssigned, nUnassigned,
            getDispatchFailures(), getDispatchAttempts(), getErrors().size()
        );
    }

    /**
     * 分发错误信息
     */
    public static class DistributionError implements Serializable {

        private static final long serialVersionUID = 1L;

        public static final String COMPUTATION_ERROR = "COMPUTATION_ERROR";
        public static final String POSITION_UNAVAILABLE = "POSITION_UNAVAILABLE";
        public static final String DISPATCH_ERROR = "DISPATCH_ERROR";

        private final String targetId;
        private final String platformId;
        private final String errorType;
        private final String errorMessage;

        public DistributionError(String targetId, String platformId,
                                 String errorType, String errorMessage) {
            this.targetId = targetId;
            this.platformId = platformId;
            this.errorType = errorType;
            this.errorMessage = errorMessage;
        }

        public String getTargetId() { return targetId; }
        public String getPlatformId() { return platformId; }
        public String getErrorType() { return errorType; }
        public String getErrorMessage() { return errorMessage; }
    }
}
