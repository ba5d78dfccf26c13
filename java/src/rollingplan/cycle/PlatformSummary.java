package rollingplan.cycle;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单个平台在本周期的讨论结果摘要
 */
public class PlatformSummary implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String platformId;
    private final List<String> assignedTargetIds;
    private final List<String> sessionIds;
    private final boolean discussionCompleted;
    private final boolean consensusReached;

    public PlatformSummary(String platformId, List<String> assignedTargetIds, List<String> sessionIds,
                           boolean discussionCompleted, boolean consensusReached) {
        this.platformId = platformId;
        this.assignedTargetIds = Collections.unmodifiableList(new ArrayList<>(assignedTargetIds));
        this.sessionIds = Collections.unmodifiableList(new ArrayList<>(sessionIds));
        this.discussionCompleted = discussionCompleted;
        this.consensusReached = consensusReached;
    }

    public String getPlatformId() {
        return platformId;
    }

    public List<String> getAssignedTargetIds() {
        return assignedTargetIds;
    }

    /**
     * 该平台参与的讨论组
     */
    public List<String> getSessionIds() {
        return sessionIds;
    }

    /**
     * 参与的讨论组全部正常解散（未被强制清理）
     */
    public boolean isDiscussionCompleted() {
        return discussionCompleted;
    }

    /**
     * 至少一个讨论组以完成标记、迭代完成或质量达标结束
     */
    public boolean isConsensusReached() {
        return consensusReached;
    }

    @Override
    public String toString() {
        return "PlatformSummary{" +
                "platformId='" + platformId + '\'' +
                ", targets=" + assignedTargetIds +
                ", sessions=" + sessionIds +
                ", discussionCompleted=" + discussionCompleted +
                ", consensusReached=" + consensusReached +
                '}';
    }
}
