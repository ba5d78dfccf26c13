package rollingplan.discussion;

import java.util.List;

/**
 * 讨论组会话存储
 *
 * 讨论组由外部智能体运行时托管，规划核心只通过该接口读取进度、解散和清理。
 */
public interface SessionStore {

    /**
     * 当前活跃的讨论组ID
     */
    List<String> listActiveSessions() throws SessionStoreException;

    /**
     * 读取讨论组进度（已移除的讨论组仍可查询最终状态）
     *
     * @param sessionId 讨论组ID
     * @return 进度快照
     * @throws SessionStoreException 讨论组不存在或读取失败
     */
    SessionProgress getProgress(String sessionId) throws SessionStoreException;

    /**
     * 解散讨论组
     *
     * @param sessionId 讨论组ID
     * @return 是否解散成功
     */
    boolean completeSession(String sessionId) throws SessionStoreException;

    /**
     * 强制更新讨论组状态
     */
    void forceUpdateStatus(String sessionId, SessionStatus status) throws SessionStoreException;

    /**
     * 从活跃登记中移除讨论组
     *
     * @return 移除前是否处于活跃登记中
     */
    boolean removeSession(String sessionId) throws SessionStoreException;
}
