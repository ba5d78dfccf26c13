package rollingplan.discussion;

import rollingplan.model.PlanningException;

/**
 * 会话存储访问失败（会话不存在、宿主运行时不可用等）
 */
public class SessionStoreException extends PlanningException {

    private static final long serialVersionUID = 1L;

    public SessionStoreException(String message) {
        super(message);
    }

    public SessionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
