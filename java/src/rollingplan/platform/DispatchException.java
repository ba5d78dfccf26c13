package rollingplan.platform;

import rollingplan.model.PlanningException;

/**
 * 平台拒绝或无法接收任务
 */
public class DispatchException extends PlanningException {

    private static final long serialVersionUID = 1L;

    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
