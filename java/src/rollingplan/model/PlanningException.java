package rollingplan.model;

/**
 * 滚动规划核心的受检异常基类
 */
public class PlanningException extends Exception {

    private static final long serialVersionUID = 1L;

    public PlanningException(String message) {
        super(message);
    }

    public PlanningException(String message, Throwable cause) {
        super(message, cause);
    }
}
