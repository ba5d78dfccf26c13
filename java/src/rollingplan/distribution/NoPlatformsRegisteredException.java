package rollingplan.distribution;

import rollingplan.model.PlanningException;

/**
 * 没有已注册的平台，本周期无法分发任务
 */
public class NoPlatformsRegisteredException extends PlanningException {

    private static final long serialVersionUID = 1L;

    public NoPlatformsRegisteredException(String message) {
        super(message);
    }
}
