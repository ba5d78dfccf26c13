package rollingplan.distribution;

import rollingplan.model.Target;
import rollingplan.platform.PlatformHandle;

import java.util.List;
import java.util.Map;

/**
 * 任务分发器
 */
public interface TaskDistributor {

    /**
     * 计算分配并将任务分发给平台
     *
     * @param targets 目标列表
     * @param platforms 平台ID到平台引用的映射
     * @return 分配结果
     * @throws NoPlatformsRegisteredException 平台映射为空
     */
    Assignment distribute(List<Target> targets, Map<String, PlatformHandle> platforms)
        throws NoPlatformsRegisteredException;
}
