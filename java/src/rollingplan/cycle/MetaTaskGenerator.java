package rollingplan.cycle;

import rollingplan.model.PlanningException;
import rollingplan.model.Target;

import java.time.Instant;
import java.util.List;

/**
 * 元任务集生成器（可选的外部组件）
 */
public interface MetaTaskGenerator {

    /**
     * 为本周期的目标生成元任务集
     *
     * @param cycleId 周期ID
     * @param collectionTime 目标收集时刻（周期开始时间）
     * @param targets 本周期目标
     * @return 元任务集引用；无法生成时返回null
     * @throws PlanningException 生成失败
     */
    MetaTaskReference generate(String cycleId, Instant collectionTime, List<Target> targets)
            throws PlanningException;
}
