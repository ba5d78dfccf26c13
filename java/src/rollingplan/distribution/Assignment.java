package rollingplan.distribution;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 任务分配结果
 *
 * 平台ID到目标ID集合的映射。每个目标最多出现在一个平台的集合中；
 * 找不到可用平台的目标记录在未分配列表中。
 */
public class Assignment implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Map<String, Set<String>> platformTargets = new TreeMap<>();
    private final Map<String, String> targetPlatform = new HashMap<>();
    private final List<String> unassignedTargetIds = new ArrayList<>();

    /**
     * 空分配结果
     */
    public static Assignment empty() {
        return new Assignment();
    }

    /**
     * 将目标分配给平台
     *
     * @throws IllegalStateException 目标已分配给其他平台
     */
    public void assign(String platformId, String targetId) {
        String existing = targetPlatform.get(targetId);
        if (existing != null && !existing.equals(platformId)) {
            throw new IllegalStateException("目标 " + targetId + " 已分配给平台 " + existing);
        }
        targetPlatform.put(targetId, platformId);
        unassignedTargetIds.remove(targetId);
        platformTargets.computeIfAbsent(platformId, k -> new LinkedHashSet<>()).add(targetId);
    }

    /**
     * 记录未能分配的目标
     */
    public void markUnassigned(String targetId) {
        if (!targetPlatform.containsKey(targetId) && !unassignedTargetIds.contains(targetId)) {
            unassignedTargetIds.add(targetId);
        }
    }

    /**
     * 获取平台分配到的目标
     */
    public Set<String> getTargets(String platformId) {
        Set<String> targets = platformTargets.get(platformId);
        return targets == null ? Collections.emptySet() : Collections.unmodifiableSet(targets);
    }

    /**
     * 获取目标所在的平台，未分配时为null
     */
    public String getPlatformFor(String targetId) {
        return targetPlatform.get(targetId);
    }

    /**
     * 获取完整映射（只读）
     */
    public Map<String, Set<String>> asMap() {
        Map<String, Set<String>> copy = new TreeMap<>();
        for (Map.Entry<String, Set<String>> entry : platformTargets.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue())));
        }
        return Collections.unmodifiableMap(copy);
    }

    public Set<String> getPlatformIds() {
        return Collections.unmodifiableSet(platformTargets.keySet());
    }

    public List<String> getUnassignedTargetIds() {
        return Collections.unmodifiableList(unassignedTargetIds);
    }

    public int getAssignedCount() {
        return targetPlatform.size();
    }

    public boolean isEmpty() {
        return targetPlatform.isEmpty();
    }

    @Override
    public String toString() {
        return "Assignment{" + platformTargets + ", unassigned=" + unassignedTargetIds + '}';
    }
}
