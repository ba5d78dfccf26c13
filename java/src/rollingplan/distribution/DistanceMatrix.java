package rollingplan.distribution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * 距离矩阵
 *
 * 行按目标插入顺序，列按平台ID升序
 */
public class DistanceMatrix {

    // targetId -> (platformId -> DistanceResult)
    private final Map<String, Map<String, DistanceResult>> rows = new LinkedHashMap<>();

    /**
     * 添加结果
     */
    public void put(DistanceResult result) {
        rows.computeIfAbsent(result.getTargetId(), k -> new TreeMap<>())
            .put(result.getPlatformId(), result);
    }

    /**
     * 预留目标行（无平台时保持空行）
     */
    public void addRow(String targetId) {
        rows.computeIfAbsent(targetId, k -> new TreeMap<>());
    }

    /**
     * 获取指定目标的一行
     */
    public Map<String, DistanceResult> getRow(String targetId) {
        Map<String, DistanceResult> row = rows.get(targetId);
        return row == null ? Collections.emptyMap() : Collections.unmodifiableMap(row);
    }

    public DistanceResult get(String targetId, String platformId) {
        Map<String, DistanceResult> row = rows.get(targetId);
        return row == null ? null : row.get(platformId);
    }

    public int getTargetCount() {
        return rows.size();
    }

    /**
     * 矩阵中的结果总数
     */
    public int size() {
        return rows.values().stream().mapToInt(Map::size).sum();
    }
}
