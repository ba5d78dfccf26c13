package rollingplan.cycle;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 元任务集引用
 *
 * 元任务集由外部生成器产生，周期只保存其摘要和存储位置。
 */
public class MetaTaskReference implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String metaTaskSetId;
    private final Instant rangeStart;
    private final Instant rangeEnd;
    private final int windowCount;
    private final List<String> targetIds;
    private final String location;

    public MetaTaskReference(String metaTaskSetId, Instant rangeStart, Instant rangeEnd,
                             int windowCount, List<String> targetIds, String location) {
        this.metaTaskSetId = metaTaskSetId;
        this.rangeStart = rangeStart;
        this.rangeEnd = rangeEnd;
        this.windowCount = windowCount;
        this.targetIds = targetIds == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(targetIds));
        this.location = location;
    }

    public String getMetaTaskSetId() {
        return metaTaskSetId;
    }

    public Instant getRangeStart() {
        return rangeStart;
    }

    public Instant getRangeEnd() {
        return rangeEnd;
    }

    public int getWindowCount() {
        return windowCount;
    }

    public List<String> getTargetIds() {
        return targetIds;
    }

    /**
     * 元任务集的保存位置（文件路径等），未保存时为null
     */
    public String getLocation() {
        return location;
    }

    @Override
    public String toString() {
        return "MetaTaskReference{" +
                "id='" + metaTaskSetId + '\'' +
                ", range=" + rangeStart + " - " + rangeEnd +
                ", windows=" + windowCount +
                ", targets=" + targetIds.size() +
                '}';
    }
}
