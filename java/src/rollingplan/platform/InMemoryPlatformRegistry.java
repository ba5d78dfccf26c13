package rollingplan.platform;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.logging.Logger;

/**
 * 内存平台注册表
 *
 * 线程安全，按平台ID排序返回
 */
public class InMemoryPlatformRegistry implements PlatformRegistry {

    private static final Logger logger = Logger.getLogger(InMemoryPlatformRegistry.class.getName());

    private final Map<String, PlatformHandle> platforms = new ConcurrentSkipListMap<>();

    public void register(PlatformHandle platform) {
        PlatformHandle previous = platforms.put(platform.getId(), platform);
        if (previous != null) {
            logger.warning("平台 " + platform.getId() + " 重复注册，已替换");
        }
    }

    public boolean unregister(String platformId) {
        return platforms.remove(platformId) != null;
    }

    public int size() {
        return platforms.size();
    }

    @Override
    public Map<String, PlatformHandle> getAllPlatforms() {
        return Collections.unmodifiableMap(new ConcurrentSkipListMap<>(platforms));
    }
}
