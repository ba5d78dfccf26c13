package rollingplan.platform;

import java.util.Map;

/**
 * 平台注册表
 */
public interface PlatformRegistry {

    /**
     * @return 平台ID到平台引用的映射，无平台时为空映射
     */
    Map<String, PlatformHandle> getAllPlatforms();
}
