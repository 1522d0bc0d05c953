package com.prism.api.security;

import java.util.List;
import java.util.Set;

/**
 * Core 提供 - 权限查询服务（只读视图）
 * 授权来源只有安装流程生成的锁文件，插件无法通过此接口修改授权。
 *
 * @author Prism
 */
public interface PermissionService {

    /**
     * 检查插件是否持有某项能力
     *
     * @param pluginName 插件名称
     * @param capability 能力名称，例如 {@link Capabilities#FILE_READ_PLUGIN}
     * @return 持有则返回 true
     */
    boolean isGranted(String pluginName, String capability);

    /**
     * 获取插件当前持有的全部能力（不可变快照）
     */
    Set<String> grantedCapabilities(String pluginName);

    /**
     * 获取插件的违规记录（按发生顺序）
     */
    List<String> getViolations(String pluginName);
}
