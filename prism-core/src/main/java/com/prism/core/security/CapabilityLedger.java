package com.prism.core.security;

import com.prism.api.security.PermissionService;

import java.util.Set;

/**
 * 能力账本：插件 -> 已授予能力集合
 * <p>
 * 唯一的写入方是加载器，数据只来自插件自己的锁文件。
 * </p>
 */
public interface CapabilityLedger extends PermissionService {

    /**
     * 用锁文件内容整体替换插件的授权集合
     *
     * @return 实际授予的能力名称
     */
    Set<String> grantFromLock(String pluginName, LockFile lockFile);

    /**
     * 移除插件的授权（违规记录保留）
     */
    void release(String pluginName);

    boolean hasCapabilityWithPrefix(String pluginName, String prefix);

    void logViolation(String pluginName, String message);
}
