package com.prism.api.context;

import com.prism.api.security.PermissionService;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * 插件上下文
 * 提供插件运行时的环境信息和能力获取入口
 *
 * @author Prism
 */
public interface PluginContext {

    /**
     * 获取当前插件的唯一名称
     */
    String getPluginName();

    /**
     * 插件清单中声明的版本
     */
    String getVersion();

    /**
     * 插件根目录（沙箱内可自由读写）
     */
    Path getRootDirectory();

    /**
     * 插件专属临时数据目录（沙箱内可自由读写）
     */
    Path getDataDirectory();

    /**
     * 获取清单中 properties 段的配置
     *
     * @param key 配置键
     * @return 配置值
     */
    Optional<String> getProperty(String key);

    /**
     * 获取 Core 提供的权限查询服务（只读）
     */
    PermissionService getPermissionService();

    /**
     * 获取插件专用的后台执行器
     * <p>
     * 提交的任务在执行线程中沿用提交方的插件身份（不在任何插件作用域内提交时使用本插件的身份），
     * 受控操作照常受检。插件需要异步执行时应使用它，而不是公共线程池。
     * </p>
     */
    Executor getExecutor();
}
