package com.prism.core.plugin.event;

import java.util.Set;

/**
 * 运行时内部事件（组件间通信用）
 * 注意：这是内部事件，不暴露给插件
 */
public sealed interface RuntimeEvent {

    // ===== 生命周期事件 =====

    /**
     * 插件（或插件组）已加载
     */
    record PluginLoaded(String pluginName, String version, boolean group) implements RuntimeEvent {
    }

    /**
     * 插件已卸载
     */
    record PluginUnloaded(String pluginName) implements RuntimeEvent {
    }

    /**
     * 插件未通过加载闸门
     */
    record PluginSkipped(String pluginName, String reason) implements RuntimeEvent {
    }

    // ===== 配置事件 =====

    /**
     * 路由配置变更，routes 为空表示全部
     */
    record RoutesChanged(Set<String> routes) implements RuntimeEvent {
    }
}
