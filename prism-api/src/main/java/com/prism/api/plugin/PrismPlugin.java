package com.prism.api.plugin;

import com.prism.api.context.PluginContext;
import com.prism.api.context.RequestContext;

/**
 * 插件生命周期与处理接口
 * 所有插件的主入口类必须实现此接口
 *
 * @author Prism
 */
public interface PrismPlugin {

    /**
     * 插件加载时调用，运行在该插件的沙箱作用域内
     *
     * @param context 插件上下文，提供环境交互能力
     */
    default void initialize(PluginContext context) throws Exception {
        // Default empty implementation
    }

    /**
     * 插件卸载或重载前调用
     * 用于释放资源
     */
    default void shutdown() {
        // Default empty implementation
    }

    /**
     * 处理调用链中的一步
     *
     * @param context 当前请求上下文
     * @return {@link Flow#NEXT} 交还控制权给执行器继续下一步；{@link Flow#END} 结束调用链
     */
    Flow handle(RequestContext context) throws Exception;
}
