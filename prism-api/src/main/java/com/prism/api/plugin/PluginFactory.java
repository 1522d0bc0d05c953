package com.prism.api.plugin;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * 插件工厂：插件入口的显式注册方式
 * <p>
 * Jar 或 classes 目录形式的插件通过 META-INF/services/com.prism.api.plugin.PluginFactory 注册实现类；
 * 宿主内嵌的插件可直接注册到 Core 的工厂注册表中。
 * </p>
 */
public interface PluginFactory {

    /**
     * 插件名称。子插件使用 "组名.子插件名"
     */
    String name();

    /**
     * 创建新的插件实例，每次加载（含重载）调用一次
     */
    PrismPlugin create();

    static PluginFactory of(String name, Supplier<? extends PrismPlugin> supplier) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(supplier, "supplier");
        return new PluginFactory() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public PrismPlugin create() {
                return supplier.get();
            }
        };
    }
}
