package com.prism.core.loader;

import com.prism.api.plugin.PluginFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 插件入口注册表
 * <p>
 * 查找顺序：宿主显式注册的工厂优先；否则在插件类加载器上通过 {@link ServiceLoader}
 * 查找 name() 与插件名相同的 {@link PluginFactory}。
 * </p>
 */
@Slf4j
public class PluginFactoryRegistry {

    private final Map<String, PluginFactory> factories = new ConcurrentHashMap<>();

    public void register(PluginFactory factory) {
        PluginFactory previous = factories.put(factory.name(), factory);
        if (previous != null && previous != factory) {
            log.warn("Plugin factory [{}] replaced", factory.name());
        }
    }

    public void unregister(String pluginName) {
        factories.remove(pluginName);
    }

    public boolean isRegistered(String pluginName) {
        return factories.containsKey(pluginName);
    }

    /**
     * @param pluginName  插件名（子插件为 "组名.子插件名"）
     * @param classLoader 插件类加载器，可为 null
     */
    public Optional<PluginFactory> find(String pluginName, ClassLoader classLoader) {
        PluginFactory hosted = factories.get(pluginName);
        if (hosted != null) {
            return Optional.of(hosted);
        }
        if (classLoader == null) {
            return Optional.empty();
        }
        try {
            for (PluginFactory factory : ServiceLoader.load(PluginFactory.class, classLoader)) {
                if (pluginName.equals(factory.name())) {
                    return Optional.of(factory);
                }
            }
        } catch (ServiceConfigurationError e) {
            log.error("[{}] Invalid PluginFactory service registration: {}", pluginName, e.getMessage());
        }
        return Optional.empty();
    }
}
