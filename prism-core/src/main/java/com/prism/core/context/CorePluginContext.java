package com.prism.core.context;

import com.prism.api.context.PluginContext;
import com.prism.api.security.PermissionService;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Core 提供给插件的上下文实现
 */
@Getter
@RequiredArgsConstructor
public class CorePluginContext implements PluginContext {

    private final String pluginName;
    private final String version;
    private final Path rootDirectory;
    private final Path dataDirectory;
    private final Map<String, Object> properties;
    private final PermissionService permissionService;
    private final Executor executor;

    @Override
    public Optional<String> getProperty(String key) {
        Object value = properties == null ? null : properties.get(key);
        return Optional.ofNullable(value).map(String::valueOf);
    }
}
