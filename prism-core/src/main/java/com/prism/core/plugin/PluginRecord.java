package com.prism.core.plugin;

import com.prism.api.config.PluginManifest;
import com.prism.api.plugin.PrismPlugin;
import com.prism.core.classloader.PluginClassLoader;
import lombok.Getter;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * 已加载插件：实例 + 清单 + 目录 + 授权快照
 * 加载成功时创建，卸载或重载时销毁
 */
@Getter
public class PluginRecord {

    private final String name;

    private final PluginManifest manifest;

    private final Path rootDirectory;

    private final Path dataDirectory;

    private final PrismPlugin instance;

    /**
     * 插件自带代码时的类加载器，宿主注册的插件为 null
     */
    private final PluginClassLoader classLoader;

    /**
     * 加载时从锁文件得到的授权
     */
    private final Set<String> grantedCapabilities;

    /**
     * 插件组信息，普通插件为 null
     */
    private final PluginGroup group;

    private final Instant loadedAt = Instant.now();

    public PluginRecord(String name, PluginManifest manifest, Path rootDirectory, Path dataDirectory,
                        PrismPlugin instance, PluginClassLoader classLoader,
                        Set<String> grantedCapabilities, PluginGroup group) {
        this.name = name;
        this.manifest = manifest;
        this.rootDirectory = rootDirectory;
        this.dataDirectory = dataDirectory;
        this.instance = instance;
        this.classLoader = classLoader;
        this.grantedCapabilities = Set.copyOf(grantedCapabilities);
        this.group = group;
    }

    public String getVersion() {
        return manifest.getVersion();
    }

    public boolean isGroup() {
        return group != null;
    }

    public Optional<PluginGroup> group() {
        return Optional.ofNullable(group);
    }

    @Override
    public String toString() {
        return String.format("PluginRecord{name='%s', version='%s', group=%s}", name, getVersion(), isGroup());
    }
}
