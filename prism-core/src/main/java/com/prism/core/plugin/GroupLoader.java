package com.prism.core.plugin;

import com.prism.api.config.PluginManifest;
import com.prism.api.plugin.PluginFactory;
import com.prism.api.plugin.PrismPlugin;
import com.prism.api.security.PermissionService;
import com.prism.core.context.CorePluginContext;
import com.prism.core.loader.DependencyResolver;
import com.prism.core.loader.PluginFactoryRegistry;
import com.prism.core.loader.PluginManifestLoader;
import com.prism.core.security.PluginScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.Executor;

/**
 * 插件组加载器：子插件（私有依赖图）与预设调用链
 * <pre>
 * group.yml:
 *   subplugins:
 *     auth: {enabled: true}
 *   dependencies:
 *     llm: [auth]
 *   chains:
 *     default: {plugins: [auth, llm, "{next}"], description: ...}
 * </pre>
 * chains.yml 中的 chains 优先于 group.yml；也接受旧的列表写法 [{name, steps: [{plugin}]}]。
 */
@Slf4j
@RequiredArgsConstructor
public class GroupLoader {

    public static final String SUBPLUGINS_DIR = "subplugins";
    public static final String CHAINS_FILE = "chains.yml";
    private static final String NEXT_TOKEN = "{next}";

    private final PluginFactoryRegistry factoryRegistry;
    private final PermissionService permissionService;

    /**
     * 加载组内全部子插件并注册预设链；子插件的实例化与初始化都在组的作用域内执行
     *
     * @throws com.prism.api.exception.DependencyCycleException 子插件之间存在循环依赖
     */
    public PluginGroup load(String groupName, Path groupRoot, Path dataDirectory, ClassLoader classLoader,
                            Executor executor) {
        Map<String, Object> config = PluginManifestLoader.readYaml(groupRoot.resolve(PluginManifestLoader.GROUP_FILE));
        Map<String, Object> subConfig = asMap(config.get("subplugins"));
        Map<String, List<String>> dependencies = normalizeDependencies(config.get("dependencies"));

        List<String> enabled = discoverEnabled(groupName, groupRoot.resolve(SUBPLUGINS_DIR), subConfig);

        DependencyResolver resolver = new DependencyResolver();
        for (String sub : enabled) {
            List<String> deps = new ArrayList<>();
            for (String dep : dependencies.getOrDefault(sub, List.of())) {
                if (enabled.contains(dep)) {
                    deps.add(dep);
                }
            }
            resolver.addPlugin(sub, deps);
        }
        List<String> order = resolver.resolve();

        Map<String, PluginGroup.SubPlugin> loaded = new LinkedHashMap<>();
        for (String sub : order) {
            List<String> unmet = new ArrayList<>();
            for (String dep : resolver.getDependencies(sub)) {
                if (!loaded.containsKey(dep)) {
                    unmet.add(dep);
                }
            }
            if (!unmet.isEmpty()) {
                log.error("[{}] Skip loading sub-plugin {}, unmet dependencies: {}", groupName, sub, unmet);
                continue;
            }
            PluginGroup.SubPlugin subPlugin =
                    loadSubPlugin(groupName, sub, groupRoot, dataDirectory, classLoader, executor);
            if (subPlugin != null) {
                loaded.put(sub, subPlugin);
            }
        }

        Map<String, PluginGroup.ChainPreset> presets = loadPresets(groupName, groupRoot, config, loaded);
        log.info("[{}] Plugin group loaded: {} sub-plugins, {} chains", groupName, loaded.size(), presets.size());
        return new PluginGroup(groupName, loaded, presets);
    }

    /**
     * 逆序关闭子插件
     */
    public void shutdown(PluginGroup group) {
        List<PluginGroup.SubPlugin> subs = new ArrayList<>(group.getSubPlugins().values());
        Collections.reverse(subs);
        for (PluginGroup.SubPlugin sub : subs) {
            try {
                PluginScope.runAs(group.getName(), () -> sub.instance().shutdown());
            } catch (Exception e) {
                log.error("[{}] Error shutting down sub-plugin {}", group.getName(), sub.name(), e);
            }
        }
    }

    private PluginGroup.SubPlugin loadSubPlugin(String groupName, String sub, Path groupRoot,
                                                Path dataDirectory, ClassLoader classLoader, Executor executor) {
        String fullName = groupName + "." + sub;
        Path subDir = groupRoot.resolve(SUBPLUGINS_DIR).resolve(sub);
        try {
            PluginFactory factory = factoryRegistry.find(fullName, classLoader).orElse(null);
            if (factory == null) {
                log.error("[{}] No entry point registered for sub-plugin {}", groupName, fullName);
                return null;
            }
            Map<String, Object> properties = new LinkedHashMap<>();
            String version = "0.0.0";
            if (PluginManifestLoader.hasManifest(subDir)) {
                PluginManifest manifest = PluginManifestLoader.load(subDir);
                version = manifest.getVersion();
                properties.putAll(manifest.getProperties());
            }
            Path configFile = subDir.resolve("config.yml");
            if (Files.isRegularFile(configFile)) {
                properties.putAll(PluginManifestLoader.readYaml(configFile));
            }
            CorePluginContext context = new CorePluginContext(
                    fullName, version, subDir, dataDirectory, properties, permissionService, executor);

            PrismPlugin instance = PluginScope.callAs(groupName, () -> {
                PrismPlugin created = factory.create();
                created.initialize(context);
                return created;
            });
            log.info("[{}] Loaded sub-plugin: {}", groupName, sub);
            return new PluginGroup.SubPlugin(sub, fullName, subDir, instance);
        } catch (Exception e) {
            log.error("[{}] Error loading sub-plugin {}: {}", groupName, sub, e.getMessage(), e);
            return null;
        }
    }

    private List<String> discoverEnabled(String groupName, Path subpluginsDir, Map<String, Object> subConfig) {
        TreeSet<String> enabled = new TreeSet<>();
        if (!Files.isDirectory(subpluginsDir)) {
            log.warn("[{}] Sub-plugins directory not found: {}", groupName, subpluginsDir);
            return new ArrayList<>();
        }
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(subpluginsDir, Files::isDirectory)) {
            for (Path dir : dirs) {
                String sub = dir.getFileName().toString();
                if (sub.startsWith(".")) {
                    continue;
                }
                Map<String, Object> cfg = asMap(subConfig.get(sub));
                if (!Boolean.FALSE.equals(cfg.get("enabled"))) {
                    enabled.add(sub);
                }
            }
        } catch (IOException e) {
            log.error("[{}] Failed to list sub-plugins in {}", groupName, subpluginsDir, e);
        }
        return new ArrayList<>(enabled);
    }

    private Map<String, PluginGroup.ChainPreset> loadPresets(String groupName, Path groupRoot,
                                                             Map<String, Object> groupConfig,
                                                             Map<String, PluginGroup.SubPlugin> loaded) {
        Object raw = null;
        Path chainsFile = groupRoot.resolve(CHAINS_FILE);
        if (Files.isRegularFile(chainsFile)) {
            try {
                raw = PluginManifestLoader.readYaml(chainsFile).get("chains");
            } catch (RuntimeException e) {
                log.error("[{}] Failed to load chains config: {}", groupName, e.getMessage());
            }
        }
        if (isEmpty(raw)) {
            raw = groupConfig.get("chains");
        }

        Map<String, Map<String, Object>> normalized = new LinkedHashMap<>();
        if (raw instanceof Map<?, ?> map) {
            map.forEach((k, v) -> normalized.put(String.valueOf(k), asMap(v)));
        } else if (raw instanceof List<?> list) {
            for (Object item : list) {
                normalizeLegacyEntry(groupName, item, normalized);
            }
        } else if (raw != null) {
            log.warn("[{}] Chains config has invalid type; expected mapping or list, got {}",
                    groupName, raw.getClass().getSimpleName());
        }

        Map<String, PluginGroup.ChainPreset> presets = new LinkedHashMap<>();
        normalized.forEach((chainName, cfg) -> {
            List<String> plugins = new ArrayList<>();
            Object refs = cfg.get("plugins");
            if (refs instanceof List<?> list) {
                for (Object ref : list) {
                    String value = String.valueOf(ref);
                    if (NEXT_TOKEN.equals(value)) {
                        plugins.add(PluginGroup.NEXT_PLACEHOLDER);
                    } else if (loaded.containsKey(value)) {
                        plugins.add(groupName + "." + value);
                    } else {
                        plugins.add(value);
                    }
                }
            }
            Object description = cfg.get("description");
            presets.put(chainName, new PluginGroup.ChainPreset(
                    chainName, description == null ? "" : String.valueOf(description), plugins));
            log.info("[{}] Registered chain: {}:{}", groupName, groupName, chainName);
        });
        return presets;
    }

    private void normalizeLegacyEntry(String groupName, Object item, Map<String, Map<String, Object>> target) {
        if (!(item instanceof Map<?, ?> entry)) {
            log.warn("[{}] Invalid chain entry (not a mapping), skipped", groupName);
            return;
        }
        Object name = entry.get("name");
        if (!(name instanceof String chainName) || chainName.isBlank()) {
            log.warn("[{}] Chain entry missing valid 'name', skipped", groupName);
            return;
        }
        Object steps = entry.get("steps");
        if (steps != null && !(steps instanceof List)) {
            log.warn("[{}] Chain '{}' has invalid 'steps', skipped", groupName, chainName);
            return;
        }
        List<String> plugins = new ArrayList<>();
        if (steps != null) {
            for (Object step : (List<?>) steps) {
                if (step instanceof Map<?, ?> stepMap && stepMap.get("plugin") != null) {
                    plugins.add(String.valueOf(stepMap.get("plugin")));
                } else if (step instanceof String s) {
                    plugins.add(s);
                }
            }
        }
        Map<String, Object> cfg = new LinkedHashMap<>();
        cfg.put("description", entry.get("description"));
        cfg.put("plugins", plugins);
        target.put(chainName, cfg);
    }

    private static Map<String, List<String>> normalizeDependencies(Object raw) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        asMap(raw).forEach((name, value) -> {
            List<String> deps = new ArrayList<>();
            if (value instanceof List<?> list) {
                for (Object spec : list) {
                    if (spec != null) {
                        deps.add(PluginManifestLoader.parseDependencySpec(String.valueOf(spec)).name());
                    }
                }
            } else if (value instanceof String s) {
                deps.add(PluginManifestLoader.parseDependencySpec(s).name());
            }
            result.put(name, deps);
        });
        return result;
    }

    private static Map<String, Object> asMap(Object value) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            map.forEach((k, v) -> result.put(String.valueOf(k), v));
        }
        return result;
    }

    private static boolean isEmpty(Object raw) {
        return raw == null
                || (raw instanceof Map<?, ?> m && m.isEmpty())
                || (raw instanceof List<?> l && l.isEmpty());
    }
}
