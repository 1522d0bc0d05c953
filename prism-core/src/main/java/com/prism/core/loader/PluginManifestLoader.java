package com.prism.core.loader;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prism.api.config.PluginManifest;
import com.prism.api.exception.ConfigurationException;
import com.prism.api.exception.MissingArtifactException;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 读取插件清单，不执行任何插件代码
 * <p>
 * 查找顺序：plugin.yml、plugin.yaml、plugin.json；插件组在缺少上述文件时读取 group.yml 的同名字段。
 * 目录名即插件的规范名称，与清单中的 name 不一致时以目录名为准并告警。
 * </p>
 */
@Slf4j
public final class PluginManifestLoader {

    public static final String GROUP_FILE = "group.yml";
    private static final List<String> MANIFEST_FILES = List.of("plugin.yml", "plugin.yaml", "plugin.json");

    private static final ObjectMapper JSON = new ObjectMapper();

    private PluginManifestLoader() {
    }

    public static boolean isGroup(Path pluginDir) {
        return Files.isRegularFile(pluginDir.resolve(GROUP_FILE));
    }

    public static boolean hasManifest(Path pluginDir) {
        for (String name : MANIFEST_FILES) {
            if (Files.isRegularFile(pluginDir.resolve(name))) {
                return true;
            }
        }
        return isGroup(pluginDir);
    }

    /**
     * @throws MissingArtifactException 目录中没有任何清单
     * @throws ConfigurationException   清单格式错误
     */
    public static PluginManifest load(Path pluginDir) {
        String dirName = pluginDir.getFileName().toString();
        Map<String, Object> raw = null;
        for (String name : MANIFEST_FILES) {
            Path file = pluginDir.resolve(name);
            if (Files.isRegularFile(file)) {
                raw = name.endsWith(".json") ? readJson(file) : readYaml(file);
                break;
            }
        }
        if (raw == null && isGroup(pluginDir)) {
            raw = readYaml(pluginDir.resolve(GROUP_FILE));
        }
        if (raw == null) {
            throw new MissingArtifactException(dirName, "No manifest found in " + pluginDir);
        }
        PluginManifest manifest = toManifest(raw, dirName);
        manifest.validate();
        return manifest;
    }

    /**
     * 从已解析的键值结构构建清单，YAML 与 JSON 共用
     */
    public static PluginManifest toManifest(Map<String, Object> raw, String canonicalName) {
        PluginManifest manifest = new PluginManifest();

        Object declaredName = raw.get("name");
        if (declaredName != null && !String.valueOf(declaredName).equals(canonicalName)) {
            log.warn("[{}] Manifest declares name '{}', using directory name", canonicalName, declaredName);
        }
        manifest.setName(canonicalName);
        if (raw.get("version") != null) {
            manifest.setVersion(String.valueOf(raw.get("version")));
        }
        manifest.setDescription(stringOrNull(raw.get("description")));
        manifest.setAuthor(stringOrNull(raw.get("author")));

        Object deps = raw.get("dependencies");
        if (deps instanceof List<?> list) {
            List<PluginManifest.DependencySpec> specs = new ArrayList<>();
            for (Object item : list) {
                if (item != null) {
                    specs.add(parseDependencySpec(String.valueOf(item)));
                }
            }
            manifest.setDependencies(specs);
        } else if (deps != null && !(deps instanceof Map)) {
            // group.yml 中的 dependencies 是子插件依赖表，不属于清单
            throw new ConfigurationException("'dependencies' must be a list in manifest of " + canonicalName);
        }

        Object perms = raw.get("permissions");
        if (perms instanceof List<?> list) {
            List<PluginManifest.PermissionRequest> requests = new ArrayList<>();
            for (Object item : list) {
                requests.add(toPermissionRequest(item, canonicalName));
            }
            manifest.setPermissions(requests);
        } else if (perms != null) {
            throw new ConfigurationException("'permissions' must be a list in manifest of " + canonicalName);
        }

        Object props = raw.get("properties");
        if (props instanceof Map<?, ?> map) {
            Map<String, Object> properties = new LinkedHashMap<>();
            map.forEach((k, v) -> properties.put(String.valueOf(k), v));
            manifest.setProperties(properties);
        }
        return manifest;
    }

    public static PluginManifest.DependencySpec parseDependencySpec(String spec) {
        return PluginManifest.DependencySpec.parse(spec);
    }

    private static PluginManifest.PermissionRequest toPermissionRequest(Object item, String pluginName) {
        if (item instanceof Map<?, ?> map) {
            return new PluginManifest.PermissionRequest(
                    stringOrNull(map.get("type")),
                    stringOrNull(map.get("resource")),
                    stringOrNull(map.get("description")));
        }
        if (item instanceof String s) {
            // 简写："type" 或 "type:resource"
            int idx = s.indexOf(':');
            return idx < 0
                    ? new PluginManifest.PermissionRequest(s, null, null)
                    : new PluginManifest.PermissionRequest(s.substring(0, idx), s.substring(idx + 1), null);
        }
        throw new ConfigurationException("Invalid permission entry in manifest of " + pluginName + ": " + item);
    }

    public static Map<String, Object> readYaml(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            Object loaded = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
            if (loaded == null) {
                return new LinkedHashMap<>();
            }
            if (!(loaded instanceof Map<?, ?> map)) {
                throw new ConfigurationException("Root of " + file + " must be a mapping");
            }
            Map<String, Object> result = new LinkedHashMap<>();
            map.forEach((k, v) -> result.put(String.valueOf(k), v));
            return result;
        } catch (IOException | YAMLException e) {
            throw new ConfigurationException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> readJson(Path file) {
        try {
            Map<String, Object> map = JSON.readValue(file.toFile(), new TypeReference<LinkedHashMap<String, Object>>() {
            });
            return map == null ? new LinkedHashMap<>() : map;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
