package com.prism.core.config;

import com.prism.api.exception.ConfigurationException;
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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 从 YAML 读取 {@link PrismConfig}
 * <pre>
 * prism:
 *   plugin-home: plugins
 *   hot-reload: true
 *   routes:
 *     /chat: [auth, provider]
 * </pre>
 * 键名同时接受 kebab-case、snake_case 与 camelCase；根节点 prism 可省略。
 */
@Slf4j
public final class PrismConfigLoader {

    private PrismConfigLoader() {
    }

    public static PrismConfig load(Path file) {
        if (!Files.isRegularFile(file)) {
            log.info("Config file {} not found, using defaults", file);
            return PrismConfig.defaults();
        }
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read config file " + file + ": " + e.getMessage(), e);
        }
    }

    public static PrismConfig load(InputStream inputStream) {
        Object root;
        try {
            root = new Yaml(new SafeConstructor(new LoaderOptions())).load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed config: " + e.getMessage(), e);
        }
        if (root == null) {
            return PrismConfig.defaults();
        }
        if (!(root instanceof Map<?, ?> map)) {
            throw new ConfigurationException("Config root must be a mapping");
        }
        Map<String, Object> values = normalize(map);
        Object nested = values.get("prism");
        if (nested instanceof Map<?, ?> prism) {
            values = normalize(prism);
        }
        return bind(values);
    }

    private static PrismConfig bind(Map<String, Object> v) {
        PrismConfig.PrismConfigBuilder b = PrismConfig.builder();
        if (v.containsKey("projectroot")) b.projectRoot(string(v, "projectroot"));
        if (v.containsKey("pluginhome")) b.pluginHome(string(v, "pluginhome"));
        if (v.containsKey("securedirectory")) b.secureDirectory(string(v, "securedirectory"));
        if (v.containsKey("tempdatadirectory")) b.tempDataDirectory(string(v, "tempdatadirectory"));
        if (v.containsKey("registryfile")) b.registryFile(string(v, "registryfile"));
        if (v.containsKey("autoload")) b.autoLoad(bool(v, "autoload"));
        if (v.containsKey("enabled")) b.enabled(stringList(v.get("enabled"), "enabled"));
        if (v.containsKey("verifysignatures")) b.verifySignatures(bool(v, "verifysignatures"));
        if (v.containsKey("trustedkeysdirectory")) b.trustedKeysDirectory(string(v, "trustedkeysdirectory"));
        if (v.containsKey("strictversionconstraints")) b.strictVersionConstraints(bool(v, "strictversionconstraints"));
        if (v.containsKey("hotreload")) b.hotReload(bool(v, "hotreload"));
        if (v.containsKey("hotreloadintervalms")) b.hotReloadIntervalMs(number(v, "hotreloadintervalms"));
        if (v.containsKey("hotreloadusehash")) b.hotReloadUseHash(bool(v, "hotreloadusehash"));
        if (v.containsKey("privilegedprefix")) b.privilegedPrefix(string(v, "privilegedprefix"));
        if (v.containsKey("defaultplugin")) b.defaultPlugin(string(v, "defaultplugin"));
        if (v.containsKey("routes")) b.routes(routes(v.get("routes")));
        return b.build();
    }

    private static Map<String, Object> normalize(Map<?, ?> raw) {
        Map<String, Object> result = new LinkedHashMap<>();
        raw.forEach((k, val) -> result.put(normalizeKey(String.valueOf(k)), val));
        return result;
    }

    private static String normalizeKey(String key) {
        return key.replace("-", "").replace("_", "").toLowerCase();
    }

    private static String string(Map<String, Object> v, String key) {
        Object value = v.get(key);
        return value == null ? null : String.valueOf(value);
    }

    private static boolean bool(Map<String, Object> v, String key) {
        Object value = v.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s && (s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false"))) {
            return Boolean.parseBoolean(s);
        }
        throw new ConfigurationException("Config key '" + key + "' must be a boolean, got: " + value);
    }

    private static long number(Map<String, Object> v, String key) {
        Object value = v.get(key);
        if (value instanceof Number n) {
            return n.longValue();
        }
        try {
            return Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Config key '" + key + "' must be a number, got: " + value, e);
        }
    }

    private static List<String> stringList(Object value, String key) {
        if (value == null) {
            return Collections.emptyList();
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("Config key '" + key + "' must be a list");
        }
        List<String> result = new ArrayList<>();
        for (Object item : list) {
            result.add(String.valueOf(item));
        }
        return List.copyOf(result);
    }

    private static Map<String, List<String>> routes(Object value) {
        if (value == null) {
            return Collections.emptyMap();
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new ConfigurationException("Config key 'routes' must be a mapping");
        }
        Map<String, List<String>> result = new LinkedHashMap<>();
        map.forEach((route, refs) -> result.put(String.valueOf(route), stringList(refs, "routes." + route)));
        return Collections.unmodifiableMap(result);
    }
}
