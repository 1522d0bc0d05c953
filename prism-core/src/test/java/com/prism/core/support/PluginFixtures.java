package com.prism.core.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prism.api.context.PluginContext;
import com.prism.api.context.RequestContext;
import com.prism.api.plugin.Flow;
import com.prism.api.plugin.PrismPlugin;
import com.prism.core.config.PrismConfig;
import com.prism.core.security.LockFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 测试用插件目录与插件实现
 */
public final class PluginFixtures {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private PluginFixtures() {
    }

    public static PrismConfig config(Path projectRoot) {
        return PrismConfig.builder()
                .projectRoot(projectRoot.toString())
                .build();
    }

    /**
     * 创建插件目录：plugin.yml + permissions.lock.json
     *
     * @param permissions "type:resource" 形式的锁文件条目
     */
    public static Path plugin(Path pluginHome, String name, String version, List<String> dependencies,
                              String... permissions) {
        Path dir = pluginHome.resolve(name);
        StringBuilder yaml = new StringBuilder();
        yaml.append("name: ").append(name).append('\n');
        yaml.append("version: \"").append(version).append("\"\n");
        if (!dependencies.isEmpty()) {
            yaml.append("dependencies:\n");
            dependencies.forEach(d -> yaml.append("  - \"").append(d).append("\"\n"));
        }
        write(dir.resolve("plugin.yml"), yaml.toString());
        lockFile(dir, name, permissions);
        return dir;
    }

    public static void lockFile(Path pluginDir, String name, String... permissions) {
        Map<String, Object> lock = new LinkedHashMap<>();
        lock.put("plugin_name", name);
        List<Map<String, String>> entries = new ArrayList<>();
        for (String permission : permissions) {
            int colon = permission.indexOf(':');
            Map<String, String> entry = new LinkedHashMap<>();
            entry.put("type", permission.substring(0, colon));
            entry.put("resource", permission.substring(colon + 1));
            entry.put("description", "test");
            entries.add(entry);
        }
        lock.put("permissions", entries);
        lock.put("created_at", "2024-01-01T00:00:00");
        lock.put("version", "1.0");
        try {
            Files.createDirectories(pluginDir);
            MAPPER.writeValue(LockFile.locate(pluginDir).toFile(), lock);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static void markInstalled(Path registryFile, String... names) {
        Map<String, Object> registry = new LinkedHashMap<>();
        try {
            if (Files.isRegularFile(registryFile)) {
                @SuppressWarnings("unchecked")
                Map<String, Object> existing = MAPPER.readValue(registryFile.toFile(), Map.class);
                registry.putAll(existing);
            }
            for (String name : names) {
                registry.put(name, Map.of("installed_at", "2024-01-01T00:00:00", "metadata", Map.of()));
            }
            Files.createDirectories(registryFile.getParent());
            MAPPER.writeValue(registryFile.toFile(), registry);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static void write(Path file, String content) {
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, content);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * 记录调用的插件，行为可替换
     */
    public static class RecordingPlugin implements PrismPlugin {

        public interface Behavior {
            Flow handle(RequestContext context) throws Exception;
        }

        private final String label;
        private final List<String> journal;
        private final Behavior behavior;

        public volatile PluginContext initializedWith;
        public volatile boolean shutdown;

        public RecordingPlugin(String label, List<String> journal, Behavior behavior) {
            this.label = label;
            this.journal = journal;
            this.behavior = behavior;
        }

        public RecordingPlugin(String label, List<String> journal) {
            this(label, journal, ctx -> Flow.NEXT);
        }

        public static List<String> journal() {
            return new CopyOnWriteArrayList<>();
        }

        @Override
        public void initialize(PluginContext context) {
            this.initializedWith = context;
        }

        @Override
        public Flow handle(RequestContext context) throws Exception {
            journal.add(label);
            return behavior.handle(context);
        }

        @Override
        public void shutdown() {
            shutdown = true;
        }
    }
}
