package com.prism.core.loader;

import com.prism.api.config.PluginManifest;
import com.prism.api.exception.ConfigurationException;
import com.prism.api.exception.MissingArtifactException;
import com.prism.core.support.PluginFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PluginManifestLoader 单元测试")
class PluginManifestLoaderTest {

    @TempDir
    Path home;

    @Test
    @DisplayName("解析 YAML 清单")
    void yamlManifestShouldLoad() {
        Path dir = home.resolve("weather");
        PluginFixtures.write(dir.resolve("plugin.yml"), """
                name: weather
                version: "1.2.0"
                description: Weather lookups
                dependencies:
                  - http-client@>=1.0,<2.0
                  - cache
                permissions:
                  - type: network
                    resource: "outbound:https"
                    description: call the weather API
                  - "file:read"
                properties:
                  city: Berlin
                """);

        PluginManifest manifest = PluginManifestLoader.load(dir);

        assertEquals("weather", manifest.getName());
        assertEquals("1.2.0", manifest.getVersion());
        assertEquals(2, manifest.getDependencies().size());
        assertEquals("http-client", manifest.getDependencies().get(0).name());
        assertEquals(">=1.0,<2.0", manifest.getDependencies().get(0).constraint());
        assertFalse(manifest.getDependencies().get(1).hasConstraint());
        assertEquals("network:outbound:https", manifest.getPermissions().get(0).toString());
        assertEquals("file", manifest.getPermissions().get(1).getType());
        assertEquals("read", manifest.getPermissions().get(1).getResource());
        assertEquals("Berlin", manifest.getProperties().get("city"));
    }

    @Test
    @DisplayName("解析 JSON 清单")
    void jsonManifestShouldLoad() {
        Path dir = home.resolve("json-plugin");
        PluginFixtures.write(dir.resolve("plugin.json"),
                "{\"name\": \"json-plugin\", \"version\": \"0.3.0\", \"dependencies\": [\"core@==1.*\"]}");

        PluginManifest manifest = PluginManifestLoader.load(dir);

        assertEquals("0.3.0", manifest.getVersion());
        assertEquals("==1.*", manifest.getDependencies().get(0).constraint());
    }

    @Test
    @DisplayName("目录名是规范名称")
    void directoryNameShouldWin() {
        Path dir = home.resolve("real-name");
        PluginFixtures.write(dir.resolve("plugin.yml"), "name: other-name\nversion: \"1.0\"\n");

        assertEquals("real-name", PluginManifestLoader.load(dir).getName());
    }

    @Test
    @DisplayName("插件组在没有 plugin.yml 时使用 group.yml")
    void groupFileShouldActAsManifest() {
        Path dir = home.resolve("suite");
        PluginFixtures.write(dir.resolve("group.yml"), """
                version: "2.0.0"
                subplugins:
                  auth: {enabled: true}
                dependencies:
                  auth: []
                """);

        PluginManifest manifest = PluginManifestLoader.load(dir);

        assertTrue(PluginManifestLoader.isGroup(dir));
        assertEquals("2.0.0", manifest.getVersion());
        assertTrue(manifest.getDependencies().isEmpty());
    }

    @Test
    @DisplayName("没有清单时报告缺失")
    void missingManifestShouldFail() throws Exception {
        Path dir = Files.createDirectories(home.resolve("empty"));
        MissingArtifactException ex = assertThrows(MissingArtifactException.class, () -> PluginManifestLoader.load(dir));
        assertEquals("empty", ex.getPluginName());
    }

    @Test
    @DisplayName("格式错误的清单")
    void malformedManifestShouldFail() {
        Path dir = home.resolve("broken");
        PluginFixtures.write(dir.resolve("plugin.yml"), "dependencies: \"not-a-list\"\n");
        assertThrows(ConfigurationException.class, () -> PluginManifestLoader.load(dir));

        PluginFixtures.write(dir.resolve("plugin.yml"), "- just\n- a list\n");
        assertThrows(ConfigurationException.class, () -> PluginManifestLoader.load(dir));
    }

    @Test
    @DisplayName("依赖声明解析")
    void dependencySpecShouldParse() {
        PluginManifest.DependencySpec spec = PluginManifestLoader.parseDependencySpec("db@>=2.1");
        assertEquals("db", spec.name());
        assertEquals(">=2.1", spec.constraint());
        assertEquals(List.of("db"), List.of(PluginManifestLoader.parseDependencySpec("db").name()));
        assertThrows(ConfigurationException.class, () -> PluginManifestLoader.parseDependencySpec("@1.0"));
    }
}
