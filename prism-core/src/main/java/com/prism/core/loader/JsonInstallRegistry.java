package com.prism.core.loader;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prism.core.spi.InstallRegistry;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 基于 JSON 文件的安装登记：{"插件名": {"installed_at": ..., "metadata": {...}}}
 * <p>
 * 每次查询都重新读取文件，安装流程写入后无需通知运行时。
 * </p>
 */
@Slf4j
public class JsonInstallRegistry implements InstallRegistry {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path registryFile;

    public JsonInstallRegistry(Path registryFile) {
        this.registryFile = registryFile;
    }

    @Override
    public boolean isInstalled(String pluginName) {
        return listInstalled().containsKey(pluginName);
    }

    @Override
    public Optional<Map<String, Object>> getInstallInfo(String pluginName) {
        return Optional.ofNullable(listInstalled().get(pluginName));
    }

    @Override
    public Map<String, Map<String, Object>> listInstalled() {
        if (!Files.isRegularFile(registryFile)) {
            log.debug("Install registry {} does not exist", registryFile);
            return Collections.emptyMap();
        }
        try {
            Map<String, Map<String, Object>> entries = MAPPER.readValue(registryFile.toFile(),
                    new TypeReference<LinkedHashMap<String, Map<String, Object>>>() {
                    });
            return entries == null ? Collections.emptyMap() : Collections.unmodifiableMap(entries);
        } catch (IOException e) {
            log.error("Failed to read install registry {}: {}", registryFile, e.getMessage());
            return Collections.emptyMap();
        }
    }
}
