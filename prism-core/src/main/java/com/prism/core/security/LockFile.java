package com.prism.core.security;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prism.api.exception.ConfigurationException;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * permissions.lock.json：安装流程生成的授权快照，运行时只读
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LockFile {

    public static final String FILE_NAME = "permissions.lock.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @JsonProperty("plugin_name")
    private String pluginName;

    private List<LockedPermission> permissions = new ArrayList<>();

    @JsonProperty("created_at")
    private String createdAt;

    private String version;

    public static Path locate(Path pluginRoot) {
        return pluginRoot.resolve(FILE_NAME);
    }

    public static LockFile read(Path file) {
        try {
            LockFile lock = MAPPER.readValue(file.toFile(), LockFile.class);
            if (lock.permissions == null) {
                lock.permissions = new ArrayList<>();
            }
            return lock;
        } catch (IOException e) {
            throw new ConfigurationException("Malformed lock file " + file + ": " + e.getMessage(), e);
        }
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LockedPermission {
        private String type;
        private String resource;
        private String description;

        public LockedPermission(String type, String resource, String description) {
            this.type = type;
            this.resource = resource;
            this.description = description;
        }
    }
}
