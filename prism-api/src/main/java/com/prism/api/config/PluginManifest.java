package com.prism.api.config;

import com.prism.api.exception.ConfigurationException;
import lombok.Getter;
import lombok.Setter;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 对应 plugin.yml / plugin.json / group.yml 的根节点
 * 作为标准契约，解析时不执行任何插件代码
 */
@Getter
@Setter
public class PluginManifest implements Serializable {

    // === 基础元数据 ===
    private String name;
    private String version = "0.0.0";
    private String description;
    private String author;

    // 依赖列表
    private List<DependencySpec> dependencies = new ArrayList<>();

    // 声明的权限请求（安装流程据此生成锁文件）
    private List<PermissionRequest> permissions = new ArrayList<>();

    // === 扩展配置 (KV 键值对，用于业务参数) ===
    private Map<String, Object> properties = new LinkedHashMap<>();

    /**
     * 验证
     */
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Plugin name cannot be blank");
        }
        if (version == null || version.isBlank()) {
            throw new ConfigurationException("Plugin version cannot be blank for " + name);
        }
    }

    @Override
    public String toString() {
        return String.format("PluginManifest{name='%s', version='%s'}", name, version);
    }

    // ==================== 嵌套类 ====================

    /**
     * 插件依赖：name 或 name@constraint
     *
     * @param name       依赖插件名称
     * @param constraint 版本约束，可为 null
     */
    public record DependencySpec(String name, String constraint) implements Serializable {

        public static DependencySpec parse(String spec) {
            if (spec == null || spec.isBlank()) {
                throw new ConfigurationException("Empty dependency specification");
            }
            String trimmed = spec.trim();
            int at = trimmed.indexOf('@');
            if (at < 0) {
                return new DependencySpec(trimmed, null);
            }
            String name = trimmed.substring(0, at).trim();
            String constraint = trimmed.substring(at + 1).trim();
            if (name.isEmpty()) {
                throw new ConfigurationException("Dependency name missing in '" + spec + "'");
            }
            return new DependencySpec(name, constraint.isEmpty() ? null : constraint);
        }

        public boolean hasConstraint() {
            return constraint != null;
        }

        @Override
        public String toString() {
            return constraint == null ? name : name + "@" + constraint;
        }
    }

    /**
     * 权限请求
     */
    @Getter
    @Setter
    public static class PermissionRequest implements Serializable {

        private String type;
        private String resource;
        private String description;

        public PermissionRequest() {
        }

        public PermissionRequest(String type, String resource, String description) {
            this.type = type;
            this.resource = resource;
            this.description = description;
        }

        @Override
        public String toString() {
            return type + ":" + resource;
        }
    }
}
