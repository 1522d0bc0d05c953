package com.prism.core.security;

import com.prism.api.exception.ConfigurationException;
import com.prism.api.sandbox.GovernedOperations;
import com.prism.api.security.Capabilities;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 权限引擎：能力定义注册表，以及 "受控事件 -> 所需能力" 的映射
 * <p>
 * 只能在 {@link #freeze()} 之前注册，冻结后只读，可被任意线程并发查询。
 * </p>
 */
@Slf4j
public class PermissionEngine {

    private final Map<String, CapabilityDefinition> definitions = new LinkedHashMap<>();
    private volatile boolean frozen;

    /**
     * 创建包含内置能力并已冻结的引擎
     */
    public static PermissionEngine withDefaults() {
        PermissionEngine engine = new PermissionEngine();
        registerDefaults(engine);
        engine.freeze();
        return engine;
    }

    public static void registerDefaults(PermissionEngine engine) {
        engine.register(CapabilityDefinition.builder()
                .name(Capabilities.FILE_READ_PLUGIN)
                .description("Read files inside the plugin's own directory")
                .type("file")
                .resourcePattern("read")
                .event(GovernedOperations.FILE_OPEN)
                .resourceMatcher(mode -> mode instanceof String m && m.contains("r"))
                .build());
        engine.register(CapabilityDefinition.builder()
                .name(Capabilities.FILE_WRITE_PLUGIN)
                .description("Write, rename and delete files inside the plugin's own directory")
                .type("file")
                .resourcePattern("write")
                .event(GovernedOperations.FILE_OPEN)
                .event(GovernedOperations.FILE_RENAME)
                .event(GovernedOperations.FILE_DELETE)
                .resourceMatcher(PermissionEngine::isMutation)
                .build());
        engine.register(CapabilityDefinition.builder()
                .name(Capabilities.NETWORK_HTTPS)
                .description("Outbound HTTPS connections")
                .type("network")
                .resourcePattern("outbound:https")
                .event(GovernedOperations.SOCKET_CONNECT)
                .resourceMatcher(port -> port instanceof Number p && p.intValue() == 443)
                .build());
        engine.register(CapabilityDefinition.builder()
                .name(Capabilities.NETWORK_HTTP)
                .description("Outbound HTTP connections")
                .type("network")
                .resourcePattern("outbound:http")
                .event(GovernedOperations.SOCKET_CONNECT)
                .resourceMatcher(port -> port instanceof Number p && p.intValue() == 80)
                .build());
        engine.register(CapabilityDefinition.builder()
                .name(Capabilities.API_CREATE_ROUTE)
                .description("Register API routes for the plugin")
                .type("api")
                .resourcePattern("create_route")
                .build());
        engine.register(CapabilityDefinition.builder()
                .name(Capabilities.SYSTEM_SUBPROCESS)
                .description("Spawn subprocesses")
                .type("system")
                .resourcePattern("subprocess")
                .eventPrefix(GovernedOperations.PROCESS_PREFIX)
                .build());
    }

    private static boolean isMutation(Object discriminator) {
        if (discriminator instanceof Path) {
            return true;
        }
        return discriminator instanceof String mode
                && (mode.contains("w") || mode.contains("a") || mode.contains("+"));
    }

    /**
     * 注册能力定义
     *
     * @throws IllegalStateException  引擎已冻结
     * @throws ConfigurationException 名称重复或资源通配符无法编译
     */
    public synchronized void register(CapabilityDefinition definition) {
        if (frozen) {
            throw new IllegalStateException("Capability definitions are frozen, cannot register " + definition.getName());
        }
        if (definitions.containsKey(definition.getName())) {
            throw new ConfigurationException("Capability '" + definition.getName() + "' is already registered");
        }
        GlobMatcher.validate(definition.getResourcePattern());
        definitions.put(definition.getName(), definition);
        log.debug("Registered capability: {}", definition.getName());
    }

    public synchronized void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public Optional<CapabilityDefinition> getDefinition(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public boolean isValidPermissionType(String name) {
        return definitions.containsKey(name);
    }

    public Collection<CapabilityDefinition> definitions() {
        return Collections.unmodifiableCollection(definitions.values());
    }

    /**
     * 计算事件所需的能力集合（任一即可）
     * <p>
     * 先按事件名精确匹配，无结果时再按前缀匹配；再用判别值过滤。
     * </p>
     *
     * @return 能力名称集合；非受控事件返回空集
     */
    public Set<String> mapEventToPermissions(String event, Object... args) {
        if (event == null) {
            return Collections.emptySet();
        }
        List<CapabilityDefinition> candidates = new ArrayList<>();
        for (CapabilityDefinition def : definitions.values()) {
            if (def.governsExactly(event)) {
                candidates.add(def);
            }
        }
        if (candidates.isEmpty()) {
            for (CapabilityDefinition def : definitions.values()) {
                if (def.governsByPrefix(event)) {
                    candidates.add(def);
                }
            }
        }
        if (candidates.isEmpty()) {
            return Collections.emptySet();
        }
        Object discriminator = extractDiscriminator(event, args);
        Set<String> result = new LinkedHashSet<>();
        for (CapabilityDefinition def : candidates) {
            if (def.acceptsResource(discriminator)) {
                result.add(def.getName());
            }
        }
        return result;
    }

    /**
     * 反向查找：清单声明 (type, resource) 对应的能力定义
     */
    public Optional<CapabilityDefinition> findDefinitionForDeclaration(String type, String resource) {
        if (type == null) {
            return Optional.empty();
        }
        for (CapabilityDefinition def : definitions.values()) {
            if (def.matchesDeclaration(type, resource)) {
                return Optional.of(def);
            }
        }
        return Optional.empty();
    }

    static Object extractDiscriminator(String event, Object[] args) {
        if (args == null || args.length == 0) {
            return null;
        }
        if (GovernedOperations.FILE_OPEN.equals(event) || GovernedOperations.SOCKET_CONNECT.equals(event)) {
            return args.length > 1 ? args[1] : null;
        }
        return args[0];
    }
}
