package com.prism.core.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 默认能力账本实现
 * 职责：维护授权集合，提供鉴权查询，记录违规日志
 * <p>
 * 授权集合以不可变 Set 整体替换，执行期读取无锁，且不会看到更新了一半的集合。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultCapabilityLedger implements CapabilityLedger {

    private final PermissionEngine permissionEngine;

    // 授权表: Map<PluginName, Set<Capability>>
    private final Map<String, Set<String>> grants = new ConcurrentHashMap<>();

    // 违规记录跨重载保留
    private final Map<String, List<String>> violations = new ConcurrentHashMap<>();

    @Override
    public Set<String> grantFromLock(String pluginName, LockFile lockFile) {
        Set<String> granted = new LinkedHashSet<>();
        for (LockFile.LockedPermission entry : lockFile.getPermissions()) {
            Optional<CapabilityDefinition> def =
                    permissionEngine.findDefinitionForDeclaration(entry.getType(), entry.getResource());
            if (def.isPresent()) {
                granted.add(def.get().getName());
            } else {
                log.warn("[{}] Lock file entry {}:{} maps to no known capability, dropped",
                        pluginName, entry.getType(), entry.getResource());
            }
        }
        Set<String> snapshot = Collections.unmodifiableSet(granted);
        grants.put(pluginName, snapshot);
        log.info("[{}] Granted capabilities: {}", pluginName, snapshot);
        return snapshot;
    }

    @Override
    public void release(String pluginName) {
        if (grants.remove(pluginName) != null) {
            log.debug("[{}] Capabilities released", pluginName);
        }
    }

    @Override
    public boolean isGranted(String pluginName, String capability) {
        Set<String> set = grants.get(pluginName);
        if (set == null) {
            log.debug("DENY: Plugin [{}] has no capabilities granted.", pluginName);
            return false;
        }
        return set.contains(capability);
    }

    @Override
    public Set<String> grantedCapabilities(String pluginName) {
        return grants.getOrDefault(pluginName, Collections.emptySet());
    }

    @Override
    public boolean hasCapabilityWithPrefix(String pluginName, String prefix) {
        for (String capability : grantedCapabilities(pluginName)) {
            if (capability.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void logViolation(String pluginName, String message) {
        violations.computeIfAbsent(pluginName, k -> new CopyOnWriteArrayList<>()).add(message);
        log.warn("[AUDIT] Violation by plugin [{}]: {}", pluginName, message);
    }

    @Override
    public List<String> getViolations(String pluginName) {
        List<String> list = violations.get(pluginName);
        return list == null ? Collections.emptyList() : List.copyOf(list);
    }
}
