package com.prism.core.security;

import com.prism.api.config.PluginManifest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 加载期检查清单中的权限声明，只产生告警，不阻断加载
 */
@Slf4j
@RequiredArgsConstructor
public class PermissionDeclarationValidator {

    private final PermissionEngine permissionEngine;
    private final String privilegedPrefix;

    public List<String> validate(PluginManifest manifest) {
        List<String> warnings = new ArrayList<>();
        List<PluginManifest.PermissionRequest> requests = manifest.getPermissions();
        if (requests == null) {
            return warnings;
        }
        for (PluginManifest.PermissionRequest request : requests) {
            if (request.getType() == null || request.getType().isBlank()) {
                warnings.add("Permission declaration without type: " + request);
                continue;
            }
            Optional<CapabilityDefinition> def =
                    permissionEngine.findDefinitionForDeclaration(request.getType(), request.getResource());
            if (def.isEmpty()) {
                warnings.add("Permission declaration " + request + " does not match any known capability");
            } else if (def.get().getName().startsWith(privilegedPrefix)) {
                warnings.add("Permission declaration " + request + " requests privileged capability "
                        + def.get().getName());
            }
        }
        warnings.forEach(w -> log.warn("[{}] {}", manifest.getName(), w));
        return warnings;
    }
}
