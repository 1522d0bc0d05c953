package com.prism.core.security;

import com.prism.api.security.PermissionService;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 交给插件的只读权限视图
 * <p>
 * 只转发查询，不暴露账本本身，插件无法通过向下转型改写授权。
 * </p>
 */
public final class PermissionView implements PermissionService {

    private final CapabilityLedger ledger;

    public PermissionView(CapabilityLedger ledger) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
    }

    @Override
    public boolean isGranted(String pluginName, String capability) {
        return ledger.isGranted(pluginName, capability);
    }

    @Override
    public Set<String> grantedCapabilities(String pluginName) {
        return ledger.grantedCapabilities(pluginName);
    }

    @Override
    public List<String> getViolations(String pluginName) {
        return ledger.getViolations(pluginName);
    }

    @Override
    public String toString() {
        return "PermissionView";
    }
}
