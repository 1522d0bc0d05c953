package com.prism.api.exception;

import java.util.List;

/**
 * 依赖缺失或版本不匹配
 */
public class UnmetDependencyException extends PluginLoadException {

    private final List<String> unmet;

    public UnmetDependencyException(String pluginName, List<String> unmet) {
        super(pluginName, "Dependency not satisfied for plugin '" + pluginName + "': " + String.join(", ", unmet));
        this.unmet = List.copyOf(unmet);
    }

    public List<String> getUnmet() {
        return unmet;
    }
}
