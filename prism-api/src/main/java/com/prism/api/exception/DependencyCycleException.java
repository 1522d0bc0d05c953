package com.prism.api.exception;

import java.util.List;

/**
 * 循环依赖异常
 * 与其他配置错误不同，循环依赖会中止整个加载批次。
 */
public class DependencyCycleException extends ConfigurationException {

    private final List<String> cycle;

    public DependencyCycleException(List<String> cycle) {
        super("Circular dependency detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * 构成环的节点路径，首尾为同一节点
     */
    public List<String> getCycle() {
        return cycle;
    }
}
