package com.prism.core.loader;

import com.prism.api.exception.DependencyCycleException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 依赖图：一次加载批次一个实例
 * <p>
 * 深度优先拓扑排序，依赖先于依赖方输出；回边即循环依赖。
 * 图中不存在的依赖只告警，由加载闸门最终拦截。
 * </p>
 */
@Slf4j
public class DependencyResolver {

    private final Map<String, Set<String>> graph = new LinkedHashMap<>();

    public void addPlugin(String pluginName, Collection<String> dependencies) {
        graph.put(pluginName, new LinkedHashSet<>(dependencies));
    }

    public Set<String> getDependencies(String pluginName) {
        return Collections.unmodifiableSet(graph.getOrDefault(pluginName, Set.of()));
    }

    public boolean contains(String pluginName) {
        return graph.containsKey(pluginName);
    }

    /**
     * @return 加载顺序
     * @throws DependencyCycleException 存在循环依赖（含自依赖）
     */
    public List<String> resolve() {
        List<String> order = new ArrayList<>();
        Set<String> resolved = new HashSet<>();
        List<String> path = new ArrayList<>();
        for (String plugin : graph.keySet()) {
            if (!resolved.contains(plugin)) {
                visit(plugin, resolved, path, order);
            }
        }
        return order;
    }

    private void visit(String node, Set<String> resolved, List<String> path, List<String> order) {
        int onPath = path.indexOf(node);
        if (onPath >= 0) {
            List<String> cycle = new ArrayList<>(path.subList(onPath, path.size()));
            cycle.add(node);
            throw new DependencyCycleException(cycle);
        }
        if (resolved.contains(node)) {
            return;
        }
        path.add(node);
        for (String dependency : graph.getOrDefault(node, Set.of())) {
            if (!graph.containsKey(dependency)) {
                log.warn("Missing dependency: {} required by {}", dependency, node);
                continue;
            }
            visit(dependency, resolved, path, order);
        }
        path.remove(path.size() - 1);
        resolved.add(node);
        order.add(node);
    }
}
