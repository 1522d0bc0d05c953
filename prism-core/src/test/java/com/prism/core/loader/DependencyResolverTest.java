package com.prism.core.loader;

import com.prism.api.exception.DependencyCycleException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DependencyResolver 单元测试")
class DependencyResolverTest {

    @Test
    @DisplayName("依赖先于依赖方")
    void dependenciesShouldComeFirst() {
        DependencyResolver resolver = new DependencyResolver();
        resolver.addPlugin("app", List.of("db", "auth"));
        resolver.addPlugin("auth", List.of("db"));
        resolver.addPlugin("db", List.of());

        List<String> order = resolver.resolve();

        assertEquals(List.of("db", "auth", "app"), order);
    }

    @Test
    @DisplayName("无依赖时保持注册顺序")
    void independentPluginsShouldKeepInsertionOrder() {
        DependencyResolver resolver = new DependencyResolver();
        resolver.addPlugin("b", List.of());
        resolver.addPlugin("a", List.of());
        resolver.addPlugin("c", List.of());

        assertEquals(List.of("b", "a", "c"), resolver.resolve());
    }

    @Test
    @DisplayName("循环依赖报告完整路径")
    void cycleShouldReportPath() {
        DependencyResolver resolver = new DependencyResolver();
        resolver.addPlugin("a", List.of("b"));
        resolver.addPlugin("b", List.of("c"));
        resolver.addPlugin("c", List.of("a"));

        DependencyCycleException ex = assertThrows(DependencyCycleException.class, resolver::resolve);

        assertEquals(List.of("a", "b", "c", "a"), ex.getCycle());
        assertEquals("Circular dependency detected: a -> b -> c -> a", ex.getMessage());
    }

    @Test
    @DisplayName("三元循环无论从哪个插件开始注册都被发现")
    void threeNodeCycleShouldBeFoundFromAnyEntry() {
        for (List<String> order : permutations(List.of("a", "b", "c"))) {
            DependencyResolver resolver = new DependencyResolver();
            Map<String, List<String>> graph = Map.of("a", List.of("b"), "b", List.of("c"), "c", List.of("a"));
            order.forEach(name -> resolver.addPlugin(name, graph.get(name)));

            DependencyCycleException ex = assertThrows(DependencyCycleException.class, resolver::resolve,
                    "registration order " + order);
            assertEquals(4, ex.getCycle().size());
            assertEquals(ex.getCycle().get(0), ex.getCycle().get(3));
            assertEquals(Set.of("a", "b", "c"), new HashSet<>(ex.getCycle()));
        }
    }

    @Test
    @DisplayName("任意注册顺序下都得到合法的拓扑序")
    void orderShouldBeValidForEveryRegistrationOrder() {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        graph.put("app", List.of("auth", "llm"));
        graph.put("auth", List.of("db"));
        graph.put("llm", List.of("db", "cache"));
        graph.put("db", List.of());
        graph.put("cache", List.of());

        for (List<String> registration : permutations(new ArrayList<>(graph.keySet()))) {
            DependencyResolver resolver = new DependencyResolver();
            registration.forEach(name -> resolver.addPlugin(name, graph.get(name)));

            List<String> order = resolver.resolve();

            assertEquals(Set.copyOf(graph.keySet()), Set.copyOf(order), "registration order " + registration);
            assertEquals(graph.size(), order.size());
            graph.forEach((plugin, deps) -> deps.forEach(dep -> assertTrue(
                    order.indexOf(dep) < order.indexOf(plugin),
                    dep + " must precede " + plugin + " in " + order + " (registration " + registration + ")")));
        }
    }

    private static List<List<String>> permutations(List<String> items) {
        if (items.isEmpty()) {
            List<List<String>> single = new ArrayList<>();
            single.add(new ArrayList<>());
            return single;
        }
        List<List<String>> result = new ArrayList<>();
        for (String head : items) {
            List<String> rest = new ArrayList<>(items);
            rest.remove(head);
            for (List<String> tail : permutations(rest)) {
                tail.add(0, head);
                result.add(tail);
            }
        }
        return result;
    }

    @Test
    @DisplayName("自依赖也是循环")
    void selfDependencyShouldBeCycle() {
        DependencyResolver resolver = new DependencyResolver();
        resolver.addPlugin("loop", List.of("loop"));

        DependencyCycleException ex = assertThrows(DependencyCycleException.class, resolver::resolve);
        assertEquals(List.of("loop", "loop"), ex.getCycle());
    }

    @Test
    @DisplayName("图外依赖只告警，留给加载闸门处理")
    void missingDependencyShouldNotFailResolution() {
        DependencyResolver resolver = new DependencyResolver();
        resolver.addPlugin("app", List.of("ghost"));

        assertEquals(List.of("app"), resolver.resolve());
        assertEquals(Set.of("ghost"), resolver.getDependencies("app"));
    }
}
