package com.prism.core.chain;

import com.prism.core.plugin.event.RuntimeEvent;
import com.prism.core.plugin.event.RuntimeEventBus;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存路由表，每次变更都发布 {@link RuntimeEvent.RoutesChanged}
 */
@Slf4j
public class InMemoryRouteTable implements RouteTable {

    private final Map<String, List<String>> routes = new ConcurrentHashMap<>();
    private final RuntimeEventBus eventBus;

    public InMemoryRouteTable(RuntimeEventBus eventBus) {
        this(Map.of(), eventBus);
    }

    public InMemoryRouteTable(Map<String, List<String>> initial, RuntimeEventBus eventBus) {
        this.eventBus = eventBus;
        if (initial != null) {
            initial.forEach((route, chain) -> routes.put(route, List.copyOf(chain)));
        }
    }

    @Override
    public List<String> getChain(String route) {
        return routes.getOrDefault(route, List.of());
    }

    @Override
    public Set<String> routes() {
        return new TreeSet<>(routes.keySet());
    }

    public void setChain(String route, List<String> chain) {
        routes.put(route, List.copyOf(chain));
        log.info("Route [{}] chain updated: {}", route, chain);
        publish(Set.of(route));
    }

    public boolean removeRoute(String route) {
        boolean removed = routes.remove(route) != null;
        if (removed) {
            log.info("Route [{}] removed", route);
            publish(Set.of(route));
        }
        return removed;
    }

    public void replaceAll(Map<String, List<String>> newRoutes) {
        routes.clear();
        newRoutes.forEach((route, chain) -> routes.put(route, List.copyOf(chain)));
        log.info("Route table replaced, {} routes", routes.size());
        publish(Set.of());
    }

    private void publish(Set<String> changed) {
        if (eventBus != null) {
            eventBus.publish(new RuntimeEvent.RoutesChanged(changed));
        }
    }
}
