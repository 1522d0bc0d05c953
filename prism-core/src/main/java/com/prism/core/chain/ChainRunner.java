package com.prism.core.chain;

import com.prism.api.context.RequestContext;
import com.prism.api.exception.ChainExecutionException;
import com.prism.api.exception.ConfigurationException;
import com.prism.api.exception.PrismException;
import com.prism.api.plugin.Flow;
import com.prism.api.plugin.PrismPlugin;
import com.prism.core.plugin.PluginGroup;
import com.prism.core.plugin.PluginLoader;
import com.prism.core.plugin.PluginRecord;
import com.prism.core.plugin.event.RuntimeEvent;
import com.prism.core.plugin.event.RuntimeEventBus;
import com.prism.core.security.PluginScope;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 调用链执行器
 * 职责：按路由解析并缓存插件链，依次在各插件的作用域内执行
 * <p>
 * 执行前先校验链上所有插件都存在；单步异常记录到 responseData.errors 并短路，不向调用方抛出。
 * </p>
 */
@Slf4j
public class ChainRunner implements AutoCloseable {

    private final PluginLoader pluginLoader;
    private final RouteTable routeTable;
    private final String defaultPlugin;

    private final Map<String, List<ChainRef>> chainCache = new ConcurrentHashMap<>();
    // 每次失效加一；解析开始后发生过失效的结果不留在缓存中
    private final AtomicLong cacheGeneration = new AtomicLong();
    private final List<RuntimeEventBus.Subscription> subscriptions = new ArrayList<>();

    public ChainRunner(PluginLoader pluginLoader, RouteTable routeTable) {
        this(pluginLoader, routeTable, pluginLoader.getConfig().getDefaultPlugin());
    }

    public ChainRunner(PluginLoader pluginLoader, RouteTable routeTable, String defaultPlugin) {
        this.pluginLoader = pluginLoader;
        this.routeTable = routeTable;
        this.defaultPlugin = defaultPlugin;

        RuntimeEventBus eventBus = pluginLoader.getEventBus();
        subscriptions.add(eventBus.subscribe("chain-runner", RuntimeEvent.PluginLoaded.class, e -> clearCache()));
        subscriptions.add(eventBus.subscribe("chain-runner", RuntimeEvent.PluginUnloaded.class, e -> clearCache()));
        subscriptions.add(eventBus.subscribe("chain-runner", RuntimeEvent.RoutesChanged.class, e -> {
            if (e.routes() == null || e.routes().isEmpty()) {
                clearCache();
            } else {
                e.routes().forEach(this::invalidate);
            }
        }));
        log.info("ChainRunner initialized, routes: {}", routeTable.routes().size());
    }

    // ==================== 执行 ====================

    /**
     * 执行路由对应的调用链，总是返回上下文
     */
    public RequestContext run(String route, Map<String, Object> requestData) {
        RequestContext context = new RequestContext(route, requestData);
        if (isTruthy(context.getRequestData().get(RequestContext.TRACE_KEY))) {
            context.enableTrace();
            context.addTrace("Execution trace enabled for request_id: " + context.getRequestData().get("request_id"));
        }
        try {
            List<ChainRef> chain = resolveChain(route, context);
            if (chain.isEmpty()) {
                context.addTrace("No plugin chain configured for route, attempting to find default.");
                chain = defaultChain();
                if (chain.isEmpty()) {
                    log.warn("No plugin chain configured and no default available for route: {}", route);
                    context.addTrace("No default chain available. Aborting.");
                    context.error("No handlers configured for route: " + route);
                    return context;
                }
                context.addTrace("Using default chain: " + raw(chain));
            }

            context.addTrace("Validating plugins in chain...");
            List<String> missing = new ArrayList<>();
            for (ChainRef ref : chain) {
                try {
                    resolveStep(ref, context);
                } catch (PrismException e) {
                    missing.add(ref.raw() + ": " + e.getMessage());
                }
            }
            if (!missing.isEmpty()) {
                String message = "Missing or invalid plugins for route " + route + ": " + missing;
                log.error(message);
                context.addTrace("Validation failed: " + message);
                context.error(message);
                return context;
            }
            context.addTrace("All plugins in chain are valid.");

            execute(context, chain);
            context.addTrace("Plugin chain execution finished.");
            log.debug("Plugin chain execution completed: route={}, chain={}", route, raw(chain));
        } catch (RuntimeException e) {
            log.error("Plugin chain execution failed: route={}", route, e);
            context.error("Plugin chain execution failed: " + e.getMessage());
        } finally {
            if (context.isTracing()) {
                context.getResponseData().put(RequestContext.TRACE_KEY, context.getTraceLog());
            }
        }
        return context;
    }

    /**
     * 在给定执行器上异步执行，插件身份在任务内部进入
     */
    public CompletableFuture<RequestContext> runAsync(String route, Map<String, Object> requestData, Executor executor) {
        return CompletableFuture.supplyAsync(() -> run(route, requestData), executor);
    }

    private void execute(RequestContext context, List<ChainRef> chain) {
        for (int index = 0; index < chain.size(); index++) {
            if (context.isShortCircuited()) {
                context.addTrace("Chain short-circuited at index " + index + ". Halting execution.");
                log.debug("Plugin chain short-circuited at index {}", index);
                return;
            }
            ChainRef ref = chain.get(index);
            String name = ref.raw();
            context.setCurrentPluginName(name);
            context.addTrace("Executing plugin at index " + index + ": '" + name + "'");
            try {
                ResolvedStep step = resolveStep(ref, context);
                Flow flow = PluginScope.callAs(step.scope(), () -> step.plugin().handle(context));
                context.addTrace("Plugin '" + name + "' execution finished successfully.");
                if (flow == Flow.END) {
                    context.addTrace("Plugin '" + name + "' ended the chain.");
                    return;
                }
            } catch (Exception e) {
                ChainExecutionException failure = new ChainExecutionException(name, e);
                log.error(failure.getMessage(), e);
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                context.addTrace("Plugin '" + name + "' execution FAILED: " + message);
                context.addError(name, message);
                context.shortCircuit();
            }
        }
        context.addTrace("Reached end of chain.");
    }

    // ==================== 解析 ====================

    public List<ChainRef> resolveChain(String route) {
        return resolveChain(route, null);
    }

    /**
     * 解析路由的调用链：展开预设链，保留子插件引用；结果按路由缓存直到失效
     */
    public List<ChainRef> resolveChain(String route, RequestContext context) {
        List<ChainRef> cached = chainCache.get(route);
        if (cached != null) {
            trace(context, "Chain for route '" + route + "' found in cache: " + raw(cached));
            return cached;
        }
        trace(context, "Chain for route '" + route + "' not in cache, resolving from config or meta plugin.");
        long generation = cacheGeneration.get();
        List<String> configured = routeTable.getChain(route);
        trace(context, "Initial chain from config: " + configured);

        if (configured.isEmpty() && route.indexOf(':') > 0) {
            String normalized = route.startsWith("/") ? route.substring(1) : route;
            ChainRef ref = safeParse(normalized);
            if (ref instanceof ChainRef.Preset preset) {
                Optional<PluginGroup.ChainPreset> found = findPreset(preset);
                if (found.isPresent()) {
                    trace(context, "Meta chain '" + preset.raw() + "' resolved via meta plugin registry.");
                    configured = found.get().plugins();
                }
            }
        }

        List<ChainRef> expanded = new ArrayList<>();
        for (String entry : configured) {
            if (PluginGroup.NEXT_PLACEHOLDER.equals(entry)) {
                trace(context, "  -> Skipping '" + PluginGroup.NEXT_PLACEHOLDER + "' placeholder.");
                continue;
            }
            ChainRef ref = safeParse(entry);
            if (ref == null) {
                continue;
            }
            if (ref instanceof ChainRef.Preset preset) {
                Optional<PluginGroup.ChainPreset> found = findPreset(preset);
                if (found.isPresent()) {
                    List<String> presetPlugins = found.get().plugins();
                    trace(context, "Expanding meta-chain '" + preset.raw() + "' to " + presetPlugins);
                    for (String item : presetPlugins) {
                        if (PluginGroup.NEXT_PLACEHOLDER.equals(item)) {
                            trace(context, "  -> Skipping '" + PluginGroup.NEXT_PLACEHOLDER + "' placeholder.");
                            continue;
                        }
                        ChainRef presetRef = safeParse(item);
                        if (presetRef != null) {
                            expanded.add(presetRef);
                        }
                    }
                    continue;
                }
            }
            trace(context, "Adding normal plugin ref '" + ref.raw() + "' to chain.");
            expanded.add(ref);
        }

        List<ChainRef> resolved = List.copyOf(expanded);
        chainCache.put(route, resolved);
        if (cacheGeneration.get() != generation) {
            chainCache.remove(route, resolved);
            trace(context, "Resolved chain for route '" + route + "' (not cached, invalidated meanwhile): " + raw(resolved));
            return resolved;
        }
        trace(context, "Resolved and cached final chain for route '" + route + "': " + raw(resolved));
        return resolved;
    }

    /**
     * 校验路由的调用链，不执行任何插件
     */
    public ChainValidation validate(String route) {
        List<ChainRef> chain = resolveChain(route);
        List<String> issues = new ArrayList<>();
        if (chain.isEmpty()) {
            issues.add("No plugin chain configured");
        }
        for (ChainRef ref : chain) {
            try {
                resolveStep(ref, null);
            } catch (PrismException e) {
                issues.add(e.getMessage());
            }
        }
        ChainValidation result = new ChainValidation(route, raw(chain), issues.isEmpty(), issues);
        log.info("Chain validation completed: {}", result);
        return result;
    }

    public void clearCache() {
        cacheGeneration.incrementAndGet();
        chainCache.clear();
        log.debug("Chain cache cleared");
    }

    public void invalidate(String route) {
        cacheGeneration.incrementAndGet();
        chainCache.remove(route);
    }

    @Override
    public void close() {
        subscriptions.forEach(RuntimeEventBus.Subscription::unsubscribe);
        subscriptions.clear();
    }

    private List<ChainRef> defaultChain() {
        if (defaultPlugin == null || defaultPlugin.isBlank() || !pluginLoader.isLoaded(defaultPlugin)) {
            return List.of();
        }
        return List.of(new ChainRef.Plain(defaultPlugin));
    }

    /**
     * 找到执行实例与其作用域名；子插件在所属组的身份下运行
     */
    private ResolvedStep resolveStep(ChainRef ref, RequestContext context) {
        if (ref instanceof ChainRef.Plain plain) {
            trace(context, "Resolving normal plugin reference: '" + plain.name() + "'");
            PluginRecord record = pluginLoader.find(plain.name())
                    .orElseThrow(() -> new PrismException("Plugin '" + plain.name() + "' not found"));
            return new ResolvedStep(record.getName(), record.getInstance());
        }
        if (ref instanceof ChainRef.SubPlugin sub) {
            trace(context, "Resolving sub-plugin reference: '" + sub.raw() + "'");
            PluginRecord record = pluginLoader.find(sub.group())
                    .orElseThrow(() -> new PrismException("Meta plugin '" + sub.group() + "' not found"));
            PluginGroup group = record.group()
                    .orElseThrow(() -> new PrismException("Plugin '" + sub.group() + "' is not a meta plugin"));
            PluginGroup.SubPlugin subPlugin = group.getSubPlugin(sub.subName())
                    .orElseThrow(() -> new PrismException(
                            "Subplugin '" + sub.subName() + "' not found in '" + sub.group() + "'"));
            return new ResolvedStep(group.getName(), subPlugin.instance());
        }
        ChainRef.Preset preset = (ChainRef.Preset) ref;
        throw new PrismException("Chain preset '" + preset.raw() + "' not found");
    }

    private Optional<PluginGroup.ChainPreset> findPreset(ChainRef.Preset preset) {
        return pluginLoader.find(preset.group())
                .flatMap(PluginRecord::group)
                .flatMap(g -> g.getPreset(preset.chainName()));
    }

    private static ChainRef safeParse(String entry) {
        try {
            return ChainRef.parse(entry);
        } catch (ConfigurationException e) {
            log.warn("Ignoring invalid chain entry [{}]: {}", entry, e.getMessage());
            return null;
        }
    }

    private static List<String> raw(List<ChainRef> chain) {
        List<String> names = new ArrayList<>(chain.size());
        chain.forEach(ref -> names.add(ref.raw()));
        return names;
    }

    private static void trace(RequestContext context, String message) {
        if (context != null) {
            context.addTrace(message);
        }
    }

    private static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0;
        }
        if (value instanceof String s) {
            return !s.isEmpty() && !"false".equalsIgnoreCase(s) && !"0".equals(s);
        }
        return true;
    }

    private record ResolvedStep(String scope, PrismPlugin plugin) {
    }
}
