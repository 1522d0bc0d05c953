package com.prism.core;

import com.prism.api.context.RequestContext;
import com.prism.api.plugin.PluginFactory;
import com.prism.core.chain.ChainRunner;
import com.prism.core.chain.InMemoryRouteTable;
import com.prism.core.config.PrismConfig;
import com.prism.core.config.PrismConfigLoader;
import com.prism.core.dev.HotReloadWatcher;
import com.prism.core.loader.JsonInstallRegistry;
import com.prism.core.loader.PluginFactoryRegistry;
import com.prism.core.plugin.PluginLoader;
import com.prism.core.plugin.event.RuntimeEventBus;
import com.prism.core.security.CapabilityLedger;
import com.prism.core.security.DefaultCapabilityLedger;
import com.prism.core.security.InterceptionEngine;
import com.prism.core.security.PermissionEngine;
import com.prism.core.security.SignatureVerifier;
import com.prism.core.security.UngovernedApiVerifier;
import com.prism.core.spi.InstallRegistry;
import com.prism.core.spi.PluginSecurityVerifier;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 运行时启动入口
 * <p>
 * 组装权限引擎、能力账本、拦截引擎、加载器、调用链执行器和热重载监听器。
 * {@link #start()} 安装审计钩子并加载插件，{@link #close()} 逆序关闭。
 * </p>
 */
@Slf4j
@Getter
public class PrismRuntime implements AutoCloseable {

    private final PrismConfig config;
    private final PermissionEngine permissionEngine;
    private final CapabilityLedger ledger;
    private final InterceptionEngine interceptionEngine;
    private final RuntimeEventBus eventBus;
    private final PluginFactoryRegistry factoryRegistry;
    private final PluginLoader pluginLoader;
    private final InMemoryRouteTable routeTable;
    private final ChainRunner chainRunner;
    private final HotReloadWatcher hotReloadWatcher;

    private volatile boolean started;

    public PrismRuntime(PrismConfig config) {
        this(config, List.of());
    }

    public PrismRuntime(PrismConfig config, List<PluginFactory> hostFactories) {
        this(config, hostFactories, new JsonInstallRegistry(config.registryFilePath()));
    }

    public PrismRuntime(PrismConfig config, List<PluginFactory> hostFactories, InstallRegistry installRegistry) {
        this.config = config;
        this.permissionEngine = PermissionEngine.withDefaults();
        this.ledger = new DefaultCapabilityLedger(permissionEngine);
        this.interceptionEngine = new InterceptionEngine(permissionEngine, ledger, config);
        this.eventBus = new RuntimeEventBus("prism");
        this.factoryRegistry = new PluginFactoryRegistry();
        hostFactories.forEach(factoryRegistry::register);

        List<PluginSecurityVerifier> verifiers = new ArrayList<>();
        if (config.isVerifySignatures()) {
            verifiers.add(new SignatureVerifier(config.trustedKeysPath()));
        }
        verifiers.add(new UngovernedApiVerifier());

        this.pluginLoader = PluginLoader.builder()
                .config(config)
                .permissionEngine(permissionEngine)
                .ledger(ledger)
                .interceptionEngine(interceptionEngine)
                .installRegistry(installRegistry)
                .factoryRegistry(factoryRegistry)
                .verifiers(verifiers)
                .eventBus(eventBus)
                .build();
        this.routeTable = new InMemoryRouteTable(config.getRoutes(), eventBus);
        this.chainRunner = new ChainRunner(pluginLoader, routeTable);
        this.hotReloadWatcher = config.isHotReload() ? new HotReloadWatcher(pluginLoader) : null;
    }

    public static PrismRuntime fromConfigFile(Path configFile) {
        return new PrismRuntime(PrismConfigLoader.load(configFile));
    }

    /**
     * 安装审计钩子并加载插件
     *
     * @return 成功加载的插件
     */
    public synchronized List<String> start() {
        if (started) {
            log.warn("Prism runtime already started");
            return List.copyOf(pluginLoader.getLoadedPlugins().keySet());
        }
        log.info("Starting Prism runtime: {}", config);
        interceptionEngine.activate();
        List<String> loaded;
        try {
            loaded = pluginLoader.loadAll();
        } catch (RuntimeException e) {
            interceptionEngine.deactivate();
            throw e;
        }
        if (hotReloadWatcher != null) {
            hotReloadWatcher.start();
        }
        started = true;
        log.info("Prism runtime started, {} plugins loaded", loaded.size());
        return loaded;
    }

    public RequestContext run(String route, Map<String, Object> requestData) {
        return chainRunner.run(route, requestData);
    }

    @Override
    public synchronized void close() {
        if (!started) {
            return;
        }
        log.info("Stopping Prism runtime...");
        if (hotReloadWatcher != null) {
            hotReloadWatcher.stop();
        }
        chainRunner.close();
        pluginLoader.shutdown();
        interceptionEngine.deactivate();
        started = false;
        log.info("Prism runtime stopped");
    }
}
