package com.prism.core.plugin;

import com.prism.api.config.PluginManifest;
import com.prism.api.exception.ConfigurationException;
import com.prism.api.exception.DependencyCycleException;
import com.prism.api.exception.MissingArtifactException;
import com.prism.api.exception.PluginLoadException;
import com.prism.api.exception.UnmetDependencyException;
import com.prism.api.plugin.PluginFactory;
import com.prism.api.plugin.PrismPlugin;
import com.prism.core.classloader.PluginClassLoader;
import com.prism.core.config.PrismConfig;
import com.prism.core.context.CorePluginContext;
import com.prism.core.loader.DependencyResolver;
import com.prism.core.loader.PluginFactoryRegistry;
import com.prism.core.loader.PluginManifestLoader;
import com.prism.core.loader.Version;
import com.prism.core.loader.VersionConstraint;
import com.prism.core.plugin.event.RuntimeEvent;
import com.prism.core.plugin.event.RuntimeEventBus;
import com.prism.core.security.CapabilityLedger;
import com.prism.core.security.InterceptionEngine;
import com.prism.core.security.LockFile;
import com.prism.core.security.PermissionDeclarationValidator;
import com.prism.core.security.PermissionEngine;
import com.prism.core.security.PermissionView;
import com.prism.core.security.PluginScope;
import com.prism.core.spi.InstallRegistry;
import com.prism.core.spi.PluginSecurityVerifier;
import com.prism.core.spi.ThreadLocalPropagator;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 插件加载器
 * 职责：清单扫描、依赖排序、逐个插件的加载闸门、卸载与重载
 * <p>
 * 闸门顺序：安装登记 → 安全校验 → 依赖与版本 → 锁文件 → 授权入账 → 目录注册 → 在插件作用域内实例化与初始化。
 * 循环依赖中止整个批次；其他失败只跳过当前插件（以及依赖它的插件）。
 * 加载、卸载、重载共用一把锁，同一时刻只有一个变更在进行。
 * </p>
 */
@Slf4j
public class PluginLoader {

    @Getter
    private final PrismConfig config;
    private final CapabilityLedger ledger;
    private final PermissionView permissionView;
    private final InterceptionEngine interceptionEngine;
    private final InstallRegistry installRegistry;
    private final PluginFactoryRegistry factoryRegistry;
    private final List<PluginSecurityVerifier> verifiers;
    private final RuntimeEventBus eventBus;
    private final PermissionDeclarationValidator declarationValidator;
    private final GroupLoader groupLoader;

    private final Map<String, PluginRecord> plugins = new ConcurrentHashMap<>();
    private final List<String> loadOrder = new CopyOnWriteArrayList<>();
    private final ReentrantLock mutationLock = new ReentrantLock();

    // 插件后台任务线程池：有界队列，满载时快速失败
    private static final int TASK_CORE_POOL_SIZE = 2;
    private static final int TASK_MAX_POOL_SIZE = 16;
    private static final int TASK_QUEUE_CAPACITY = 256;
    private static final long TASK_KEEP_ALIVE_SECONDS = 60L;
    private final AtomicInteger taskThreadNumber = new AtomicInteger(1);
    @SuppressWarnings("rawtypes")
    private final List<ThreadLocalPropagator> propagators;
    private ExecutorService taskPool;

    @Builder
    public PluginLoader(PrismConfig config,
                        PermissionEngine permissionEngine,
                        CapabilityLedger ledger,
                        InterceptionEngine interceptionEngine,
                        InstallRegistry installRegistry,
                        PluginFactoryRegistry factoryRegistry,
                        List<PluginSecurityVerifier> verifiers,
                        RuntimeEventBus eventBus,
                        @SuppressWarnings("rawtypes") List<ThreadLocalPropagator> propagators) {
        this.config = config;
        this.ledger = ledger;
        this.permissionView = new PermissionView(ledger);
        this.interceptionEngine = interceptionEngine;
        this.installRegistry = installRegistry;
        this.factoryRegistry = factoryRegistry == null ? new PluginFactoryRegistry() : factoryRegistry;
        this.verifiers = verifiers == null ? List.of() : List.copyOf(verifiers);
        this.propagators = propagators == null ? List.of() : List.copyOf(propagators);
        this.eventBus = eventBus == null ? new RuntimeEventBus("prism") : eventBus;
        this.declarationValidator = new PermissionDeclarationValidator(permissionEngine, config.getPrivilegedPrefix());
        this.groupLoader = new GroupLoader(this.factoryRegistry, permissionView);
    }

    // ==================== 批量加载 ====================

    /**
     * 扫描插件目录，按依赖顺序加载
     *
     * @return 本批次成功加载的插件名（按加载顺序）
     * @throws DependencyCycleException 存在循环依赖，整个批次不加载任何插件
     */
    public List<String> loadAll() {
        mutationLock.lock();
        try {
            List<Path> candidates = discoverCandidates();
            log.info("Starting plugin discovery from {}, candidates: {}", getPluginHome(), candidates.size());

            Map<String, PluginManifest> manifests = new LinkedHashMap<>();
            Map<String, Path> directories = new LinkedHashMap<>();
            DependencyResolver resolver = new DependencyResolver();
            for (Path dir : candidates) {
                String name = dir.getFileName().toString();
                try {
                    PluginManifest manifest = PluginManifestLoader.load(dir);
                    manifests.put(name, manifest);
                    directories.put(name, dir);
                    List<String> deps = new ArrayList<>();
                    manifest.getDependencies().forEach(d -> deps.add(d.name()));
                    resolver.addPlugin(name, deps);
                } catch (PluginLoadException | ConfigurationException e) {
                    skip(name, "Failed to load manifest: " + e.getMessage(), e);
                }
            }

            List<String> order;
            try {
                order = resolver.resolve();
            } catch (DependencyCycleException e) {
                log.error("Dependency resolution failed, aborting load batch: {}", e.getMessage());
                throw e;
            }
            log.info("Plugin load order determined: {}", order);

            List<String> loaded = new ArrayList<>();
            for (String name : order) {
                if (plugins.containsKey(name)) {
                    log.debug("[{}] Already loaded, skipping", name);
                    continue;
                }
                try {
                    gate(name, directories.get(name), manifests.get(name));
                    loaded.add(name);
                } catch (PluginLoadException | ConfigurationException e) {
                    skip(name, e.getMessage(), e);
                } catch (RuntimeException e) {
                    skip(name, "Unexpected error: " + e.getMessage(), e);
                }
            }
            log.info("Plugin discovery finished. Loaded {} of {} plugins", loaded.size(), order.size());
            return loaded;
        } finally {
            mutationLock.unlock();
        }
    }

    /**
     * 按名称加载单个插件，依赖须已加载
     *
     * @throws PluginLoadException 未通过加载闸门
     */
    public PluginRecord loadPlugin(String name) {
        mutationLock.lock();
        try {
            PluginRecord existing = plugins.get(name);
            if (existing != null) {
                log.warn("[{}] Plugin already loaded", name);
                return existing;
            }
            Path dir = getPluginHome().resolve(name);
            if (!Files.isDirectory(dir)) {
                throw new MissingArtifactException(name, "Plugin directory not found: " + dir);
            }
            PluginManifest manifest;
            try {
                manifest = PluginManifestLoader.load(dir);
            } catch (ConfigurationException e) {
                throw new PluginLoadException(name, "Invalid manifest: " + e.getMessage(), e);
            }
            return gate(name, dir, manifest);
        } catch (PluginLoadException e) {
            eventBus.publish(new RuntimeEvent.PluginSkipped(name, e.getMessage()));
            throw e;
        } finally {
            mutationLock.unlock();
        }
    }

    // ==================== 卸载与重载 ====================

    /**
     * 关闭实例，释放目录注册与授权
     *
     * @return 插件原本未加载时返回 false
     */
    public boolean unload(String name) {
        mutationLock.lock();
        try {
            PluginRecord record = plugins.remove(name);
            if (record == null) {
                log.warn("Plugin not loaded: {}", name);
                return false;
            }
            loadOrder.remove(name);
            log.info("Unloading plugin: {}", name);

            List<String> dependents = dependentsOf(name);
            if (!dependents.isEmpty()) {
                log.warn("[{}] Unloaded while still required by: {}", name, dependents);
            }

            if (record.isGroup()) {
                groupLoader.shutdown(record.getGroup());
            }
            try {
                PluginScope.runAs(name, () -> record.getInstance().shutdown());
            } catch (Exception e) {
                log.error("[{}] Error during shutdown", name, e);
            }
            release(name, record.getClassLoader());
            eventBus.publish(new RuntimeEvent.PluginUnloaded(name));
            return true;
        } finally {
            mutationLock.unlock();
        }
    }

    /**
     * 卸载后重新执行完整的加载闸门
     *
     * @throws PluginLoadException 重新加载失败，插件保持未加载状态
     */
    public PluginRecord reload(String name) {
        mutationLock.lock();
        try {
            log.info("Reloading plugin: {}", name);
            unload(name);
            return loadPlugin(name);
        } finally {
            mutationLock.unlock();
        }
    }

    /**
     * 按加载的逆序卸载全部插件
     */
    public void shutdown() {
        mutationLock.lock();
        try {
            log.info("Shutting down PluginLoader...");
            List<String> names = new ArrayList<>(loadOrder);
            Collections.reverse(names);
            for (String name : names) {
                try {
                    unload(name);
                } catch (Exception e) {
                    log.error("[{}] Error unloading plugin", name, e);
                }
            }
            stopTaskPool();
            log.info("PluginLoader shutdown complete.");
        } finally {
            mutationLock.unlock();
        }
    }

    // ==================== 查询 ====================

    public Optional<PluginRecord> find(String name) {
        return Optional.ofNullable(plugins.get(name));
    }

    public boolean isLoaded(String name) {
        return plugins.containsKey(name);
    }

    /**
     * 已加载插件（按加载顺序）
     */
    public Map<String, PluginRecord> getLoadedPlugins() {
        Map<String, PluginRecord> snapshot = new LinkedHashMap<>();
        for (String name : loadOrder) {
            PluginRecord record = plugins.get(name);
            if (record != null) {
                snapshot.put(name, record);
            }
        }
        return Collections.unmodifiableMap(snapshot);
    }

    public List<String> getViolations(String name) {
        return ledger.getViolations(name);
    }

    public Path getPluginHome() {
        return config.pluginHomePath();
    }

    public RuntimeEventBus getEventBus() {
        return eventBus;
    }

    public PluginFactoryRegistry getFactoryRegistry() {
        return factoryRegistry;
    }

    /**
     * 候选插件目录：忽略以 _ 或 . 开头的目录，按 enabled 白名单过滤；
     * 白名单为空且关闭 autoLoad 时不加载任何插件
     */
    public List<Path> discoverCandidates() {
        Path home = getPluginHome();
        if (!Files.isDirectory(home)) {
            log.warn("Plugin directory does not exist: {}", home);
            return List.of();
        }
        List<String> enabled = config.getEnabled() == null ? List.of() : config.getEnabled();
        if (enabled.isEmpty() && !config.isAutoLoad()) {
            log.info("No plugins enabled and autoLoad is false");
            return List.of();
        }
        List<Path> result = new ArrayList<>();
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(home, Files::isDirectory)) {
            for (Path dir : dirs) {
                String name = dir.getFileName().toString();
                if (name.startsWith("_") || name.startsWith(".")) {
                    continue;
                }
                if (!enabled.isEmpty() && !enabled.contains(name)) {
                    log.debug("[{}] Not in enabled list, skipping", name);
                    continue;
                }
                result.add(dir);
            }
        } catch (IOException e) {
            log.error("Failed to list plugin directory {}", home, e);
        }
        result.sort(null);
        return result;
    }

    // ==================== 加载闸门 ====================

    private PluginRecord gate(String name, Path dir, PluginManifest manifest) {
        // 1. 安装登记
        if (!installRegistry.isInstalled(name)) {
            throw new PluginLoadException(name, "Plugin '" + name + "' is not marked as installed in registry");
        }

        // 2. 安全校验（签名、字节码）
        for (PluginSecurityVerifier verifier : verifiers) {
            try {
                verifier.verify(name, dir);
            } catch (SecurityException e) {
                throw new PluginLoadException(name, "Security verification failed: " + e.getMessage(), e);
            }
        }

        // 3. 依赖存在且版本匹配
        checkDependencies(name, manifest);

        // 4. 锁文件是唯一的授权来源
        Path lockPath = LockFile.locate(dir);
        if (!Files.isRegularFile(lockPath)) {
            throw new MissingArtifactException(name,
                    "Permission lock file missing; plugin '" + name + "' is not considered installed");
        }
        LockFile lock;
        try {
            lock = LockFile.read(lockPath);
        } catch (ConfigurationException e) {
            throw new PluginLoadException(name, e.getMessage(), e);
        }
        if (lock.getPluginName() != null && !lock.getPluginName().equals(name)) {
            throw new PluginLoadException(name,
                    "Lock file belongs to plugin '" + lock.getPluginName() + "', not '" + name + "'");
        }
        declarationValidator.validate(manifest);

        // 5. 授权入账  6. 目录注册
        Set<String> granted = ledger.grantFromLock(name, lock);
        InterceptionEngine.PluginPaths paths = interceptionEngine.registerPluginPaths(name, dir);

        PluginClassLoader classLoader = null;
        PrismPlugin instance = null;
        try {
            Files.createDirectories(paths.dataDirectory());
            classLoader = PluginClassLoader.forPluginDirectory(name, dir, PrismPlugin.class.getClassLoader());
            boolean isGroup = PluginManifestLoader.isGroup(dir);
            PluginFactory factory = factoryRegistry.find(name, classLoader).orElse(null);
            if (factory == null) {
                if (!isGroup) {
                    throw new MissingArtifactException(name, "No entry point found for plugin '" + name + "'");
                }
                // 组本身没有入口时，按名引用组只做透传
                factory = PluginFactory.of(name, PluginGroup.PassThrough::new);
            }
            PluginFactory entry = factory;

            // 7. 在插件作用域内实例化与初始化
            PluginTaskExecutor executor = new PluginTaskExecutor(name, taskPool(), propagators);
            CorePluginContext context = new CorePluginContext(name, manifest.getVersion(), paths.root(),
                    paths.dataDirectory(), manifest.getProperties(), permissionView, executor);
            log.info("[{}] Initializing plugin within sandbox scope", name);
            instance = PluginScope.callAs(name, () -> {
                PrismPlugin created = entry.create();
                created.initialize(context);
                return created;
            });

            PluginGroup group = null;
            if (isGroup) {
                group = groupLoader.load(name, paths.root(), paths.dataDirectory(), classLoader, executor);
            }

            PluginRecord record = new PluginRecord(name, manifest, paths.root(), paths.dataDirectory(),
                    instance, classLoader, granted, group);
            plugins.put(name, record);
            loadOrder.add(name);
            log.info("[{}] Plugin loaded successfully: version={}, capabilities={}, group={}",
                    name, manifest.getVersion(), granted.size(), group != null);
            eventBus.publish(new RuntimeEvent.PluginLoaded(name, manifest.getVersion(), group != null));
            return record;
        } catch (Exception e) {
            if (instance != null) {
                shutdownQuietly(name, instance);
            }
            release(name, classLoader);
            if (e instanceof PluginLoadException ple) {
                throw ple;
            }
            throw new PluginLoadException(name, "Failed to initialize plugin '" + name + "': " + e.getMessage(), e);
        }
    }

    private synchronized ExecutorService taskPool() {
        if (taskPool == null || taskPool.isShutdown()) {
            taskPool = new ThreadPoolExecutor(
                    TASK_CORE_POOL_SIZE,
                    TASK_MAX_POOL_SIZE,
                    TASK_KEEP_ALIVE_SECONDS, TimeUnit.SECONDS,
                    new LinkedBlockingQueue<>(TASK_QUEUE_CAPACITY),
                    r -> {
                        Thread t = new Thread(r, "prism-plugin-task-" + taskThreadNumber.getAndIncrement());
                        t.setDaemon(true);
                        return t;
                    },
                    new ThreadPoolExecutor.AbortPolicy());
        }
        return taskPool;
    }

    private synchronized void stopTaskPool() {
        if (taskPool != null) {
            taskPool.shutdown();
            taskPool = null;
        }
    }

    private void checkDependencies(String name, PluginManifest manifest) {
        List<String> unmet = new ArrayList<>();
        for (PluginManifest.DependencySpec dep : manifest.getDependencies()) {
            PluginRecord target = plugins.get(dep.name());
            if (target == null) {
                unmet.add(dep.name() + "@" + (dep.hasConstraint() ? dep.constraint() : "*"));
                continue;
            }
            if (!dep.hasConstraint()) {
                continue;
            }
            try {
                VersionConstraint constraint = VersionConstraint.parse(dep.constraint());
                if (!constraint.isSatisfiedBy(Version.parse(target.getVersion()))) {
                    unmet.add(dep + " (have " + target.getVersion() + ")");
                }
            } catch (ConfigurationException e) {
                if (config.isStrictVersionConstraints()) {
                    unmet.add(dep + " (unparseable: " + e.getMessage() + ")");
                } else {
                    log.warn("[{}] Could not validate version constraint {} against {}: {}; accepting",
                            name, dep, target.getVersion(), e.getMessage());
                }
            }
        }
        if (!unmet.isEmpty()) {
            throw new UnmetDependencyException(name, unmet);
        }
    }

    private List<String> dependentsOf(String name) {
        List<String> dependents = new ArrayList<>();
        for (PluginRecord record : plugins.values()) {
            for (PluginManifest.DependencySpec dep : record.getManifest().getDependencies()) {
                if (dep.name().equals(name)) {
                    dependents.add(record.getName());
                }
            }
        }
        return dependents;
    }

    private void release(String name, PluginClassLoader classLoader) {
        ledger.release(name);
        interceptionEngine.unregisterPluginPaths(name);
        if (classLoader != null) {
            try {
                classLoader.close();
            } catch (IOException e) {
                log.warn("[{}] Failed to close class loader: {}", name, e.getMessage());
            }
        }
    }

    private void shutdownQuietly(String name, PrismPlugin instance) {
        try {
            PluginScope.runAs(name, instance::shutdown);
        } catch (Exception e) {
            log.warn("[{}] Error shutting down partially loaded plugin: {}", name, e.getMessage());
        }
    }

    private void skip(String name, String reason, Exception e) {
        if (e instanceof PluginLoadException || e instanceof ConfigurationException) {
            log.error("[{}] Skipping plugin: {}", name, reason);
        } else {
            log.error("[{}] Skipping plugin: {}", name, reason, e);
        }
        eventBus.publish(new RuntimeEvent.PluginSkipped(name, reason));
    }
}
