package com.prism.core.security;

import com.prism.api.exception.PermissionDeniedException;
import com.prism.api.sandbox.AuditHook;
import com.prism.api.sandbox.AuditHooks;
import com.prism.api.sandbox.GovernedOperations;
import com.prism.core.config.PrismConfig;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 拦截引擎：进程内唯一的 {@link AuditHook}
 * <p>
 * 每个受控操作按顺序检查：
 * <ol>
 *     <li>固定围墙：安全存储目录、插件自己的锁文件、任何锁文件的重命名/删除</li>
 *     <li>目录围墙：文件路径必须位于插件根目录或其临时数据目录内，持有特权前缀能力者除外</li>
 *     <li>能力检查：已授予集合与所需能力集合有交集即放行</li>
 * </ol>
 * 不在插件作用域内的操作不做任何检查。
 */
@Slf4j
public class InterceptionEngine implements AuditHook {

    private final PermissionEngine permissionEngine;
    private final CapabilityLedger ledger;
    private final Path secureDirectory;
    private final Path tempDataRoot;
    private final String privilegedPrefix;
    private final String secureDirectoryName;

    private final Map<String, PluginPaths> pluginPaths = new ConcurrentHashMap<>();
    private volatile boolean active;

    public InterceptionEngine(PermissionEngine permissionEngine, CapabilityLedger ledger, PrismConfig config) {
        this.permissionEngine = permissionEngine;
        this.ledger = ledger;
        this.secureDirectory = config.secureDirectoryPath();
        this.tempDataRoot = config.tempDataPath();
        this.privilegedPrefix = config.getPrivilegedPrefix();
        this.secureDirectoryName = secureDirectory.getFileName() == null
                ? "" : secureDirectory.getFileName().toString().toLowerCase(Locale.ROOT);
    }

    // ==================== 生命周期 ====================

    public synchronized void activate() {
        if (active) {
            log.warn("Interception engine is already active.");
            return;
        }
        AuditHooks.install(this);
        active = true;
        log.info("Interception engine activated. Sandboxing is now enforced.");
    }

    public synchronized void deactivate() {
        if (!active) {
            return;
        }
        AuditHooks.uninstall(this);
        active = false;
        log.info("Interception engine deactivated.");
    }

    public boolean isActive() {
        return active;
    }

    // ==================== 目录注册 ====================

    /**
     * 注册插件可自由访问的目录，必须在插件初始化前调用
     */
    public PluginPaths registerPluginPaths(String pluginName, Path rootDirectory) {
        PluginPaths paths = new PluginPaths(
                rootDirectory.toAbsolutePath().normalize(),
                tempDataRoot.resolve(pluginName).normalize());
        pluginPaths.put(pluginName, paths);
        log.debug("[{}] Registered jail root {} and temp dir {}", pluginName, paths.root(), paths.dataDirectory());
        return paths;
    }

    public void unregisterPluginPaths(String pluginName) {
        pluginPaths.remove(pluginName);
    }

    public PluginPaths getPluginPaths(String pluginName) {
        return pluginPaths.get(pluginName);
    }

    // ==================== 钩子 ====================

    @Override
    public void audit(String event, Object... args) {
        String pluginName = PluginScope.current();
        if (pluginName == null) {
            return;
        }

        checkFixedJail(pluginName, event, args);

        Set<String> required = permissionEngine.mapEventToPermissions(event, args);
        if (required.isEmpty()) {
            return;
        }

        for (Object path : filePaths(event, args)) {
            enforceDirectoryJail(pluginName, event, path);
        }

        for (String capability : required) {
            if (ledger.isGranted(pluginName, capability)) {
                return;
            }
        }
        String message = String.format(
                "Plugin '%s' blocked from performing unauthorized action. Event: %s, Required one of Permissions: %s, Resource: %s",
                pluginName, event, new ArrayList<>(required), args != null && args.length > 0 ? args[0] : "N/A");
        deny(pluginName, event, message);
    }

    /**
     * 与能力无关的固定规则
     */
    public void checkFixedJail(String pluginName, String event, Object... args) {
        if (GovernedOperations.FILE_OPEN.equals(event) && args.length > 0) {
            checkProtectedAccess(pluginName, event, args[0], args.length > 1 ? args[1] : null);
        } else if (GovernedOperations.FILE_RENAME.equals(event) || GovernedOperations.FILE_DELETE.equals(event)) {
            for (Object path : args) {
                checkProtectedAccess(pluginName, event, path, "w");
                if (String.valueOf(path).toLowerCase(Locale.ROOT).replace('\\', '/').contains(LockFile.FILE_NAME)) {
                    deny(pluginName, event, String.format(
                            "Plugin '%s' attempted to modify a lock file via %s: %s", pluginName, event, path));
                }
            }
        }
    }

    private void checkProtectedAccess(String pluginName, String event, Object pathArg, Object mode) {
        Path absolute;
        try {
            absolute = toAbsolute(pathArg);
        } catch (InvalidPathException e) {
            boolean write = mode instanceof String m && (m.contains("w") || m.contains("a") || m.contains("+"));
            String lowered = String.valueOf(pathArg).toLowerCase(Locale.ROOT).replace('\\', '/');
            if (lowered.contains(secureDirectoryName + "/") || (write && lowered.contains(LockFile.FILE_NAME))) {
                deny(pluginName, event, String.format(
                        "Plugin '%s' attempted suspicious file access (string check): %s", pluginName, pathArg));
            }
            return;
        }

        if (absolute.startsWith(secureDirectory)) {
            deny(pluginName, event, String.format(
                    "Plugin '%s' attempted to access system secure directory: %s. Access denied!", pluginName, pathArg));
        }
        PluginPaths paths = pluginPaths.get(pluginName);
        if (paths != null && absolute.equals(paths.root().resolve(LockFile.FILE_NAME))) {
            deny(pluginName, event, String.format(
                    "Plugin '%s' attempted to access its own lock file: %s", pluginName, pathArg));
        }
    }

    /**
     * 目录围墙；路径无法解析时拒绝
     */
    public void enforceDirectoryJail(String pluginName, String event, Object pathArg) {
        Path absolute;
        try {
            absolute = toAbsolute(pathArg);
        } catch (InvalidPathException e) {
            deny(pluginName, event, String.format(
                    "Could not resolve path for resource '%s': %s", pathArg, e.getMessage()));
            return;
        }
        PluginPaths paths = pluginPaths.get(pluginName);
        if (paths == null) {
            deny(pluginName, event, String.format("Plugin '%s' root path not registered", pluginName));
            return;
        }
        if (paths.contains(absolute)) {
            return;
        }
        if (ledger.hasCapabilityWithPrefix(pluginName, privilegedPrefix)) {
            return;
        }
        deny(pluginName, event, String.format(
                "Plugin '%s' attempted to access path outside its allowed directories: %s", pluginName, pathArg));
    }

    private void deny(String pluginName, String event, String message) {
        ledger.logViolation(pluginName, message);
        throw new PermissionDeniedException(pluginName, event, message);
    }

    private static List<Object> filePaths(String event, Object[] args) {
        if (args == null || args.length == 0) {
            return List.of();
        }
        if (GovernedOperations.FILE_OPEN.equals(event) || GovernedOperations.FILE_DELETE.equals(event)) {
            return Collections.singletonList(args[0]);
        }
        if (GovernedOperations.FILE_RENAME.equals(event)) {
            return Arrays.asList(args);
        }
        return List.of();
    }

    private static Path toAbsolute(Object pathArg) {
        if (pathArg == null) {
            throw new InvalidPathException("null", "path is null");
        }
        Path path = pathArg instanceof Path p ? p : Path.of(String.valueOf(pathArg));
        return path.toAbsolutePath().normalize();
    }

    /**
     * 插件可访问的两个目录
     */
    public record PluginPaths(Path root, Path dataDirectory) {

        public boolean contains(Path absolute) {
            return absolute.startsWith(root) || absolute.startsWith(dataDirectory);
        }
    }
}
