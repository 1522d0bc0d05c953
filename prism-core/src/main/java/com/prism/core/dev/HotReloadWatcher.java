package com.prism.core.dev;

import com.prism.core.plugin.PluginLoader;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * 热加载监听器
 * 职责：定时轮询插件目录的文件指纹（修改时间、大小，可选 SHA-256），发现变化后重载插件
 * <p>
 * 重载串行执行；轮询间隔内不持有重载锁。
 * </p>
 */
@Slf4j
public class HotReloadWatcher implements AutoCloseable {

    private static final Set<String> WATCHED_EXTENSIONS = Set.of(".yml", ".yaml", ".json", ".jar", ".class");

    private final PluginLoader pluginLoader;
    private final long intervalMs;
    private final boolean useHash;

    private final Map<String, Map<String, FileFingerprint>> states = new ConcurrentHashMap<>();
    private final Map<String, List<ReloadRecord>> history = new ConcurrentHashMap<>();
    private final ReentrantLock reloadLock = new ReentrantLock();

    private ScheduledExecutorService scheduler;
    private volatile boolean running;

    public HotReloadWatcher(PluginLoader pluginLoader) {
        this(pluginLoader, pluginLoader.getConfig().getHotReloadIntervalMs(), pluginLoader.getConfig().isHotReloadUseHash());
    }

    public HotReloadWatcher(PluginLoader pluginLoader, long intervalMs, boolean useHash) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("Hot reload interval must be positive: " + intervalMs);
        }
        this.pluginLoader = pluginLoader;
        this.intervalMs = intervalMs;
        this.useHash = useHash;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        states.clear();
        states.putAll(snapshotAll());
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "prism-hot-reload");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::pollSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        running = true;
        log.info("[HotReload] Watching {} (interval={}ms, hash={})", pluginLoader.getPluginHome(), intervalMs, useHash);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        scheduler.shutdownNow();
        scheduler = null;
        log.info("[HotReload] Watcher stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * 对比文件指纹，重载发生变化的插件
     *
     * @return 检测到变化并尝试重载的插件
     */
    public List<String> checkChanges() {
        Map<String, Map<String, FileFingerprint>> current = snapshotAll();
        List<String> changed = new ArrayList<>();
        for (Map.Entry<String, Map<String, FileFingerprint>> entry : current.entrySet()) {
            Map<String, FileFingerprint> previous = states.get(entry.getKey());
            if (previous != null && !previous.equals(entry.getValue())) {
                changed.add(entry.getKey());
            }
        }
        states.keySet().retainAll(current.keySet());
        current.forEach(states::put);

        for (String name : changed) {
            log.info("[HotReload] Detected changes in plugin: {}", name);
            forceReload(name);
        }
        return changed;
    }

    /**
     * 立即重载插件，记录到重载历史
     *
     * @return 重载是否成功
     */
    public boolean forceReload(String pluginName) {
        reloadLock.lock();
        try {
            List<ReloadRecord> records = history.computeIfAbsent(pluginName, k -> new CopyOnWriteArrayList<>());
            ReloadRecord started = ReloadRecord.started(pluginName);
            records.add(started);
            int index = records.size() - 1;
            try {
                pluginLoader.reload(pluginName);
                records.set(index, started.finish(ReloadOutcome.SUCCESS, null));
                log.info("[HotReload] Plugin reload success: {}", pluginName);
                return true;
            } catch (Exception e) {
                records.set(index, started.finish(ReloadOutcome.FAILED, e.getMessage()));
                log.error("[HotReload] Plugin reload failed: {}: {}", pluginName, e.getMessage());
                return false;
            } finally {
                Path dir = pluginLoader.getPluginHome().resolve(pluginName);
                if (Files.isDirectory(dir)) {
                    states.put(pluginName, snapshot(dir));
                }
            }
        } finally {
            reloadLock.unlock();
        }
    }

    /**
     * 逐个重载当前已加载的全部插件
     */
    public Map<String, Boolean> reloadAll() {
        Map<String, Boolean> results = new LinkedHashMap<>();
        for (String name : new ArrayList<>(pluginLoader.getLoadedPlugins().keySet())) {
            results.put(name, forceReload(name));
        }
        return results;
    }

    public Map<String, List<ReloadRecord>> getReloadHistory() {
        Map<String, List<ReloadRecord>> copy = new TreeMap<>();
        history.forEach((name, records) -> copy.put(name, List.copyOf(records)));
        return Collections.unmodifiableMap(copy);
    }

    public List<ReloadRecord> getReloadHistory(String pluginName) {
        List<ReloadRecord> records = history.get(pluginName);
        return records == null ? List.of() : List.copyOf(records);
    }

    public WatcherStatus getStatus() {
        int totalFiles = states.values().stream().mapToInt(Map::size).sum();
        return new WatcherStatus(running, intervalMs, useHash, new ArrayList<>(new TreeMap<>(states).keySet()), totalFiles);
    }

    private void pollSafely() {
        try {
            checkChanges();
        } catch (Exception e) {
            log.error("[HotReload] Error in watch loop", e);
        }
    }

    // ==================== 指纹 ====================

    private Map<String, Map<String, FileFingerprint>> snapshotAll() {
        Map<String, Map<String, FileFingerprint>> result = new LinkedHashMap<>();
        Path home = pluginLoader.getPluginHome();
        if (!Files.isDirectory(home)) {
            return result;
        }
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(home, Files::isDirectory)) {
            for (Path dir : dirs) {
                String name = dir.getFileName().toString();
                if (name.startsWith("_") || name.startsWith(".")) {
                    continue;
                }
                result.put(name, snapshot(dir));
            }
        } catch (IOException e) {
            log.warn("[HotReload] Failed to scan plugin directory {}: {}", home, e.getMessage());
        }
        return result;
    }

    private Map<String, FileFingerprint> snapshot(Path pluginDir) {
        Map<String, FileFingerprint> files = new TreeMap<>();
        try (Stream<Path> walk = Files.walk(pluginDir)) {
            walk.filter(Files::isRegularFile)
                    .filter(this::isWatched)
                    .forEach(file -> {
                        FileFingerprint fingerprint = fingerprint(file);
                        if (fingerprint != null) {
                            files.put(pluginDir.relativize(file).toString(), fingerprint);
                        }
                    });
        } catch (IOException | UncheckedIOException e) {
            log.warn("[HotReload] Failed to walk {}: {}", pluginDir, e.getMessage());
        }
        return files;
    }

    private boolean isWatched(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 && WATCHED_EXTENSIONS.contains(name.substring(dot));
    }

    private FileFingerprint fingerprint(Path file) {
        try {
            long modified = Files.getLastModifiedTime(file).toMillis();
            long size = Files.size(file);
            return new FileFingerprint(modified, size, useHash ? sha256(file) : null);
        } catch (IOException e) {
            // 文件在扫描期间被删除
            log.debug("[HotReload] Cannot stat {}: {}", file, e.getMessage());
            return null;
        }
    }

    private static String sha256(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] buffer = new byte[8192];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // ==================== 数据结构 ====================

    record FileFingerprint(long modifiedMillis, long size, String hash) {
    }

    public enum ReloadOutcome {
        STARTED, SUCCESS, FAILED
    }

    /**
     * 一次重载尝试
     */
    public record ReloadRecord(String pluginName, Instant startedAt, Instant finishedAt,
                               ReloadOutcome outcome, String error) {

        static ReloadRecord started(String pluginName) {
            return new ReloadRecord(pluginName, Instant.now(), null, ReloadOutcome.STARTED, null);
        }

        ReloadRecord finish(ReloadOutcome outcome, String error) {
            return new ReloadRecord(pluginName, startedAt, Instant.now(), outcome, error);
        }
    }

    public record WatcherStatus(boolean running, long intervalMs, boolean useHash,
                                List<String> watchedPlugins, int totalFiles) {
    }
}
