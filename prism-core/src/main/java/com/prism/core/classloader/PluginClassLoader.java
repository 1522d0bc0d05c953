package com.prism.core.classloader;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;

/**
 * 插件类加载器
 * 特性：
 * 1. Child-First (优先加载插件内部类)
 * 2. 强制委派白名单 (Prism API 契约与 JDK 必须走父加载器)
 * 3. 运行时内部包 com.prism.core 对插件隐藏
 * 3. 资源加载 Child-First，服务注册文件合并父加载器的结果
 */
@Slf4j
public class PluginClassLoader extends URLClassLoader {

    // 必须强制走父加载器的包（契约包 + JDK + 日志门面）
    private static final List<String> FORCE_PARENT_PACKAGES = List.of(
            "java.", "javax.", "jdk.", "sun.", "com.sun.", "org.w3c.", "org.xml.",
            "com.prism.api.", // API 契约必须共享
            "org.slf4j.");

    // 运行时内部实现，插件不可见（账本、拦截引擎等）
    private static final List<String> HIDDEN_PACKAGES = List.of("com.prism.core.");

    @Getter
    private final String pluginName;

    private volatile boolean closed;

    public PluginClassLoader(String pluginName, URL[] urls, ClassLoader parent) {
        super("prism-plugin-" + pluginName, urls, parent);
        this.pluginName = pluginName;
    }

    /**
     * 为插件目录创建类加载器：plugin.jar、classes/ 与 lib/*.jar
     *
     * @return 插件目录中没有任何代码时返回 null
     */
    public static PluginClassLoader forPluginDirectory(String pluginName, Path root, ClassLoader parent)
            throws IOException {
        List<URL> urls = new ArrayList<>();
        addIfPresent(urls, root.resolve("plugin.jar"), false);
        addIfPresent(urls, root.resolve("classes"), true);
        Path lib = root.resolve("lib");
        if (Files.isDirectory(lib)) {
            try (DirectoryStream<Path> jars = Files.newDirectoryStream(lib, "*.jar")) {
                for (Path jar : jars) {
                    addIfPresent(urls, jar, false);
                }
            }
        }
        if (urls.isEmpty()) {
            return null;
        }
        log.debug("[{}] Plugin classpath: {}", pluginName, urls);
        return new PluginClassLoader(pluginName, urls.toArray(new URL[0]), parent);
    }

    private static void addIfPresent(List<URL> urls, Path path, boolean directory) throws MalformedURLException {
        if (directory ? Files.isDirectory(path) : Files.isRegularFile(path)) {
            urls.add(path.toUri().toURL());
        }
    }

    @Override
    public Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        if (closed) {
            throw new ClassNotFoundException("ClassLoader of plugin [" + pluginName + "] is closed: " + name);
        }
        synchronized (getClassLoadingLock(name)) {
            // 1. 检查缓存
            Class<?> c = findLoadedClass(name);
            if (c != null) return c;

            // 2. 运行时内部类对插件不可见
            if (isHidden(name)) {
                throw new ClassNotFoundException("Class " + name + " is not visible to plugin [" + pluginName + "]");
            }

            // 3. 白名单强制委派给父加载器 (防止 ClassCastException)
            if (shouldDelegateToParent(name)) {
                return super.loadClass(name, resolve);
            }

            // 4. Child-First: 优先自己加载
            try {
                c = findClass(name);
            } catch (ClassNotFoundException e) {
                // 5. 兜底: 自己没有，再找父亲
                c = super.loadClass(name, false);
            }

            if (resolve) resolveClass(c);
            return c;
        }
    }

    @Override
    public URL getResource(String name) {
        if (closed) {
            return null;
        }
        URL url = findResource(name);
        if (url != null) return url;
        return super.getResource(name);
    }

    @Override
    public Enumeration<URL> getResources(String name) throws IOException {
        if (closed) {
            return Collections.emptyEnumeration();
        }
        // 组合资源：自己的 + 父加载器的
        List<URL> urls = new ArrayList<>(Collections.list(findResources(name)));
        if (getParent() != null) {
            urls.addAll(Collections.list(getParent().getResources(name)));
        }
        return Collections.enumeration(urls);
    }

    @Override
    public void close() throws IOException {
        closed = true;
        super.close();
        log.debug("[{}] ClassLoader closed", pluginName);
    }

    public boolean isClosed() {
        return closed;
    }

    private static boolean isHidden(String name) {
        for (String pkg : HIDDEN_PACKAGES) {
            if (name.startsWith(pkg)) return true;
        }
        return false;
    }

    private boolean shouldDelegateToParent(String name) {
        for (String pkg : FORCE_PARENT_PACKAGES) {
            if (name.startsWith(pkg)) return true;
        }
        return false;
    }
}
