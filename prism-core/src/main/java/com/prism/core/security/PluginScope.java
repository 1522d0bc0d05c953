package com.prism.core.security;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * 当前执行插件的身份
 * <p>
 * 线程绑定，在进入插件代码前设置，任何退出路径上恢复为之前的值。
 * 插件作用域内新建的线程继承当前身份；线程池中的任务使用 {@link #wrap}、
 * {@link PluginScopePropagator} 或插件上下文提供的执行器搬运身份。
 * </p>
 */
public final class PluginScope {

    private static final InheritableThreadLocal<String> CURRENT = new InheritableThreadLocal<>();

    private PluginScope() {
    }

    /**
     * @return 当前插件名称，不在任何插件作用域内时为 null
     */
    public static String current() {
        return CURRENT.get();
    }

    public static <T> T callAs(String pluginName, Callable<T> action) throws Exception {
        Objects.requireNonNull(pluginName, "pluginName");
        String previous = enter(pluginName);
        try {
            return action.call();
        } finally {
            restore(previous);
        }
    }

    public static void runAs(String pluginName, ScopedAction action) throws Exception {
        Objects.requireNonNull(pluginName, "pluginName");
        String previous = enter(pluginName);
        try {
            action.run();
        } finally {
            restore(previous);
        }
    }

    /**
     * 捕获调用方当前身份，在执行线程中重放
     */
    public static Runnable wrap(Runnable task) {
        String captured = current();
        return () -> {
            String previous = enter(captured);
            try {
                task.run();
            } finally {
                restore(previous);
            }
        };
    }

    public static <T> Callable<T> wrap(Callable<T> task) {
        String captured = current();
        return () -> {
            String previous = enter(captured);
            try {
                return task.call();
            } finally {
                restore(previous);
            }
        };
    }

    static String enter(String pluginName) {
        String previous = CURRENT.get();
        if (pluginName == null) {
            CURRENT.remove();
        } else {
            CURRENT.set(pluginName);
        }
        return previous;
    }

    static void restore(String previous) {
        if (previous == null) {
            CURRENT.remove();
        } else {
            CURRENT.set(previous);
        }
    }

    @FunctionalInterface
    public interface ScopedAction {
        void run() throws Exception;
    }
}
