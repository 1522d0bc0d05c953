package com.prism.core.plugin;

import com.prism.core.security.PluginScopePropagator;
import com.prism.core.spi.ThreadLocalPropagator;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;

/**
 * 插件后台任务执行器
 * 职责：提交时捕获插件身份与宿主上下文，在工作线程中重放，任务结束后恢复
 * <p>
 * 提交方不在任何插件作用域内时，任务以所属插件（子插件为所属组）的身份运行，
 * 因此插件交出去的执行器不会产生无归属的受控操作。
 * </p>
 */
@SuppressWarnings({"rawtypes", "unchecked"})
public class PluginTaskExecutor implements Executor {

    @Getter
    private final String owner;
    private final ExecutorService delegate;
    private final PluginScopePropagator scopePropagator = new PluginScopePropagator();
    private final List<ThreadLocalPropagator> propagators;

    public PluginTaskExecutor(String owner, ExecutorService delegate, List<ThreadLocalPropagator> propagators) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.propagators = propagators != null ? new ArrayList<>(propagators) : new ArrayList<>();
    }

    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        String caller = scopePropagator.capture();
        String identity = caller != null ? caller : owner;
        Object[] snapshots = new Object[propagators.size()];
        for (int i = 0; i < propagators.size(); i++) {
            snapshots[i] = propagators.get(i).capture();
        }

        delegate.execute(() -> {
            String scopeBackup = scopePropagator.replay(identity);
            Object[] backups = new Object[propagators.size()];
            for (int i = 0; i < propagators.size(); i++) {
                backups[i] = propagators.get(i).replay(snapshots[i]);
            }
            try {
                task.run();
            } finally {
                for (int i = propagators.size() - 1; i >= 0; i--) {
                    propagators.get(i).restore(backups[i]);
                }
                scopePropagator.restore(scopeBackup);
            }
        });
    }

    @Override
    public String toString() {
        return "PluginTaskExecutor[" + owner + "]";
    }
}
