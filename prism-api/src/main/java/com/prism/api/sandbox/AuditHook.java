package com.prism.api.sandbox;

/**
 * 敏感操作审计钩子
 * <p>
 * 整个进程只安装一个（见 {@link AuditHooks}）。{@link Governed} 在执行每个敏感操作前调用它，
 * 钩子通过抛出 {@link com.prism.api.exception.PermissionDeniedException} 拒绝操作。
 * </p>
 */
@FunctionalInterface
public interface AuditHook {

    /**
     * @param event 操作事件名，见 {@link GovernedOperations}
     * @param args  事件参数，约定见各事件常量
     */
    void audit(String event, Object... args);
}
