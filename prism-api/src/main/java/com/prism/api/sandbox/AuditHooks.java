package com.prism.api.sandbox;

import com.prism.api.exception.SandboxException;

/**
 * 进程级唯一审计钩子的持有者
 */
public final class AuditHooks {

    private static volatile AuditHook installed;

    private AuditHooks() {
    }

    /**
     * 安装钩子。重复安装同一个实例是幂等的，安装另一个实例则失败
     *
     * @throws SandboxException 已安装了其他钩子
     */
    public static synchronized void install(AuditHook hook) {
        if (hook == null) {
            throw new SandboxException("Audit hook cannot be null");
        }
        if (installed != null && installed != hook) {
            throw new SandboxException("Another audit hook is already installed: " + installed);
        }
        installed = hook;
    }

    /**
     * 卸载钩子，仅当传入的正是当前已安装的实例时生效
     *
     * @return 是否卸载成功
     */
    public static synchronized boolean uninstall(AuditHook hook) {
        if (installed != null && installed == hook) {
            installed = null;
            return true;
        }
        return false;
    }

    public static boolean isInstalled() {
        return installed != null;
    }

    /**
     * 上报一次敏感操作。未安装钩子时直接放行
     */
    public static void audit(String event, Object... args) {
        AuditHook hook = installed;
        if (hook != null) {
            hook.audit(event, args);
        }
    }
}
