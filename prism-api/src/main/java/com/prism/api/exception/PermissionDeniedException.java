package com.prism.api.exception;

import lombok.Getter;

/**
 * 权限拒绝异常
 * 当插件尝试执行未经授权的操作时，由拦截引擎在调用点同步抛出，操作不会生效。
 *
 * @author Prism
 */
@Getter
public class PermissionDeniedException extends PrismException {

    /**
     * 触发拒绝的插件名称
     */
    private final String pluginName;

    /**
     * 被拦截的操作类别，例如 file.open
     */
    private final String event;

    public PermissionDeniedException(String pluginName, String event, String message) {
        super(message);
        this.pluginName = pluginName;
        this.event = event;
    }

    public PermissionDeniedException(String message) {
        this(null, null, message);
    }
}
