package com.prism.api.exception;

import lombok.Getter;

/**
 * 调用链步骤执行异常
 * 只在调用链执行器内部使用，转换为响应级错误条目后不会继续向上传播。
 */
@Getter
public class ChainExecutionException extends PrismException {

    private final String pluginName;

    public ChainExecutionException(String pluginName, Throwable cause) {
        super("Plugin '" + pluginName + "' failed: " + cause.getMessage(), cause);
        this.pluginName = pluginName;
    }
}
