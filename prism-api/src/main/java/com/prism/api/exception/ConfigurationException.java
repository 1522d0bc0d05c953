package com.prism.api.exception;

/**
 * 配置异常
 * 清单、版本约束、调用链条目等格式错误时抛出。通常只影响当前单元（跳过并记录日志）。
 */
public class ConfigurationException extends PrismException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
