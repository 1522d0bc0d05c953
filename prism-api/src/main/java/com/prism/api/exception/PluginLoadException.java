package com.prism.api.exception;

import lombok.Getter;

/**
 * 单个插件加载失败
 * 只跳过该插件，批次中其他插件继续加载。
 */
@Getter
public class PluginLoadException extends PrismException {

    private final String pluginName;

    public PluginLoadException(String pluginName, String message) {
        super(message);
        this.pluginName = pluginName;
    }

    public PluginLoadException(String pluginName, String message, Throwable cause) {
        super(message, cause);
        this.pluginName = pluginName;
    }
}
