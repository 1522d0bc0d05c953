package com.prism.api.exception;

/**
 * 缺少必要产物（锁文件、清单、入口）
 */
public class MissingArtifactException extends PluginLoadException {

    public MissingArtifactException(String pluginName, String message) {
        super(pluginName, message);
    }
}
