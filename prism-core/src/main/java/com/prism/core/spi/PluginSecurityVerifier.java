package com.prism.core.spi;

import java.nio.file.Path;

/**
 * 插件安全验证器 SPI
 * 在插件加载前执行签名校验、哈希比对、字节码检查等阻断性操作
 */
public interface PluginSecurityVerifier {

    /**
     * 校验插件目录
     *
     * @throws SecurityException 如果校验失败，抛出异常阻止加载
     */
    void verify(String pluginName, Path pluginRoot) throws SecurityException;
}
