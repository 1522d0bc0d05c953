package com.prism.core.spi;

import java.util.Map;
import java.util.Optional;

/**
 * 安装登记 SPI
 * 由外部安装流程写入，运行时只读；未登记的插件不会被加载。
 */
public interface InstallRegistry {

    boolean isInstalled(String pluginName);

    /**
     * 获取登记信息（安装时间、来源、元数据等）
     */
    Optional<Map<String, Object>> getInstallInfo(String pluginName);

    /**
     * 全部已登记插件
     */
    Map<String, Map<String, Object>> listInstalled();
}
