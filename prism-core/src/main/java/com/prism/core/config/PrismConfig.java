package com.prism.core.config;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Prism Core 全局配置对象 (Immutable)
 * <p>
 * 职责：作为 Core 层的唯一配置入口，屏蔽宿主环境的差异。
 * 相对路径均以 {@link #projectRoot} 为基准解析。
 */
@Data
@Builder(toBuilder = true)
@ToString
public class PrismConfig {

    // ================= 目录布局 =================

    /**
     * 项目根目录
     */
    @Builder.Default
    private String projectRoot = ".";

    /**
     * 插件存放根目录，每个子目录是一个插件
     */
    @Builder.Default
    private String pluginHome = "plugins";

    /**
     * 受保护的安全存储目录，任何插件都不可访问
     */
    @Builder.Default
    private String secureDirectory = "system_secure";

    /**
     * 插件临时数据目录的父目录，每个插件一个子目录
     */
    @Builder.Default
    private String tempDataDirectory = "data/temp";

    /**
     * 安装登记文件（由安装流程写入）
     */
    @Builder.Default
    private String registryFile = "plugin_data/plugin_registry.json";

    // ================= 加载 =================

    /**
     * 启动时是否自动加载 home 目录下的插件
     */
    @Builder.Default
    private boolean autoLoad = true;

    /**
     * 启用白名单，为空表示加载全部已安装插件
     */
    @Builder.Default
    private List<String> enabled = Collections.emptyList();

    /**
     * 是否校验插件签名
     */
    @Builder.Default
    private boolean verifySignatures = false;

    /**
     * 受信公钥目录（*.pem，以文件名为签名者 ID）
     */
    @Builder.Default
    private String trustedKeysDirectory = "trusted_keys";

    /**
     * 为 true 时，无法解析的版本约束视为失败；默认宽松处理并告警
     */
    @Builder.Default
    private boolean strictVersionConstraints = false;

    // ================= 热重载 =================

    @Builder.Default
    private boolean hotReload = false;

    /**
     * 轮询间隔（毫秒）
     */
    @Builder.Default
    private long hotReloadIntervalMs = 2000;

    /**
     * 除修改时间与大小外，是否比较内容哈希
     */
    @Builder.Default
    private boolean hotReloadUseHash = false;

    // ================= 安全 =================

    /**
     * 持有此前缀能力的插件可访问自身目录以外的路径
     */
    @Builder.Default
    private String privilegedPrefix = "system.";

    // ================= 路由 =================

    /**
     * 未配置调用链的路由回退到的单插件链，可为 null
     */
    private String defaultPlugin;

    /**
     * 路由 -> 插件引用列表
     */
    @Builder.Default
    private Map<String, List<String>> routes = Collections.emptyMap();

    public static PrismConfig defaults() {
        return PrismConfig.builder().build();
    }

    // ================= 路径解析 =================

    public Path projectRootPath() {
        return Path.of(projectRoot).toAbsolutePath().normalize();
    }

    public Path pluginHomePath() {
        return resolve(pluginHome);
    }

    public Path secureDirectoryPath() {
        return resolve(secureDirectory);
    }

    public Path tempDataPath() {
        return resolve(tempDataDirectory);
    }

    public Path registryFilePath() {
        return resolve(registryFile);
    }

    public Path trustedKeysPath() {
        return resolve(trustedKeysDirectory);
    }

    private Path resolve(String location) {
        return projectRootPath().resolve(location).normalize();
    }
}
