package com.prism.api.security;

/**
 * 内置能力名称常量
 * <p>
 * 锁文件中的 (type, resource) 声明会被映射到这些名称之一。
 * </p>
 */
public final class Capabilities {

    // ==================== 文件 ====================
    /**
     * 读取插件自身目录内的文件
     * <p>声明：type=file, resource=read</p>
     */
    public static final String FILE_READ_PLUGIN = "file.read.plugin";

    /**
     * 写入、重命名、删除插件自身目录内的文件
     * <p>声明：type=file, resource=write</p>
     */
    public static final String FILE_WRITE_PLUGIN = "file.write.plugin";

    // ==================== 网络 ====================
    /**
     * HTTPS 出站 (端口 443)
     * <p>声明：type=network, resource=outbound:https</p>
     */
    public static final String NETWORK_HTTPS = "network.https";

    /**
     * HTTP 出站 (端口 80)
     * <p>声明：type=network, resource=outbound:http</p>
     */
    public static final String NETWORK_HTTP = "network.http";

    // ==================== API ====================
    /**
     * 注册插件自身的 API 路由
     */
    public static final String API_CREATE_ROUTE = "api.create_route";

    // ==================== 系统 ====================
    /**
     * 执行子进程。以 system. 开头，同时视为越过目录围墙的特权能力
     */
    public static final String SYSTEM_SUBPROCESS = "system.subprocess";

    private Capabilities() {
        // 防止实例化
    }
}
