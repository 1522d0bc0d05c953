package com.prism.api.sandbox;

/**
 * 受管控的操作事件名
 */
public final class GovernedOperations {

    /**
     * 打开文件。参数：(Path path, String mode)，mode 取 "r" / "w" / "a" / "r+"
     */
    public static final String FILE_OPEN = "file.open";

    /**
     * 重命名/移动文件。参数：(Path source, Path target)
     */
    public static final String FILE_RENAME = "file.rename";

    /**
     * 删除文件。参数：(Path path)
     */
    public static final String FILE_DELETE = "file.delete";

    /**
     * 出站连接。参数：(String host, Integer port)
     */
    public static final String SOCKET_CONNECT = "socket.connect";

    /**
     * 进程类事件的公共前缀
     */
    public static final String PROCESS_PREFIX = "process.";

    /**
     * 启动子进程。参数：(List&lt;String&gt; command)
     */
    public static final String PROCESS_START = "process.start";

    private GovernedOperations() {
    }
}
