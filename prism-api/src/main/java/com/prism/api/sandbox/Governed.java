package com.prism.api.sandbox;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.CopyOption;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * 插件访问文件、网络、子进程的唯一入口
 * <p>
 * 每个方法在产生副作用之前先上报 {@link AuditHooks}，被拒绝时抛出
 * {@link com.prism.api.exception.PermissionDeniedException}，操作不会发生。
 * </p>
 *
 * @author Prism
 */
public final class Governed {

    private Governed() {
    }

    // ==================== 文件 ====================

    public static InputStream newInputStream(Path path) throws IOException {
        AuditHooks.audit(GovernedOperations.FILE_OPEN, path, "r");
        return Files.newInputStream(path);
    }

    public static OutputStream newOutputStream(Path path, boolean append) throws IOException {
        AuditHooks.audit(GovernedOperations.FILE_OPEN, path, append ? "a" : "w");
        if (append) {
            return Files.newOutputStream(path, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        }
        return Files.newOutputStream(path);
    }

    public static String readString(Path path) throws IOException {
        AuditHooks.audit(GovernedOperations.FILE_OPEN, path, "r");
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    public static byte[] readAllBytes(Path path) throws IOException {
        AuditHooks.audit(GovernedOperations.FILE_OPEN, path, "r");
        return Files.readAllBytes(path);
    }

    public static void writeString(Path path, String content) throws IOException {
        AuditHooks.audit(GovernedOperations.FILE_OPEN, path, "w");
        Files.writeString(path, content, StandardCharsets.UTF_8);
    }

    public static void appendString(Path path, String content) throws IOException {
        AuditHooks.audit(GovernedOperations.FILE_OPEN, path, "a");
        Files.writeString(path, content, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    public static Path move(Path source, Path target, CopyOption... options) throws IOException {
        AuditHooks.audit(GovernedOperations.FILE_RENAME, source, target);
        return Files.move(source, target, options);
    }

    public static boolean deleteIfExists(Path path) throws IOException {
        AuditHooks.audit(GovernedOperations.FILE_DELETE, path);
        return Files.deleteIfExists(path);
    }

    // ==================== 网络 ====================

    public static Socket connect(String host, int port) throws IOException {
        AuditHooks.audit(GovernedOperations.SOCKET_CONNECT, host, port);
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port));
        } catch (IOException e) {
            socket.close();
            throw e;
        }
        return socket;
    }

    // ==================== 子进程 ====================

    public static Process start(List<String> command) throws IOException {
        List<String> copy = List.copyOf(command);
        AuditHooks.audit(GovernedOperations.PROCESS_START, copy);
        return new ProcessBuilder(copy).start();
    }
}
