package com.prism.core.security;

import com.prism.api.exception.PrismException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.Set;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 使用 ASM 检测绕过 Governed SDK 的调用
 * <p>
 * 进程终止与子进程创建属于关键违规；直接使用 JDK 文件、网络 API 会绕过拦截引擎，记为警告。
 * </p>
 */
@Slf4j
public class UngovernedApiScanner {

    private static final Set<String> FORBIDDEN_METHODS = Set.of(
            "java/lang/System.exit(I)V",
            "java/lang/Runtime.exit(I)V",
            "java/lang/Runtime.halt(I)V");

    private static final Set<String> FORBIDDEN_PREFIXES = Set.of(
            "java/lang/Runtime.exec",
            "java/lang/ProcessBuilder.start");

    private static final Set<String> WARN_PREFIXES = Set.of(
            "java/io/FileInputStream.<init>",
            "java/io/FileOutputStream.<init>",
            "java/io/RandomAccessFile.<init>",
            "java/io/FileReader.<init>",
            "java/io/FileWriter.<init>",
            "java/io/File.delete",
            "java/io/File.renameTo",
            "java/nio/file/Files.newInputStream",
            "java/nio/file/Files.newOutputStream",
            "java/nio/file/Files.newBufferedReader",
            "java/nio/file/Files.newBufferedWriter",
            "java/nio/file/Files.newByteChannel",
            "java/nio/file/Files.readAllBytes",
            "java/nio/file/Files.readAllLines",
            "java/nio/file/Files.readString",
            "java/nio/file/Files.write",
            "java/nio/file/Files.writeString",
            "java/nio/file/Files.delete",
            "java/nio/file/Files.move",
            "java/net/Socket.<init>",
            "java/net/Socket.connect",
            "java/nio/channels/SocketChannel.open",
            "java/nio/channels/SocketChannel.connect");

    private UngovernedApiScanner() {
    }

    /**
     * 扫描 jar 文件或 classes 目录
     */
    public static ScanResult scan(Path source) throws IOException {
        if (Files.isDirectory(source)) {
            return scanDirectory(source);
        } else if (source.getFileName() != null && source.getFileName().toString().endsWith(".jar")) {
            return scanJar(source);
        }
        return new ScanResult(Collections.emptyList(), Collections.emptyList());
    }

    private static ScanResult scanJar(Path jarFile) throws IOException {
        List<Violation> errors = new ArrayList<>();
        List<Violation> warnings = new ArrayList<>();

        try (JarFile jar = new JarFile(jarFile.toFile())) {
            Enumeration<JarEntry> entries = jar.entries();
            while (entries.hasMoreElements()) {
                JarEntry entry = entries.nextElement();
                if (entry.getName().endsWith(".class")) {
                    try (InputStream is = jar.getInputStream(entry)) {
                        scanClass(is, errors, warnings);
                    }
                }
            }
        }

        return new ScanResult(errors, warnings);
    }

    private static ScanResult scanDirectory(Path dir) throws IOException {
        List<Violation> errors = new ArrayList<>();
        List<Violation> warnings = new ArrayList<>();
        List<Path> classFiles;
        try (Stream<Path> walk = Files.walk(dir)) {
            classFiles = walk.filter(p -> p.toString().endsWith(".class")).collect(Collectors.toList());
        }
        for (Path classFile : classFiles) {
            try (InputStream is = Files.newInputStream(classFile)) {
                scanClass(is, errors, warnings);
            }
        }
        return new ScanResult(errors, warnings);
    }

    static void scanClass(InputStream is, List<Violation> errors, List<Violation> warnings) throws IOException {
        ClassReader reader = new ClassReader(is);
        reader.accept(new ClassVisitor(Opcodes.ASM9) {

            private String currentClass;

            @Override
            public void visit(int version, int access, String name, String signature,
                              String superName, String[] interfaces) {
                this.currentClass = name;
            }

            @Override
            public MethodVisitor visitMethod(int access, String name, String descriptor,
                                             String signature, String[] exceptions) {
                return new MethodVisitor(Opcodes.ASM9) {
                    @Override
                    public void visitMethodInsn(int opcode, String owner, String methodName,
                                                String desc, boolean isInterface) {
                        String fullMethod = owner + "." + methodName + desc;
                        String methodPrefix = owner + "." + methodName;

                        if (FORBIDDEN_METHODS.contains(fullMethod)) {
                            errors.add(new Violation(currentClass, fullMethod, ViolationType.CRITICAL,
                                    "Forbidden API: This call would terminate the JVM"));
                        } else if (matchesAny(FORBIDDEN_PREFIXES, methodPrefix)) {
                            errors.add(new Violation(currentClass, fullMethod, ViolationType.CRITICAL,
                                    "Forbidden API: Process execution must go through Governed.start"));
                        } else if (matchesAny(WARN_PREFIXES, methodPrefix)) {
                            warnings.add(new Violation(currentClass, fullMethod, ViolationType.WARNING,
                                    "Ungoverned I/O: bypasses the interception engine"));
                        }
                    }
                };
            }
        }, ClassReader.SKIP_DEBUG | ClassReader.SKIP_FRAMES);
    }

    private static boolean matchesAny(Set<String> prefixes, String methodPrefix) {
        for (String prefix : prefixes) {
            if (methodPrefix.equals(prefix) || methodPrefix.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    // ==================== 结果类 ====================

    public enum ViolationType {
        CRITICAL, WARNING
    }

    public record Violation(
            String className,
            String apiCall,
            ViolationType type,
            String message) {
        @NonNull
        @Override
        public String toString() {
            return String.format("[%s] %s in %s: %s", type, apiCall, className, message);
        }
    }

    public record ScanResult(List<Violation> errors, List<Violation> warnings) {

        public ScanResult merge(ScanResult other) {
            List<Violation> e = new ArrayList<>(errors);
            e.addAll(other.errors);
            List<Violation> w = new ArrayList<>(warnings);
            w.addAll(other.warnings);
            return new ScanResult(e, w);
        }

        public boolean hasCriticalViolations() {
            return !errors.isEmpty();
        }

        public boolean hasWarnings() {
            return !warnings.isEmpty();
        }

        public void throwIfCritical() {
            if (hasCriticalViolations()) {
                String msg = errors.stream()
                        .map(Violation::toString)
                        .collect(Collectors.joining("\n"));
                throw new PrismException("Plugin security check failed:\n" + msg);
            }
        }

        public void logWarnings(String pluginName) {
            if (hasWarnings()) {
                log.warn("[{}] Plugin security warnings:", pluginName);
                warnings.forEach(w -> log.warn("  {}", w));
            }
        }
    }
}
