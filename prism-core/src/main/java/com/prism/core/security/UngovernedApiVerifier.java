package com.prism.core.security;

import com.prism.api.exception.PrismException;
import com.prism.core.spi.PluginSecurityVerifier;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 字节码安全验证器：扫描 plugin.jar 与 classes 目录
 */
@Slf4j
public class UngovernedApiVerifier implements PluginSecurityVerifier {

    private final boolean strictMode;

    public UngovernedApiVerifier() {
        this(false);
    }

    /**
     * @param strictMode 为 true 时，警告级别的调用同样拒绝加载
     */
    public UngovernedApiVerifier(boolean strictMode) {
        this.strictMode = strictMode;
    }

    @Override
    public void verify(String pluginName, Path pluginRoot) {
        Path jar = pluginRoot.resolve("plugin.jar");
        Path classes = pluginRoot.resolve("classes");
        if (!Files.isRegularFile(jar) && !Files.isDirectory(classes)) {
            log.debug("[{}] No bytecode to scan", pluginName);
            return;
        }
        log.info("[{}] Scanning for ungoverned API calls...", pluginName);

        try {
            UngovernedApiScanner.ScanResult result = new UngovernedApiScanner.ScanResult(
                    List.of(), List.of());
            if (Files.isRegularFile(jar)) {
                result = result.merge(UngovernedApiScanner.scan(jar));
            }
            if (Files.isDirectory(classes)) {
                result = result.merge(UngovernedApiScanner.scan(classes));
            }

            result.logWarnings(pluginName);

            if (strictMode && result.hasWarnings()) {
                throw new SecurityException("Plugin [" + pluginName + "] performs I/O outside the governed SDK");
            }

            try {
                result.throwIfCritical();
            } catch (PrismException e) {
                throw new SecurityException(e.getMessage(), e);
            }

            log.info("[{}] Security scan passed", pluginName);

        } catch (SecurityException e) {
            throw e;
        } catch (Exception e) {
            log.error("[{}] Security scan failed", pluginName, e);
            throw new SecurityException("Failed to scan plugin: " + e.getMessage(), e);
        }
    }
}
