package com.prism.core.security;

import com.fasterxml.jackson.core.type.TypeReference;
import com.prism.core.spi.PluginSecurityVerifier;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 插件签名验证器
 * <p>
 * 插件目录需包含：
 * <ul>
 *     <li>plugin.manifest：{"metadata": {...}, "files": {"相对路径": "sha256"}}</li>
 *     <li>plugin.sig：{"signer_id": "...", "signature": "base64"}</li>
 * </ul>
 * 受信公钥为 trusted keys 目录下的 *.pem，文件名（不含扩展名）即签名者 ID。
 */
@Slf4j
public class SignatureVerifier implements PluginSecurityVerifier {

    private final Map<String, RSAPublicKey> trustedKeys;

    public SignatureVerifier(Path trustedKeysDirectory) {
        this.trustedKeys = loadTrustedKeys(trustedKeysDirectory);
    }

    public SignatureVerifier(Map<String, RSAPublicKey> trustedKeys) {
        this.trustedKeys = Map.copyOf(trustedKeys);
    }

    public Set<String> getTrustedSigners() {
        return Collections.unmodifiableSet(trustedKeys.keySet());
    }

    @Override
    public void verify(String pluginName, Path pluginRoot) throws SecurityException {
        Path signatureFile = pluginRoot.resolve(SignatureSupport.SIGNATURE_FILE);
        Path manifestFile = pluginRoot.resolve(SignatureSupport.MANIFEST_FILE);
        if (!Files.isRegularFile(signatureFile)) {
            throw new SecurityException("Signature file not found for plugin " + pluginName);
        }
        if (!Files.isRegularFile(manifestFile)) {
            throw new SecurityException("Manifest file not found for plugin " + pluginName);
        }

        try {
            SignedManifest manifest = SignatureSupport.MAPPER.readValue(manifestFile.toFile(), SignedManifest.class);
            Map<String, String> sig = SignatureSupport.MAPPER.readValue(signatureFile.toFile(),
                    new TypeReference<Map<String, String>>() {
                    });
            String signerId = sig.get("signer_id");
            String signatureB64 = sig.get("signature");
            if (signerId == null || signatureB64 == null) {
                throw new SecurityException("Invalid signature file format");
            }
            RSAPublicKey key = trustedKeys.get(signerId);
            if (key == null) {
                throw new SecurityException("Unknown signer: " + signerId);
            }

            byte[] digest = SignatureSupport.manifestDigest(manifest.metadata, manifest.files, pluginRoot);
            Signature verifier = SignatureSupport.pssSignature(key);
            verifier.initVerify(key);
            verifier.update(digest);
            if (!verifier.verify(Base64.getDecoder().decode(signatureB64))) {
                throw new SecurityException("Invalid signature");
            }
            log.info("[{}] Plugin signature verified (signed by {})", pluginName, signerId);
        } catch (IOException | GeneralSecurityException | IllegalArgumentException e) {
            throw new SecurityException("Signature verification failed for " + pluginName + ": " + e.getMessage(), e);
        }
    }

    private static Map<String, RSAPublicKey> loadTrustedKeys(Path directory) {
        Map<String, RSAPublicKey> keys = new LinkedHashMap<>();
        if (!Files.isDirectory(directory)) {
            log.warn("Trusted keys directory not found: {}", directory);
            return keys;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.pem")) {
            for (Path pem : stream) {
                String name = pem.getFileName().toString();
                String signerId = name.substring(0, name.length() - ".pem".length());
                try {
                    keys.put(signerId, readPublicKey(pem));
                    log.info("Loaded trusted key: {}", signerId);
                } catch (IOException | GeneralSecurityException | IllegalArgumentException e) {
                    log.error("Failed to load key {}: {}", pem, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.error("Failed to list trusted keys in {}", directory, e);
        }
        return keys;
    }

    static RSAPublicKey readPublicKey(Path pem) throws IOException, GeneralSecurityException {
        String text = Files.readString(pem, StandardCharsets.US_ASCII);
        String body = text.replaceAll("-----[A-Z ]+-----", "").replaceAll("\\s", "");
        PublicKey key = KeyFactory.getInstance("RSA").generatePublic(
                new X509EncodedKeySpec(Base64.getDecoder().decode(body)));
        return (RSAPublicKey) key;
    }

    public static class SignedManifest {
        public Map<String, Object> metadata = new LinkedHashMap<>();
        public Map<String, String> files = new LinkedHashMap<>();
    }
}
