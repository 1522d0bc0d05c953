package com.prism.core.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.InvalidAlgorithmParameterException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.Signature;
import java.security.interfaces.RSAKey;
import java.security.spec.MGF1ParameterSpec;
import java.security.spec.PSSParameterSpec;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * 签名与验签共用的摘要算法
 * <p>
 * 摘要 = SHA-256( canonical(metadata) || 按路径排序的 "path:sha256" )，
 * 签名算法为 RSASSA-PSS / SHA-256 / MGF1-SHA-256，盐长取最大值。
 * </p>
 */
final class SignatureSupport {

    static final String SIGNATURE_FILE = "plugin.sig";
    static final String MANIFEST_FILE = "plugin.manifest";

    static final ObjectMapper MAPPER = JsonMapper.builder()
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .build();

    private SignatureSupport() {
    }

    static byte[] manifestDigest(Map<String, Object> metadata, Map<String, String> files, Path pluginRoot)
            throws IOException {
        MessageDigest digest = sha256();
        digest.update(MAPPER.writeValueAsBytes(metadata == null ? Map.of() : metadata));
        for (Map.Entry<String, String> entry : new TreeMap<>(files).entrySet()) {
            Path file = pluginRoot.resolve(entry.getKey()).normalize();
            if (!file.startsWith(pluginRoot.normalize())) {
                throw new SecurityException("Manifest entry escapes plugin directory: " + entry.getKey());
            }
            if (!Files.isRegularFile(file)) {
                throw new SecurityException("File not found: " + entry.getKey());
            }
            String actual = fileHash(file);
            if (!actual.equalsIgnoreCase(entry.getValue())) {
                throw new SecurityException("File hash mismatch: " + entry.getKey());
            }
            digest.update((entry.getKey() + ":" + actual).getBytes(StandardCharsets.UTF_8));
        }
        return digest.digest();
    }

    static String fileHash(Path file) throws IOException {
        MessageDigest digest = sha256();
        byte[] buffer = new byte[8192];
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    static Signature pssSignature(RSAKey key) throws NoSuchAlgorithmException, InvalidAlgorithmParameterException {
        int emLen = (key.getModulus().bitLength() - 1 + 7) / 8;
        int saltLength = emLen - 32 - 2;
        Signature signature = Signature.getInstance("RSASSA-PSS");
        signature.setParameter(new PSSParameterSpec("SHA-256", "MGF1", MGF1ParameterSpec.SHA256, saltLength, 1));
        return signature;
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
