package com.checkpilot.orchestrator.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Normalized, immutable field mapping shared by every unit type.
 *
 * Keys are sorted and stripped of the leading underscore that marks
 * translatable fields ({@code _summary} becomes {@code summary}); values are
 * trimmed. The checksum is computed once over namespace and fields.
 */
public final class UnitFields {

    private final String namespace;
    private final Map<String, String> values;
    private final String checksum;

    public UnitFields(String namespace, Map<String, String> raw) {
        this.namespace = namespace == null ? "" : namespace;
        TreeMap<String, String> normalized = new TreeMap<>();
        raw.forEach((key, value) -> {
            if (key == null || value == null) return;
            String k = key.startsWith("_") ? key.substring(1) : key;
            normalized.put(k.trim(), value.strip());
        });
        this.values   = Collections.unmodifiableMap(normalized);
        this.checksum = digest(this.namespace, this.values);
    }

    public String namespace()            { return namespace; }
    public Map<String, String> asMap()   { return values; }
    public String checksum()             { return checksum; }

    public Optional<String> get(String key) {
        String value = values.get(key);
        return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    public String getOrDefault(String key, String fallback) {
        return get(key).orElse(fallback);
    }

    private static String digest(String namespace, Map<String, String> values) {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            sha.update(namespace.getBytes(StandardCharsets.UTF_8));
            sha.update((byte) 0);
            for (Map.Entry<String, String> e : values.entrySet()) {
                sha.update(e.getKey().getBytes(StandardCharsets.UTF_8));
                sha.update((byte) 0);
                sha.update(e.getValue().getBytes(StandardCharsets.UTF_8));
                sha.update((byte) 0);
            }
            return HexFormat.of().formatHex(sha.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
