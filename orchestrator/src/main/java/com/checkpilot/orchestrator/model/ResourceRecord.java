package com.checkpilot.orchestrator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One flat key/value record printed by a resource job.
 *
 * A resource job usually prints several records (one per disk, one per
 * package...); they are grouped in the session's resource map under the
 * resource job's id.
 */
public final class ResourceRecord {

    private final Map<String, String> data;

    public ResourceRecord(Map<String, String> data) {
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static ResourceRecord of(String... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("key/value pairs expected");
        }
        Map<String, String> data = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            data.put(keyValues[i], keyValues[i + 1]);
        }
        return new ResourceRecord(data);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(data.get(key));
    }

    public boolean has(String key) {
        return data.containsKey(key);
    }

    public Map<String, String> asMap() {
        return data;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ResourceRecord other && data.equals(other.data);
    }

    @Override
    public int hashCode() {
        return data.hashCode();
    }

    @Override
    public String toString() {
        return "ResourceRecord" + data;
    }
}
