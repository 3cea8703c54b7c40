package com.migratorx.workflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single reported observation: severity, human-readable message and free-form metadata.
 *
 * <p>Findings are immutable. The message is mandatory and never blank; metadata keeps insertion
 * order and may contain {@code null} values.
 *
 * @param severity how serious the observation is
 * @param message  explanation shown to the operator
 * @param metadata structured context (host, table, connector, ...)
 */
public record Finding(Severity severity, String message, Map<String, Object> metadata) {

    public Finding {
        if (severity == null) {
            throw new IllegalArgumentException("severity must not be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message must not be null or blank");
        }
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Finding info(String message) {
        return new Finding(Severity.INFO, message, Map.of());
    }

    public static Finding info(String message, Map<String, Object> metadata) {
        return new Finding(Severity.INFO, message, metadata);
    }

    public static Finding warn(String message) {
        return new Finding(Severity.WARN, message, Map.of());
    }

    public static Finding warn(String message, Map<String, Object> metadata) {
        return new Finding(Severity.WARN, message, metadata);
    }

    public static Finding block(String message) {
        return new Finding(Severity.BLOCK, message, Map.of());
    }

    public static Finding block(String message, Map<String, Object> metadata) {
        return new Finding(Severity.BLOCK, message, metadata);
    }

    /**
     * Returns a copy of this finding with one extra metadata entry (replacing an existing key).
     */
    public Finding withMetadata(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return new Finding(severity, message, copy);
    }

    /** Returns true if this finding halts progression. */
    public boolean isBlock() {
        return severity == Severity.BLOCK;
    }
}
