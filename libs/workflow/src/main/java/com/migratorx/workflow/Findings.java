package com.migratorx.workflow;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Small helpers over finding collections.
 */
public final class Findings {

    private Findings() {
        // utility class
    }

    public static boolean hasBlock(Collection<Finding> findings) {
        return findings.stream().anyMatch(Finding::isBlock);
    }

    public static long countOf(Collection<Finding> findings, Severity severity) {
        return findings.stream().filter(f -> f.severity() == severity).count();
    }

    /**
     * Builds an insertion-ordered metadata map from alternating key/value arguments. Unlike
     * {@link Map#of}, {@code null} values are kept.
     *
     * @param keyValues {@code key1, value1, key2, value2, ...}; keys must be strings
     */
    public static Map<String, Object> meta(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("metadata requires key/value pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            if (!(keyValues[i] instanceof String key)) {
                throw new IllegalArgumentException("metadata key must be a string: " + keyValues[i]);
            }
            map.put(key, keyValues[i + 1]);
        }
        return map;
    }
}
