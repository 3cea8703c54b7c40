package com.migratorx.observability;

import com.migratorx.workflow.Finding;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks credentials in finding metadata before it is printed or logged.
 * <p>
 * A metadata key is sensitive when it contains one of the configured fragments, ignoring case.
 * Nested maps are redacted recursively, their keys compared by string form. Defaults cover passwords, tokens, secrets, API keys,
 * credentials and connection strings.
 */
public final class SensitiveDataRedactor {

    /** Replacement for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_FRAGMENTS = Set.of(
            "password", "passwd", "token", "secret", "authorization",
            "apikey", "api_key", "credential", "dsn", "connection_string");

    private final Set<String> fragments;
    private final Pattern pattern;

    public SensitiveDataRedactor() {
        this(DEFAULT_FRAGMENTS);
    }

    /**
     * @param fragments key fragments treated as sensitive; must not be empty
     */
    public SensitiveDataRedactor(Set<String> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            throw new IllegalArgumentException("fragments must not be null or empty");
        }
        this.fragments = Set.copyOf(fragments);
        this.pattern = Pattern.compile(String.join("|", this.fragments.stream().map(Pattern::quote).toList()),
                Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns the finding unchanged when nothing needs masking, otherwise a copy with masked metadata.
     */
    public Finding redact(Finding finding) {
        Map<String, Object> metadata = finding.metadata();
        if (metadata.isEmpty() || !containsSensitive(metadata)) {
            return finding;
        }
        return new Finding(finding.severity(), finding.message(), redact(metadata));
    }

    public List<Finding> redactAll(List<Finding> findings) {
        return findings.stream().map(this::redact).toList();
    }

    /**
     * Returns a new map with sensitive values replaced by {@value #REDACTED}.
     */
    public Map<String, Object> redact(Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        data.forEach((key, value) -> result.put(key, isSensitive(key) ? REDACTED : redactValue(value)));
        return result;
    }

    public boolean isSensitive(String key) {
        return key != null && pattern.matcher(key).find();
    }

    public Set<String> fragments() {
        return fragments;
    }

    private Object redactValue(Object value) {
        if (value instanceof Map<?, ?> nested) {
            return redact(stringKeyed(nested));
        }
        return value;
    }

    private boolean containsSensitive(Map<String, Object> data) {
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (isSensitive(entry.getKey())) {
                return true;
            }
            if (entry.getValue() instanceof Map<?, ?> nested && containsSensitive(stringKeyed(nested))) {
                return true;
            }
        }
        return false;
    }

    private static Map<String, Object> stringKeyed(Map<?, ?> nested) {
        Map<String, Object> copy = new LinkedHashMap<>(nested.size());
        nested.forEach((key, value) -> copy.put(String.valueOf(key), value));
        return copy;
    }
}
