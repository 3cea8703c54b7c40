package com.migratorx.workflow.state;

import java.util.ArrayList;
import java.util.List;

/**
 * Composite checkpoint key: {@code (scope, entity, field)}, e.g.
 * {@code ("replica_upgrade", "mysql-replica-1", "stopped")}.
 *
 * <p>The parts are kept separate so entity names containing the storage delimiter cannot collide
 * with other keys. {@link #encode()} escapes {@code \} and {@code :} in every part and
 * {@link #decode(String)} reverses it exactly.
 *
 * @param scope  component namespace (e.g. "replica_upgrade", "workflow")
 * @param entity the thing the checkpoint is about (replica host, step name)
 * @param field  the recorded fact (e.g. "stopped", "completed")
 */
public record CheckpointKey(String scope, String entity, String field) {

    private static final char DELIMITER = ':';
    private static final char ESCAPE = '\\';

    /** Scope reserved for workflow step completion markers. */
    public static final String WORKFLOW_SCOPE = "workflow";

    /** Field used for workflow step completion markers. */
    public static final String COMPLETED_FIELD = "completed";

    public CheckpointKey {
        requireNonBlank(scope, "scope");
        requireNonBlank(entity, "entity");
        requireNonBlank(field, "field");
    }

    public static CheckpointKey of(String scope, String entity, String field) {
        return new CheckpointKey(scope, entity, field);
    }

    /** The distinguished key marking a workflow step as completed. */
    public static CheckpointKey stepCompleted(String stepName) {
        return new CheckpointKey(WORKFLOW_SCOPE, stepName, COMPLETED_FIELD);
    }

    /** Renders the key as a single escaped string for storage. */
    public String encode() {
        return escape(scope) + DELIMITER + escape(entity) + DELIMITER + escape(field);
    }

    /**
     * Parses a string produced by {@link #encode()}.
     *
     * @throws IllegalArgumentException if the string does not hold exactly three parts
     */
    public static CheckpointKey decode(String encoded) {
        if (encoded == null) {
            throw new IllegalArgumentException("encoded key must not be null");
        }
        List<String> parts = new ArrayList<>(3);
        StringBuilder current = new StringBuilder();
        boolean escaping = false;
        for (int i = 0; i < encoded.length(); i++) {
            char c = encoded.charAt(i);
            if (escaping) {
                current.append(c);
                escaping = false;
            } else if (c == ESCAPE) {
                escaping = true;
            } else if (c == DELIMITER) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (escaping) {
            throw new IllegalArgumentException("dangling escape in checkpoint key: " + encoded);
        }
        parts.add(current.toString());
        if (parts.size() != 3) {
            throw new IllegalArgumentException("checkpoint key must have 3 parts: " + encoded);
        }
        return new CheckpointKey(parts.get(0), parts.get(1), parts.get(2));
    }

    @Override
    public String toString() {
        return encode();
    }

    private static String escape(String part) {
        StringBuilder sb = new StringBuilder(part.length());
        for (int i = 0; i < part.length(); i++) {
            char c = part.charAt(i);
            if (c == ESCAPE || c == DELIMITER) {
                sb.append(ESCAPE);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private static void requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
    }
}
