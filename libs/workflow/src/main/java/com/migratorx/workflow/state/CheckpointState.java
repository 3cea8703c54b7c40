package com.migratorx.workflow.state;

import java.util.Optional;

/**
 * Checkpoint store for one workflow invocation: scalar values under composite keys plus a
 * "completed" marker per step name.
 *
 * <p>Implementations must be safe for concurrent use within one process. Durable implementations
 * persist synchronously on every {@link #set} and {@link #markCompleted} so a checkpoint is never
 * lost once the call returns. Separate processes sharing one store are not coordinated; the last
 * writer wins.
 */
public interface CheckpointState {

    /**
     * Returns the value recorded under {@code key}, if any.
     */
    Optional<Object> get(CheckpointKey key);

    /**
     * Records a scalar value ({@link String}, {@link Number} or {@link Boolean}).
     *
     * @throws IllegalArgumentException if the value is null or not a scalar
     */
    void set(CheckpointKey key, Object value);

    void markCompleted(String stepName);

    boolean isCompleted(String stepName);

    /**
     * Returns true only when a {@link Boolean#TRUE} is recorded under {@code key}.
     */
    default boolean isFlagSet(CheckpointKey key) {
        return get(key).filter(Boolean.class::isInstance).map(Boolean.class::cast).orElse(false);
    }

    /** Records {@link Boolean#TRUE} under {@code key}. */
    default void setFlag(CheckpointKey key) {
        set(key, Boolean.TRUE);
    }

    /**
     * Validates that a value can be stored by any backend.
     */
    static Object requireScalar(Object value) {
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        throw new IllegalArgumentException(
                "checkpoint value must be a string, number or boolean, got: "
                        + (value == null ? "null" : value.getClass().getName()));
    }
}
