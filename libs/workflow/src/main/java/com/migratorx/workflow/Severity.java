package com.migratorx.workflow;

/**
 * Severity of a {@link Finding}.
 *
 * <p>Declaration order is the total order: {@code INFO < WARN < BLOCK}. Only {@link #BLOCK}
 * halts progression; {@link #WARN} and {@link #INFO} are recorded and the flow continues.
 */
public enum Severity {

    /** Observation only, nothing to act on. */
    INFO,

    /** Risk that an operator should review; does not stop the workflow. */
    WARN,

    /** Forbids any further progression until resolved. */
    BLOCK;

    /** Returns true only for {@link #BLOCK}. */
    public boolean isHalting() {
        return this == BLOCK;
    }

    /**
     * Returns true if this severity is the same as or more severe than {@code other}.
     *
     * @param other the severity to compare against
     */
    public boolean atLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
