package com.migratorx.workflow;

/**
 * Terminal condition of a {@link WorkflowRunner} run.
 */
public enum WorkflowOutcome {

    /** Every step ran (or was already completed) without a BLOCK. */
    COMPLETED,

    /** A BLOCK finding halted the run. */
    BLOCKED,

    /** The execution context was cancelled (or its deadline passed) at a step boundary. */
    CANCELLED
}
