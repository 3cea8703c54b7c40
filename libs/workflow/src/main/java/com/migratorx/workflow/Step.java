package com.migratorx.workflow;

import com.migratorx.workflow.state.CheckpointState;

/**
 * A single idempotent unit of work in a migration workflow.
 *
 * <p>Rules enforced by {@link WorkflowRunner}:
 *
 * <ul>
 *   <li>every step must report {@link #idempotent()} {@code true} or the runner refuses to start;
 *   <li>a step reporting {@link #mutates()} {@code true} only runs when the runner allows
 *       mutations;
 *   <li>any BLOCK finding stops the workflow and the step is not marked completed.
 * </ul>
 */
public interface Step {

    String name();

    /**
     * Executes the step.
     *
     * @param context cancellation/deadline signal
     * @param state   checkpoint state shared by the whole workflow
     * @return the findings produced
     * @throws Exception on failure; the runner converts it into a BLOCK finding
     */
    StepResult run(ExecutionContext context, CheckpointState state) throws Exception;

    boolean idempotent();

    boolean mutates();
}
