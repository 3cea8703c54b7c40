package com.migratorx.workflow;

import com.migratorx.workflow.state.CheckpointState;

/**
 * Body of a lambda-backed step.
 */
@FunctionalInterface
public interface StepAction {

    StepResult run(ExecutionContext context, CheckpointState state) throws Exception;
}
