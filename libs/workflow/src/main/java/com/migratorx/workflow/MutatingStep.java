package com.migratorx.workflow;

import com.migratorx.workflow.state.CheckpointState;

/**
 * Idempotent step that changes target systems. A {@link WorkflowRunner} only executes it when
 * configured to allow mutations.
 */
public final class MutatingStep implements Step {

    private final String name;
    private final StepAction action;

    public MutatingStep(String name, StepAction action) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
        this.name = name;
        this.action = action;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public StepResult run(ExecutionContext context, CheckpointState state) throws Exception {
        return action.run(context, state);
    }

    @Override
    public boolean idempotent() {
        return true;
    }

    @Override
    public boolean mutates() {
        return true;
    }
}
