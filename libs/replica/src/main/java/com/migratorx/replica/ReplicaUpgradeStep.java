package com.migratorx.replica;

import com.migratorx.workflow.ExecutionContext;
import com.migratorx.workflow.Step;
import com.migratorx.workflow.StepResult;
import com.migratorx.workflow.state.CheckpointState;

/**
 * Workflow step that upgrades one replica through a {@link ReplicaUpgradeOrchestrator} sharing the
 * workflow's checkpoint state.
 */
public class ReplicaUpgradeStep implements Step {

    private final String name;
    private final ReplicaInspector inspector;
    private final ReplicaActions actions;
    private final String primaryHost;
    private final String replica;

    public ReplicaUpgradeStep(String name, ReplicaInspector inspector, ReplicaActions actions,
                              String primaryHost, String replica) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (inspector == null) {
            throw new IllegalArgumentException("replica inspector must not be null");
        }
        if (actions == null) {
            throw new IllegalArgumentException("replica actions must not be null");
        }
        this.name = name;
        this.inspector = inspector;
        this.actions = actions;
        this.primaryHost = primaryHost;
        this.replica = replica;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public StepResult run(ExecutionContext context, CheckpointState state) {
        ReplicaUpgradeResult result = new ReplicaUpgradeOrchestrator(inspector, actions, state, primaryHost)
                .run(context, replica);
        return new StepResult(result.findings());
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
