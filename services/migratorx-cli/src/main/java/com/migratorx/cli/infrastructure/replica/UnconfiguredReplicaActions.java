package com.migratorx.cli.infrastructure.replica;

import com.migratorx.replica.ReplicaActions;
import com.migratorx.workflow.ExecutionContext;

/**
 * Actions used when no executor is configured. Every call fails, which the orchestrator reports
 * as a BLOCK without recording a checkpoint.
 */
public class UnconfiguredReplicaActions implements ReplicaActions {

    static final String MESSAGE = "replica actions not configured; use --simulate or provide an implementation";

    @Override
    public void stopReplication(ExecutionContext context, String replica) {
        throw new UnsupportedOperationException(MESSAGE);
    }

    @Override
    public void runUpgrade(ExecutionContext context, String replica) {
        throw new UnsupportedOperationException(MESSAGE);
    }

    @Override
    public void startReplication(ExecutionContext context, String replica) {
        throw new UnsupportedOperationException(MESSAGE);
    }
}
