package com.migratorx.replica;

import com.migratorx.workflow.state.CheckpointKey;

/**
 * The three phases of a replica upgrade, in execution order, each guarded by its own checkpoint.
 */
public enum UpgradePhase {
    STOP_REPLICATION("stopped", "replication stopped", "replication already stopped",
            "failed to stop replication"),
    RUN_UPGRADE("upgraded", "upgrade completed", "upgrade already completed", "upgrade failed"),
    START_REPLICATION("resumed", "replication started", "replication already started",
            "failed to start replication");

    static final String SCOPE = "replica_upgrade";

    private final String checkpointField;
    private final String doneMessage;
    private final String skippedMessage;
    private final String failureMessage;

    UpgradePhase(String checkpointField, String doneMessage, String skippedMessage, String failureMessage) {
        this.checkpointField = checkpointField;
        this.doneMessage = doneMessage;
        this.skippedMessage = skippedMessage;
        this.failureMessage = failureMessage;
    }

    /** Checkpoint recording that this phase finished for {@code replica}. */
    public CheckpointKey checkpoint(String replica) {
        return CheckpointKey.of(SCOPE, replica, checkpointField);
    }

    String doneMessage() {
        return doneMessage;
    }

    String skippedMessage() {
        return skippedMessage;
    }

    String failureMessage() {
        return failureMessage;
    }
}
