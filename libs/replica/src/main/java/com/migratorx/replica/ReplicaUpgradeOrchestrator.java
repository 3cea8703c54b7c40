package com.migratorx.replica;

import com.migratorx.workflow.ExecutionContext;
import com.migratorx.workflow.Finding;
import com.migratorx.workflow.Findings;
import com.migratorx.workflow.state.CheckpointState;
import com.migratorx.workflow.state.InMemoryCheckpointState;
import com.migratorx.workflow.state.StateStoreException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Upgrades a single replica in three checkpointed phases: stop replication, run the upgrade,
 * start replication.
 *
 * <p>Re-running after a partial or complete run only performs the phases whose checkpoint is
 * missing. The primary is never touched: a target reported as primary, or equal to the configured
 * primary host, yields one BLOCK before any other inspector or action call. Discrepancies between
 * the live replication status and the checkpoints are reported as WARN and do not stop the run.
 * A phase whose checkpoint cannot be saved ends the run with a BLOCK, since a re-run would repeat it.
 */
public class ReplicaUpgradeOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ReplicaUpgradeOrchestrator.class);

    private final ReplicaInspector inspector;
    private final ReplicaActions actions;
    private final CheckpointState state;
    private final String primaryHost;

    /**
     * @param state       checkpoint store; a fresh in-memory store when null
     * @param primaryHost the plan's primary, never upgraded; may be null
     */
    public ReplicaUpgradeOrchestrator(ReplicaInspector inspector, ReplicaActions actions,
                                      CheckpointState state, String primaryHost) {
        if (inspector == null) {
            throw new IllegalArgumentException("replica inspector must not be null");
        }
        if (actions == null) {
            throw new IllegalArgumentException("replica actions must not be null");
        }
        this.inspector = inspector;
        this.actions = actions;
        this.state = state == null ? new InMemoryCheckpointState() : state;
        this.primaryHost = primaryHost;
    }

    public ReplicaUpgradeResult run(ExecutionContext context, String replica) {
        String target = replica == null ? "" : replica.trim();
        if (target.isEmpty()) {
            return ReplicaUpgradeResult.of(List.of(Finding.block("replica is required")));
        }

        boolean reportedPrimary;
        try {
            reportedPrimary = inspector.isPrimary(context, target);
        } catch (Exception e) {
            restoreInterrupt(e);
            return ReplicaUpgradeResult.of(List.of(Finding.block(
                    "failed to determine primary status: " + e.getMessage(), meta(target))));
        }
        if (reportedPrimary || target.equals(primaryHost)) {
            log.error("Refusing to upgrade {}: target is the primary", target);
            return ReplicaUpgradeResult.of(List.of(Finding.block("refusing to upgrade primary", meta(target))));
        }

        List<Finding> findings = new ArrayList<>(detectPartialProgress(context, target));

        for (UpgradePhase phase : UpgradePhase.values()) {
            if (state.isFlagSet(phase.checkpoint(target))) {
                findings.add(Finding.info(phase.skippedMessage(), meta(target)));
                continue;
            }
            if (context.isCancelled()) {
                String cause = context.cancellationCause().orElse("cancelled");
                log.warn("Upgrade of {} cancelled before {}: {}", target, phase, cause);
                findings.add(Finding.block("run cancelled", Findings.meta(
                        "replica", target, "phase", phase.name().toLowerCase(Locale.ROOT), "reason", cause)));
                return ReplicaUpgradeResult.of(findings);
            }
            log.info("Replica {}: running phase {}", target, phase);
            try {
                perform(phase, context, target);
            } catch (Exception e) {
                restoreInterrupt(e);
                log.error("Replica {}: phase {} failed", target, phase, e);
                findings.add(Finding.block(phase.failureMessage() + ": " + e.getMessage(), meta(target)));
                return ReplicaUpgradeResult.of(findings);
            }
            try {
                state.setFlag(phase.checkpoint(target));
            } catch (StateStoreException e) {
                log.error("Replica {}: phase {} completed but its checkpoint was not saved", target, phase, e);
                findings.add(Finding.block("phase completed but checkpoint could not be recorded", Findings.meta(
                        "replica", target, "phase", phase.name().toLowerCase(Locale.ROOT), "reason", e.getMessage())));
                return ReplicaUpgradeResult.of(findings);
            }
            findings.add(Finding.info(phase.doneMessage(), meta(target)));
        }

        return ReplicaUpgradeResult.of(findings);
    }

    private void perform(UpgradePhase phase, ExecutionContext context, String replica) throws Exception {
        switch (phase) {
            case STOP_REPLICATION -> actions.stopReplication(context, replica);
            case RUN_UPGRADE -> actions.runUpgrade(context, replica);
            case START_REPLICATION -> actions.startReplication(context, replica);
            default -> throw new IllegalStateException("unknown phase " + phase);
        }
    }

    private List<Finding> detectPartialProgress(ExecutionContext context, String replica) {
        ReplicationStatus status;
        try {
            status = inspector.replicationStatus(context, replica);
        } catch (Exception e) {
            restoreInterrupt(e);
            return List.of(Finding.warn("unable to read replication status: " + e.getMessage(), meta(replica)));
        }

        boolean stopped = state.isFlagSet(UpgradePhase.STOP_REPLICATION.checkpoint(replica));
        boolean resumed = state.isFlagSet(UpgradePhase.START_REPLICATION.checkpoint(replica));

        List<Finding> findings = new ArrayList<>();
        if (status.fullyStopped() && !stopped) {
            findings.add(Finding.warn("replication appears stopped but checkpoint is missing", meta(replica)));
        }
        if (status.fullyRunning() && stopped && !resumed) {
            findings.add(Finding.warn("checkpoint indicates replication stopped but status is running",
                    meta(replica)));
        }
        if (status.fullyStopped() && resumed) {
            findings.add(Finding.warn("checkpoint indicates replication started but status is stopped",
                    meta(replica)));
        }
        return findings;
    }

    private static Map<String, Object> meta(String replica) {
        return Findings.meta("replica", replica);
    }

    private static void restoreInterrupt(Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
    }
}
