package com.migratorx.cli.infrastructure.replica;

import com.migratorx.replica.ReplicaActions;
import com.migratorx.workflow.ExecutionContext;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dry-run actions: every call succeeds without touching a server and is logged and recorded.
 */
public class SimulatedReplicaActions implements ReplicaActions {

    private static final Logger log = LoggerFactory.getLogger(SimulatedReplicaActions.class);

    private final List<String> performed = new CopyOnWriteArrayList<>();

    @Override
    public void stopReplication(ExecutionContext context, String replica) {
        record("stop_replication", replica);
    }

    @Override
    public void runUpgrade(ExecutionContext context, String replica) {
        record("run_upgrade", replica);
    }

    @Override
    public void startReplication(ExecutionContext context, String replica) {
        record("start_replication", replica);
    }

    /** Actions performed so far as {@code action:replica}, in call order. */
    public List<String> performed() {
        return List.copyOf(performed);
    }

    private void record(String action, String replica) {
        log.info("[simulate] {} on {}", action, replica);
        performed.add(action + ":" + replica);
    }
}
