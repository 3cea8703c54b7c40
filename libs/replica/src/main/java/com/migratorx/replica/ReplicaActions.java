package com.migratorx.replica;

import com.migratorx.workflow.ExecutionContext;

/**
 * Mutating operations performed on a replica during an upgrade. Each call either succeeds or
 * throws; a thrown exception leaves the corresponding checkpoint unset.
 */
public interface ReplicaActions {

    void stopReplication(ExecutionContext context, String replica) throws Exception;

    void runUpgrade(ExecutionContext context, String replica) throws Exception;

    void startReplication(ExecutionContext context, String replica) throws Exception;
}
