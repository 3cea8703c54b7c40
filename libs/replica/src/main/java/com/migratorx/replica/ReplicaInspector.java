package com.migratorx.replica;

import com.migratorx.workflow.ExecutionContext;

/**
 * Read-only queries used to decide whether and how to upgrade a replica.
 */
public interface ReplicaInspector {

    boolean isPrimary(ExecutionContext context, String host) throws Exception;

    ReplicationStatus replicationStatus(ExecutionContext context, String replica) throws Exception;
}
