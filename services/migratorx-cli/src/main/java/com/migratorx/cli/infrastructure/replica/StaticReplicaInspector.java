package com.migratorx.cli.infrastructure.replica;

import com.migratorx.replica.ReplicaInspector;
import com.migratorx.replica.ReplicationStatus;
import com.migratorx.workflow.ExecutionContext;

/**
 * Inspector answering from command-line input: the plan's primary is the only primary and the
 * replication status is whatever the operator reported with {@code --io-running}/{@code --sql-running}.
 */
public class StaticReplicaInspector implements ReplicaInspector {

    private final String primaryHost;
    private final ReplicationStatus status;

    public StaticReplicaInspector(String primaryHost, ReplicationStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        this.primaryHost = primaryHost;
        this.status = status;
    }

    @Override
    public boolean isPrimary(ExecutionContext context, String host) {
        return host != null && host.equals(primaryHost);
    }

    @Override
    public ReplicationStatus replicationStatus(ExecutionContext context, String replica) {
        return status;
    }
}
