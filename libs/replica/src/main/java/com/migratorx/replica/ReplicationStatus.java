package com.migratorx.replica;

/**
 * Replication thread state of a replica.
 *
 * @param ioThreadRunning  whether the I/O (receiver) thread runs
 * @param sqlThreadRunning whether the SQL (applier) thread runs
 */
public record ReplicationStatus(boolean ioThreadRunning, boolean sqlThreadRunning) {

    public static final ReplicationStatus RUNNING = new ReplicationStatus(true, true);
    public static final ReplicationStatus STOPPED = new ReplicationStatus(false, false);

    public boolean fullyRunning() {
        return ioThreadRunning && sqlThreadRunning;
    }

    public boolean fullyStopped() {
        return !ioThreadRunning && !sqlThreadRunning;
    }
}
