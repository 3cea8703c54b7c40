package com.migratorx.checks;

import com.migratorx.workflow.plan.MigrationPlan;

/**
 * Plan-derived parameters shared by every check of one run.
 *
 * @param sourceVersion version being upgraded from
 * @param targetVersion version being upgraded to
 * @param primaryHost   primary host name
 * @param replicaHost   replica being validated (may be null for primary-only checks)
 * @param cdcConnector  CDC connector name
 */
public record CheckInput(
        String sourceVersion,
        String targetVersion,
        String primaryHost,
        String replicaHost,
        String cdcConnector) {

    /** Input with every field unset. */
    public static final CheckInput EMPTY = new CheckInput(null, null, null, null, null);

    /**
     * Derives the input from a validated plan.
     *
     * @param replicaHost replica to target; the plan's first replica when null or blank
     */
    public static CheckInput fromPlan(MigrationPlan plan, String replicaHost) {
        String replica = replicaHost == null || replicaHost.isBlank()
                ? plan.firstReplica().orElse(null)
                : replicaHost;
        return new CheckInput(plan.sourceVersion(), plan.targetVersion(),
                plan.topology().primary(), replica, plan.cdc().connector());
    }
}
