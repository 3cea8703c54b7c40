package com.migratorx.observability;

/**
 * Identifies one CLI invocation so that every log line it produces can be correlated.
 * <p>
 * The values are pushed into SLF4J MDC by {@link MigrationRunContextHolder}.
 *
 * @param runId     unique ID of the invocation; also the {@code ExecutionContext} run id
 * @param migration migration name from the plan (nullable before the plan is loaded)
 * @param command   command being executed, e.g. {@code upgrade replica}
 * @param target    host or connector the command acts on (nullable)
 */
public record MigrationRunContext(
        String runId,
        String migration,
        String command,
        String target
) {

    /** MDC key for the run ID. */
    public static final String MDC_RUN_ID = "runId";

    /** MDC key for the migration name. */
    public static final String MDC_MIGRATION = "migration";

    /** MDC key for the command. */
    public static final String MDC_COMMAND = "command";

    /** MDC key for the target. */
    public static final String MDC_TARGET = "target";

    public MigrationRunContext {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId must not be null or blank");
        }
    }

    /**
     * Returns a copy with the migration name filled in once the plan is known.
     */
    public MigrationRunContext withMigration(String name) {
        return new MigrationRunContext(runId, name, command, target);
    }
}
