package com.migratorx.cli.workflow;

import java.nio.file.Path;

/**
 * Snapshot files the checks read from. Any of them may be null; a check whose file is missing
 * reports a BLOCK when it runs.
 *
 * @param schemaPrimary  primary schema JSON ({@code --schema-primary})
 * @param schemaReplica  replica schema JSON ({@code --schema-replica})
 * @param cdcStatus      Debezium connector status JSON ({@code --cdc-status})
 * @param mysqlSettings  primary server settings JSON ({@code --mysql-settings}); enables the compatibility check
 * @param schemaHistory  schema history topic JSON ({@code --schema-history}); enables the history check
 */
public record CheckSources(Path schemaPrimary, Path schemaReplica, Path cdcStatus, Path mysqlSettings,
                           Path schemaHistory) {

    public static final CheckSources NONE = new CheckSources(null, null, null, null, null);
}
