package com.migratorx.checks.mysql;

import com.migratorx.workflow.ExecutionContext;
import java.util.List;

/**
 * Read-only access to MySQL server settings.
 */
public interface MySqlInspector {

    /** Comma-separated {@code sql_mode} value of the host. */
    String sqlMode(ExecutionContext context, String host) throws Exception;

    /** Names of deprecated features the host is observed to use. */
    List<String> deprecatedFeaturesUsed(ExecutionContext context, String host) throws Exception;
}
