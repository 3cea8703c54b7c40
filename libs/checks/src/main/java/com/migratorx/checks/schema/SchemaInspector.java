package com.migratorx.checks.schema;

import com.migratorx.workflow.ExecutionContext;

/**
 * Read-only access to a host's schema.
 */
@FunctionalInterface
public interface SchemaInspector {

    SchemaSnapshot schema(ExecutionContext context, String host) throws Exception;
}
