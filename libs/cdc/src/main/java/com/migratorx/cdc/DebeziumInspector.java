package com.migratorx.cdc;

import com.migratorx.workflow.ExecutionContext;

/**
 * Read-only access to Debezium connector status.
 */
@FunctionalInterface
public interface DebeziumInspector {

    ConnectorStatus connectorStatus(ExecutionContext context, String connector) throws Exception;
}
