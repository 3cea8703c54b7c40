package com.migratorx.workflow.state;

import com.migratorx.workflow.MigrationConfigurationException;

/**
 * Thrown when a durable checkpoint store cannot be loaded or persisted.
 */
public class StateStoreException extends MigrationConfigurationException {

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
