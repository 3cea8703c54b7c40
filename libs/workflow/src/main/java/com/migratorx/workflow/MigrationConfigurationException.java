package com.migratorx.workflow;

/**
 * Thrown when an orchestration component is misconfigured or misused.
 *
 * <p>Configuration errors abort the whole invocation and never produce a partial summary.
 * Operational risk (inspector failures, drift, incompatibilities) is reported as {@link Finding}s
 * instead and never raised through this hierarchy.
 */
public class MigrationConfigurationException extends RuntimeException {

    public MigrationConfigurationException(String message) {
        super(message);
    }

    public MigrationConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
