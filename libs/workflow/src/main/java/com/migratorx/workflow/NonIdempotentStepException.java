package com.migratorx.workflow;

/**
 * Thrown by {@link WorkflowRunner} when a step does not declare itself idempotent.
 */
public class NonIdempotentStepException extends MigrationConfigurationException {

    private final String stepName;

    public NonIdempotentStepException(String stepName) {
        super(String.format("step \"%s\" is not idempotent; all steps must be idempotent", stepName));
        this.stepName = stepName;
    }

    public String stepName() {
        return stepName;
    }
}
