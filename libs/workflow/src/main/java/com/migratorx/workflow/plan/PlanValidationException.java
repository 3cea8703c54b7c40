package com.migratorx.workflow.plan;

import com.migratorx.workflow.MigrationConfigurationException;
import java.util.List;

/**
 * Thrown when a migration plan cannot be loaded or does not validate.
 */
public class PlanValidationException extends MigrationConfigurationException {

    private final List<String> errors;

    public PlanValidationException(PlanValidationResult result) {
        super(result.message());
        this.errors = result.errors();
    }

    public PlanValidationException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of(message);
    }

    public List<String> errors() {
        return errors;
    }
}
