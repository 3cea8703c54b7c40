package com.migratorx.workflow.plan;

import java.util.List;

/**
 * Result of validating a {@link MigrationPlan}.
 *
 * @param valid  true if validation passed with no errors
 * @param errors every problem found, in field order (empty when valid)
 */
public record PlanValidationResult(boolean valid, List<String> errors) {

    public static PlanValidationResult ok() {
        return new PlanValidationResult(true, List.of());
    }

    public static PlanValidationResult fail(List<String> errors) {
        return new PlanValidationResult(false, List.copyOf(errors));
    }

    /** All errors joined into one line, prefixed the way operators see them. */
    public String message() {
        return valid ? "migration plan is valid"
                : "migration plan validation failed: " + String.join("; ", errors);
    }
}
