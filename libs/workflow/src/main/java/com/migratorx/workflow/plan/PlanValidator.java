package com.migratorx.workflow.plan;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Validates a {@link MigrationPlan}: required fields, supported steps, no duplicates and
 * canonical step order. All problems are reported at once.
 */
public final class PlanValidator {

    private PlanValidator() {
        // utility class
    }

    public static PlanValidationResult validate(MigrationPlan plan) {
        if (plan == null) {
            return PlanValidationResult.fail(List.of("plan must not be null"));
        }
        List<String> errors = new ArrayList<>();

        if (isBlank(plan.migration())) {
            errors.add("migration is required");
        }
        if (isBlank(plan.sourceVersion())) {
            errors.add("source_version is required");
        }
        if (isBlank(plan.targetVersion())) {
            errors.add("target_version is required");
        }

        if (isBlank(plan.topology().primary())) {
            errors.add("topology.primary is required");
        }
        List<String> replicas = plan.topology().replicas();
        if (replicas.isEmpty()) {
            errors.add("topology.replicas must include at least one replica");
        } else {
            for (int i = 0; i < replicas.size(); i++) {
                if (isBlank(replicas.get(i))) {
                    errors.add("topology.replicas[" + i + "] is empty");
                }
            }
        }

        if (isBlank(plan.cdc().type())) {
            errors.add("cdc.type is required");
        }
        if (isBlank(plan.cdc().connector())) {
            errors.add("cdc.connector is required");
        }

        validateSteps(plan.steps(), errors);

        return errors.isEmpty() ? PlanValidationResult.ok() : PlanValidationResult.fail(errors);
    }

    /**
     * Validates and throws on failure.
     *
     * @throws PlanValidationException listing every problem
     */
    public static MigrationPlan validateOrThrow(MigrationPlan plan) {
        PlanValidationResult result = validate(plan);
        if (!result.valid()) {
            throw new PlanValidationException(result);
        }
        return plan;
    }

    private static void validateSteps(List<String> steps, List<String> errors) {
        if (steps.isEmpty()) {
            errors.add("steps must include at least one step");
            return;
        }
        Set<PlanStep> seen = new HashSet<>();
        int lastPosition = -1;
        for (int i = 0; i < steps.size(); i++) {
            String raw = steps.get(i);
            if (isBlank(raw)) {
                errors.add("steps[" + i + "] is empty");
                continue;
            }
            String name = raw.trim();
            Optional<PlanStep> step = PlanStep.fromName(name);
            if (step.isEmpty()) {
                errors.add("steps[" + i + "]=\"" + name + "\" is not supported");
                continue;
            }
            if (!seen.add(step.get())) {
                errors.add("steps[" + i + "]=\"" + name + "\" is duplicated");
                continue;
            }
            if (step.get().position() < lastPosition) {
                errors.add("step order invalid at steps[" + i + "]=\"" + name + "\"");
                continue;
            }
            lastPosition = step.get().position();
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
