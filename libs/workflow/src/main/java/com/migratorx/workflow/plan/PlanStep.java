package com.migratorx.workflow.plan;

import java.util.Arrays;
import java.util.Optional;

/**
 * Supported plan steps in canonical order. A plan may omit steps but never reorder or repeat
 * them.
 */
public enum PlanStep {
    PREFLIGHT("preflight"),
    UPGRADE_REPLICA("upgrade_replica"),
    VALIDATE_REPLICA("validate_replica"),
    CDC_CHECK("cdc_check"),
    PROMOTE("promote"),
    POST_VALIDATION("post_validation");

    private final String stepName;

    PlanStep(String stepName) {
        this.stepName = stepName;
    }

    /** Name used in plan files and as the workflow step name. */
    public String stepName() {
        return stepName;
    }

    /** Position in the canonical order, starting at 0. */
    public int position() {
        return ordinal();
    }

    public static Optional<PlanStep> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        return Arrays.stream(values()).filter(s -> s.stepName.equals(trimmed)).findFirst();
    }
}
