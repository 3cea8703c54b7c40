package com.migratorx.workflow;

import java.util.List;

/**
 * Findings produced by a single {@link Step} execution.
 *
 * @param findings ordered findings; never null
 */
public record StepResult(List<Finding> findings) {

    /** A result without findings. */
    public static final StepResult EMPTY = new StepResult(List.of());

    public StepResult {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public static StepResult of(Finding... findings) {
        return new StepResult(List.of(findings));
    }
}
