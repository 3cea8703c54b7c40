package com.migratorx.workflow;

import java.util.List;

/**
 * Thrown by a step that fails after it has already produced findings.
 *
 * <p>The runner keeps {@link #partialFindings()} and appends a BLOCK describing the failure, so
 * nothing the step reported before failing is lost.
 */
public class StepExecutionException extends Exception {

    private final List<Finding> partialFindings;

    public StepExecutionException(String message, List<Finding> partialFindings) {
        super(message);
        this.partialFindings = partialFindings == null ? List.of() : List.copyOf(partialFindings);
    }

    public StepExecutionException(String message, List<Finding> partialFindings, Throwable cause) {
        super(message, cause);
        this.partialFindings = partialFindings == null ? List.of() : List.copyOf(partialFindings);
    }

    public List<Finding> partialFindings() {
        return partialFindings;
    }
}
