package com.migratorx.workflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of a {@link WorkflowRunner} run.
 *
 * @param outcome            terminal condition
 * @param summary            counts of every finding recorded during this run
 * @param results            step name to findings, in execution order; skipped steps are absent
 * @param skippedSteps       steps skipped because they were already completed
 * @param haltedAt           step that blocked or before which the run was cancelled, if any
 * @param cancellationReason why the run was cancelled, if it was
 */
public record WorkflowRunResult(
        WorkflowOutcome outcome,
        Summary summary,
        Map<String, List<Finding>> results,
        List<String> skippedSteps,
        String haltedAt,
        String cancellationReason) {

    public WorkflowRunResult {
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        skippedSteps = List.copyOf(skippedSteps);
    }

    public boolean completed() {
        return outcome == WorkflowOutcome.COMPLETED;
    }

    public Optional<String> haltedStep() {
        return Optional.ofNullable(haltedAt);
    }

    /** Every finding of the run in step order. */
    public List<Finding> findings() {
        List<Finding> all = new ArrayList<>();
        results.values().forEach(all::addAll);
        return all;
    }
}
