package com.migratorx.workflow;

import com.migratorx.workflow.state.CheckpointState;
import com.migratorx.workflow.state.InMemoryCheckpointState;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes an ordered list of {@link Step}s sequentially against a {@link CheckpointState}.
 *
 * <ul>
 *   <li>Before anything runs, every step must be idempotent; otherwise a
 *       {@link NonIdempotentStepException} is thrown and no step executes.
 *   <li>Cancellation is checked once per step boundary; a cancelled run ends with
 *       {@link WorkflowOutcome#CANCELLED} and the pending step is not marked completed.
 *   <li>Steps already marked completed are skipped without producing findings.
 *   <li>A mutating step is replaced by a single BLOCK finding unless mutations are allowed.
 *   <li>A step failure becomes an extra BLOCK finding appended to whatever the step produced.
 *   <li>Any BLOCK halts the run; the blocking step is not marked completed. WARN and INFO are
 *       recorded and the run continues.
 * </ul>
 *
 * <p>A runner instance is meant for one run at a time; {@link #results()} exposes the findings of
 * the latest run.
 */
public final class WorkflowRunner {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRunner.class);

    static final String MUTATION_BLOCKED_MESSAGE = "mutating step blocked by runner configuration";

    private final List<Step> steps;
    private final CheckpointState state;
    private final boolean allowMutations;
    private final Map<String, List<Finding>> results = new LinkedHashMap<>();

    /**
     * @param steps          ordered steps to execute
     * @param state          checkpoint state; a fresh in-memory state when null
     * @param allowMutations whether steps reporting {@link Step#mutates()} may run
     */
    public WorkflowRunner(List<Step> steps, CheckpointState state, boolean allowMutations) {
        if (steps == null) {
            throw new IllegalArgumentException("steps must not be null");
        }
        this.steps = List.copyOf(steps);
        this.state = state != null ? state : new InMemoryCheckpointState();
        this.allowMutations = allowMutations;
    }

    /**
     * Runs the workflow.
     *
     * @throws NonIdempotentStepException if any step is not idempotent
     */
    public WorkflowRunResult run(ExecutionContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        for (Step step : steps) {
            if (!step.idempotent()) {
                throw new NonIdempotentStepException(step.name());
            }
        }

        results.clear();
        ResultAggregator aggregator = new ResultAggregator();
        List<String> skipped = new ArrayList<>();

        for (Step step : steps) {
            String name = step.name();

            var cancellation = context.cancellationCause();
            if (cancellation.isPresent()) {
                log.warn("Run {} cancelled before step {}: {}",
                        context.runId(), name, cancellation.get());
                return result(WorkflowOutcome.CANCELLED, aggregator, skipped, name,
                        cancellation.get());
            }

            if (state.isCompleted(name)) {
                log.info("Skipping completed step: {}", name);
                skipped.add(name);
                continue;
            }

            if (step.mutates() && !allowMutations) {
                Finding block = Finding.block(MUTATION_BLOCKED_MESSAGE, Findings.meta("step", name));
                results.put(name, List.of(block));
                aggregator.addFindings(List.of(block));
                log.warn("BLOCK: step {} mutates but mutations are not allowed", name);
                return result(WorkflowOutcome.BLOCKED, aggregator, skipped, name, null);
            }

            log.info("Running step: {}", name);
            List<Finding> findings = execute(step, context);
            results.put(name, findings);

            if (!aggregator.addFindings(findings)) {
                log.warn("BLOCK encountered in step {}; halting workflow", name);
                return result(WorkflowOutcome.BLOCKED, aggregator, skipped, name, null);
            }

            state.markCompleted(name);
            log.info("Completed step: {} ({})", name, Summary.of(findings));
        }

        return result(WorkflowOutcome.COMPLETED, aggregator, skipped, null, null);
    }

    /**
     * Findings recorded by the latest run, keyed by step name in execution order.
     */
    public Map<String, List<Finding>> results() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public boolean allowMutations() {
        return allowMutations;
    }

    private List<Finding> execute(Step step, ExecutionContext context) {
        List<Finding> findings = new ArrayList<>();
        try {
            StepResult result = step.run(context, state);
            if (result != null) {
                findings.addAll(result.findings());
            }
        } catch (StepExecutionException e) {
            findings.addAll(e.partialFindings());
            findings.add(stepError(step, e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            findings.add(stepError(step, e));
        } catch (Exception e) {
            findings.add(stepError(step, e));
        }
        return List.copyOf(findings);
    }

    private static Finding stepError(Step step, Exception e) {
        log.error("Step {} failed", step.name(), e);
        return Finding.block("step error: " + describe(e), Findings.meta("step", step.name()));
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private WorkflowRunResult result(
            WorkflowOutcome outcome,
            ResultAggregator aggregator,
            List<String> skipped,
            String haltedAt,
            String cancellationReason) {
        return new WorkflowRunResult(
                outcome, aggregator.summary(), results, skipped, haltedAt, cancellationReason);
    }
}
