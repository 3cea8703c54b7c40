package com.migratorx.cli.workflow;

import com.migratorx.checks.Check;
import com.migratorx.checks.CheckInput;
import com.migratorx.checks.ChecksRunner;
import com.migratorx.checks.PromotionGate;
import com.migratorx.replica.ReplicaActions;
import com.migratorx.replica.ReplicaInspector;
import com.migratorx.replica.ReplicaUpgradeStep;
import com.migratorx.workflow.ReadOnlyStep;
import com.migratorx.workflow.Step;
import com.migratorx.workflow.StepResult;
import com.migratorx.workflow.plan.MigrationPlan;
import com.migratorx.workflow.plan.PlanStep;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns the steps of a migration plan into workflow {@link Step}s.
 *
 * <p>Every step except {@code upgrade_replica} is read-only. {@code promote} evaluates the
 * promotion gate; performing the cutover itself is left to the operator.
 */
public class PlanWorkflowFactory {

    private final CheckCatalog catalog;
    private final ReplicaInspector replicaInspector;
    private final ReplicaActions replicaActions;
    private final List<String> requiredPromotionChecks;
    private final String confirmationPhrase;
    private final String confirmation;

    /**
     * @param confirmation phrase supplied by the operator for the promote step (may be null)
     */
    public PlanWorkflowFactory(CheckCatalog catalog, ReplicaInspector replicaInspector,
                               ReplicaActions replicaActions, List<String> requiredPromotionChecks,
                               String confirmationPhrase, String confirmation) {
        this.catalog = catalog;
        this.replicaInspector = replicaInspector;
        this.replicaActions = replicaActions;
        this.requiredPromotionChecks = requiredPromotionChecks;
        this.confirmationPhrase = confirmationPhrase;
        this.confirmation = confirmation;
    }

    public List<Step> build(String replica) {
        MigrationPlan plan = catalog.plan();
        CheckInput input = CheckInput.fromPlan(plan, replica);
        List<Step> steps = new ArrayList<>();
        for (PlanStep planStep : plan.resolvedSteps()) {
            steps.add(toStep(planStep, input));
        }
        return steps;
    }

    private Step toStep(PlanStep planStep, CheckInput input) {
        String name = planStep.stepName();
        return switch (planStep) {
            case PREFLIGHT -> checksStep(name, catalog.preflight(input.replicaHost()), input);
            case UPGRADE_REPLICA -> new ReplicaUpgradeStep(name, replicaInspector, replicaActions,
                    input.primaryHost(), input.replicaHost());
            case VALIDATE_REPLICA, POST_VALIDATION ->
                    checksStep(name, List.of(catalog.schemaParity(input.replicaHost())), input);
            case CDC_CHECK -> checksStep(name, catalog.cdc(), input);
            case PROMOTE -> new ReadOnlyStep(name, (ctx, state) -> new StepResult(
                    new PromotionGate(catalog.promotion(input.replicaHost()), requiredPromotionChecks,
                            confirmationPhrase).run(ctx, input, confirmation).findings()));
        };
    }

    private static Step checksStep(String name, List<Check> checks, CheckInput input) {
        return new ReadOnlyStep(name, (ctx, state) ->
                new StepResult(new ChecksRunner(checks).run(ctx, input).flattenedFindings()));
    }
}
