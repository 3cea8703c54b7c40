package com.migratorx.cli.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.migratorx.checks.CheckInput;
import com.migratorx.checks.ChecksRunResult;
import com.migratorx.checks.ChecksRunner;
import com.migratorx.checks.PromotionGate;
import com.migratorx.checks.PromotionResult;
import com.migratorx.cli.config.MigratorxProperties;
import com.migratorx.cli.infrastructure.replica.SimulatedReplicaActions;
import com.migratorx.cli.infrastructure.replica.StaticReplicaInspector;
import com.migratorx.cli.infrastructure.replica.UnconfiguredReplicaActions;
import com.migratorx.cli.output.CommandReport;
import com.migratorx.cli.workflow.CheckCatalog;
import com.migratorx.cli.workflow.CheckSources;
import com.migratorx.cli.workflow.PlanWorkflowFactory;
import com.migratorx.observability.MigrationRunContextHolder;
import com.migratorx.replica.ReplicaActions;
import com.migratorx.replica.ReplicaUpgradeOrchestrator;
import com.migratorx.replica.ReplicaUpgradeResult;
import com.migratorx.replica.ReplicationStatus;
import com.migratorx.workflow.ExecutionContext;
import com.migratorx.workflow.Finding;
import com.migratorx.workflow.Findings;
import com.migratorx.workflow.MigrationConfigurationException;
import com.migratorx.workflow.Step;
import com.migratorx.workflow.WorkflowOutcome;
import com.migratorx.workflow.WorkflowRunResult;
import com.migratorx.workflow.WorkflowRunner;
import com.migratorx.workflow.plan.MigrationPlan;
import com.migratorx.workflow.plan.PlanLoader;
import com.migratorx.workflow.state.FileCheckpointState;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The migratorx commands. Each one loads the plan, wires the components it needs from the
 * snapshot files named on the command line and returns the findings as a {@link CommandReport}.
 *
 * <p>Configuration problems (invalid plan, unreadable state file) are thrown as
 * {@link MigrationConfigurationException}; argument problems as {@link UsageException}.
 */
@Component
public class MigrationCommands {

    private static final Logger log = LoggerFactory.getLogger(MigrationCommands.class);

    static final String DEFAULT_PLAN = "migration.yaml";

    private final ObjectMapper mapper;
    private final MigratorxProperties properties;
    private final Clock clock;

    public MigrationCommands(ObjectMapper mapper, MigratorxProperties properties, Clock clock) {
        this.mapper = mapper;
        this.properties = properties;
        this.clock = clock;
    }

    public CommandReport execute(CommandLine line, ExecutionContext context) {
        String command = line.word(0, "command");
        return switch (command) {
            case "plan" -> plan(line);
            case "preflight" -> preflight(line, context);
            case "upgrade" -> {
                expectWord(line, 1, "replica");
                yield upgradeReplica(line, context, line.word(2, "replica name"));
            }
            case "validate" -> validate(line, context);
            case "cdc" -> {
                expectWord(line, 1, "check");
                yield cdcCheck(line, context);
            }
            case "promote" -> promote(line, context);
            case "run" -> run(line, context);
            default -> throw new UsageException("unknown command: " + command);
        };
    }

    /** Name used in logs and metrics, e.g. {@code upgrade replica}. */
    public static String commandName(CommandLine line) {
        List<String> words = line.words();
        if (words.isEmpty()) {
            return "usage";
        }
        String first = words.get(0);
        if (words.size() > 1 && List.of("upgrade", "validate", "cdc").contains(first)) {
            return first + " " + words.get(1);
        }
        return first;
    }

    /** Host named on the command line ({@code upgrade replica <name>}), if any. */
    public static String target(CommandLine line) {
        List<String> words = line.words();
        return words.size() > 2 ? words.get(2) : null;
    }

    CommandReport plan(CommandLine line) {
        MigrationPlan plan = loadPlan(line);
        return CommandReport.of("plan", List.of(
                Finding.info(String.format("plan \"%s\" is valid", plan.migration()))));
    }

    CommandReport preflight(CommandLine line, ExecutionContext context) {
        MigrationPlan plan = loadPlan(line);
        String replica = replicaFor(line, plan);
        CheckCatalog catalog = catalog(line, plan);
        return checks("preflight", new ChecksRunner(catalog.preflight(replica)), context, plan, replica);
    }

    CommandReport upgradeReplica(CommandLine line, ExecutionContext context, String replica) {
        MigrationPlan plan = loadPlan(line);
        var state = new FileCheckpointState(line.path("state", properties.statePath()));
        var orchestrator = new ReplicaUpgradeOrchestrator(replicaInspector(line, plan), replicaActions(line),
                state, plan.topology().primary());
        ReplicaUpgradeResult result = orchestrator.run(context, replica);
        return new CommandReport("upgrade replica", result.summary(), result.findings());
    }

    CommandReport validate(CommandLine line, ExecutionContext context) {
        String scope = line.word(1, "validate scope (replica or primary)");
        MigrationPlan plan = loadPlan(line);
        String replica = switch (scope) {
            case "replica" -> line.word(2, "replica name");
            case "primary" -> replicaFor(line, plan);
            default -> throw new UsageException("unknown validate scope: " + scope);
        };
        CheckCatalog catalog = catalog(line, plan);
        return checks("validate " + scope, new ChecksRunner(List.of(catalog.schemaParity(replica))),
                context, plan, replica);
    }

    CommandReport cdcCheck(CommandLine line, ExecutionContext context) {
        MigrationPlan plan = loadPlan(line);
        CheckCatalog catalog = catalog(line, plan);
        return checks("cdc check", new ChecksRunner(catalog.cdc()), context, plan, null);
    }

    CommandReport promote(CommandLine line, ExecutionContext context) {
        MigrationPlan plan = loadPlan(line);
        String replica = replicaFor(line, plan);
        CheckCatalog catalog = catalog(line, plan);
        var gate = new PromotionGate(catalog.promotion(replica), properties.requiredPromotionChecks(),
                line.option("phrase", properties.confirmationPhrase()));
        PromotionResult result = gate.run(context, CheckInput.fromPlan(plan, replica),
                line.option("confirm", null));
        return new CommandReport("promote", result.summary(), result.findings());
    }

    CommandReport run(CommandLine line, ExecutionContext context) {
        MigrationPlan plan = loadPlan(line);
        String replica = replicaFor(line, plan);
        boolean allowMutations = line.flag("allow-mutations", properties.allowMutations());
        var state = new FileCheckpointState(line.path("state", properties.statePath()));
        var factory = new PlanWorkflowFactory(catalog(line, plan), replicaInspector(line, plan),
                replicaActions(line), properties.requiredPromotionChecks(),
                line.option("phrase", properties.confirmationPhrase()), line.option("confirm", null));
        List<Step> steps = factory.build(replica);

        WorkflowRunResult result = new WorkflowRunner(steps, state, allowMutations).run(context);
        log.info("Workflow finished: {} ({}), skipped {}", result.outcome(), result.summary(), result.skippedSteps());

        List<Finding> findings = new ArrayList<>();
        for (Map.Entry<String, List<Finding>> entry : result.results().entrySet()) {
            entry.getValue().forEach(f -> findings.add(f.withMetadata("step", entry.getKey())));
        }
        if (result.outcome() == WorkflowOutcome.CANCELLED) {
            findings.add(Finding.block("run cancelled",
                    Findings.meta("step", result.haltedAt(), "reason", result.cancellationReason())));
        }
        return CommandReport.of("run", findings);
    }

    private CommandReport checks(String command, ChecksRunner runner, ExecutionContext context,
                                 MigrationPlan plan, String replica) {
        ChecksRunResult result = runner.run(context, CheckInput.fromPlan(plan, replica));
        return new CommandReport(command, result.summary(), result.flattenedFindings());
    }

    private MigrationPlan loadPlan(CommandLine line) {
        MigrationPlan plan = PlanLoader.load(line.path("plan", DEFAULT_PLAN));
        MigrationRunContextHolder.get()
                .ifPresent(c -> MigrationRunContextHolder.set(c.withMigration(plan.migration())));
        return plan;
    }

    private static String replicaFor(CommandLine line, MigrationPlan plan) {
        String replica = line.option("replica", null);
        if (replica != null) {
            return replica;
        }
        return plan.firstReplica()
                .orElseThrow(() -> new MigrationConfigurationException("no replicas defined in plan"));
    }

    private CheckCatalog catalog(CommandLine line, MigrationPlan plan) {
        var sources = new CheckSources(line.path("schema-primary"), line.path("schema-replica"),
                line.path("cdc-status"), line.path("mysql-settings"), line.path("schema-history"));
        return new CheckCatalog(mapper, properties, clock, plan, sources);
    }

    private static StaticReplicaInspector replicaInspector(CommandLine line, MigrationPlan plan) {
        var status = new ReplicationStatus(line.flag("io-running", true), line.flag("sql-running", true));
        return new StaticReplicaInspector(plan.topology().primary(), status);
    }

    private static ReplicaActions replicaActions(CommandLine line) {
        return line.flag("simulate", false) ? new SimulatedReplicaActions() : new UnconfiguredReplicaActions();
    }

    private static void expectWord(CommandLine line, int index, String expected) {
        String word = line.word(index, "\"" + expected + "\"");
        if (!expected.equals(word)) {
            throw new UsageException("expected \"" + expected + "\" but got \"" + word + "\"");
        }
    }
}
