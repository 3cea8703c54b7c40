package com.migratorx.cli.command;

import com.migratorx.cli.config.MigratorxProperties;
import com.migratorx.cli.output.CommandReport;
import com.migratorx.cli.output.ReportWriter;
import com.migratorx.observability.FindingMetrics;
import com.migratorx.observability.MigrationRunContext;
import com.migratorx.observability.MigrationRunContextHolder;
import com.migratorx.workflow.ExecutionContext;
import com.migratorx.workflow.Finding;
import com.migratorx.workflow.MigrationConfigurationException;
import io.micrometer.core.instrument.Timer;
import java.io.PrintStream;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Executes the command given on the process arguments and remembers the exit code for
 * {@link org.springframework.boot.SpringApplication#exit}.
 *
 * <p>The findings report goes to stdout. Exit codes:
 * <ul>
 *   <li>0 when the report has no BLOCK
 *   <li>{@code migratorx.block-exit-code} when it does (0 by default)
 *   <li>{@code migratorx.exit-codes.configuration-error} for configuration errors, which are
 *       still reported as a single BLOCK finding
 *   <li>{@code migratorx.exit-codes.usage} for usage errors, with the usage text on stderr
 * </ul>
 */
@Component
public class MigratorxCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(MigratorxCommandRunner.class);

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  migratorx plan --plan=migration.yaml",
            "  migratorx preflight --plan=migration.yaml [--schema-primary=path --schema-replica=path --cdc-status=path]"
                    + " [--mysql-settings=path] [--schema-history=path]",
            "  migratorx upgrade replica <name> --plan=migration.yaml [--state=path --simulate --io-running=bool --sql-running=bool]",
            "  migratorx validate replica <name> --plan=migration.yaml --schema-primary=path --schema-replica=path",
            "  migratorx validate primary --plan=migration.yaml --schema-primary=path --schema-replica=path",
            "  migratorx cdc check --plan=migration.yaml --cdc-status=path [--schema-history=path]",
            "  migratorx promote --plan=migration.yaml --confirm=PROMOTE [--phrase=PROMOTE]"
                    + " --schema-primary=path --schema-replica=path --cdc-status=path",
            "  migratorx run --plan=migration.yaml [--state=path --allow-mutations --simulate --confirm=PROMOTE --timeout=30m]");

    private final MigrationCommands commands;
    private final ReportWriter reportWriter;
    private final FindingMetrics metrics;
    private final MigratorxProperties properties;
    private final Clock clock;
    private final PrintStream out;
    private final PrintStream err;

    private volatile int exitCode;

    @Autowired
    public MigratorxCommandRunner(MigrationCommands commands, ReportWriter reportWriter, FindingMetrics metrics,
                                  MigratorxProperties properties, Clock clock) {
        this(commands, reportWriter, metrics, properties, clock, System.out, System.err);
    }

    MigratorxCommandRunner(MigrationCommands commands, ReportWriter reportWriter, FindingMetrics metrics,
                           MigratorxProperties properties, Clock clock, PrintStream out, PrintStream err) {
        this.commands = commands;
        this.reportWriter = reportWriter;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(ApplicationArguments args) {
        CommandLine line = new CommandLine(args);
        if (line.isEmpty()) {
            exitCode = usage("command is required");
            return;
        }
        var runContext = new MigrationRunContext(UUID.randomUUID().toString(), null,
                MigrationCommands.commandName(line), MigrationCommands.target(line));
        exitCode = MigrationRunContextHolder.callWithContext(runContext, () -> execute(line, runContext));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private int execute(CommandLine line, MigrationRunContext runContext) {
        String component = runContext.command();
        Timer.Sample sample = Timer.start(metrics.registry());
        CommandReport report;
        int code;
        try {
            report = commands.execute(line, executionContext(line, runContext.runId()));
            code = report.hasBlock() ? properties.blockExitCode() : 0;
        } catch (UsageException e) {
            log.debug("Usage error: {}", e.getMessage());
            return usage(e.getMessage());
        } catch (MigrationConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            report = CommandReport.of(component, List.of(Finding.block(e.getMessage())));
            code = properties.exitCodes().configurationError();
        } finally {
            sample.stop(metrics.timer(component));
        }
        metrics.record(component, report.findings());
        reportWriter.write(report, out);
        log.info("{} finished with {} (exit code {})", component, report.summary(), code);
        return code;
    }

    private ExecutionContext executionContext(CommandLine line, String runId) {
        Duration timeout = line.duration("timeout");
        if (timeout == null) {
            return ExecutionContext.create(runId);
        }
        if (timeout.isZero() || timeout.isNegative()) {
            throw new UsageException("--timeout must be positive");
        }
        Instant deadline;
        try {
            deadline = clock.instant().plus(timeout);
        } catch (DateTimeException | ArithmeticException e) {
            throw new UsageException("--timeout is too large: " + timeout);
        }
        return ExecutionContext.withDeadline(runId, deadline, clock);
    }

    private int usage(String message) {
        err.println("migratorx: " + message);
        err.println(USAGE);
        err.flush();
        return properties.exitCodes().usage();
    }
}
