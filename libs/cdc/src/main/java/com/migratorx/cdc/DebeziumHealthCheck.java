package com.migratorx.cdc;

import com.migratorx.checks.Check;
import com.migratorx.checks.CheckInput;
import com.migratorx.workflow.ExecutionContext;
import com.migratorx.workflow.Finding;
import com.migratorx.workflow.Findings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies that a Debezium connector and all of its tasks are RUNNING and not restart-looping.
 *
 * <p>Connector state, task states and the restart loop are evaluated independently and every
 * problem is reported. A restart loop means at least {@code maxRestarts} restarts with the latest
 * one no older than {@code window}.
 */
public class DebeziumHealthCheck implements Check {

    private static final Logger log = LoggerFactory.getLogger(DebeziumHealthCheck.class);

    public static final String NAME = "cdc_debezium_health";
    public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(10);
    public static final int DEFAULT_MAX_RESTARTS = 3;

    private final DebeziumInspector inspector;
    private final String connector;
    private final Duration window;
    private final int maxRestarts;
    private final Clock clock;

    public DebeziumHealthCheck(DebeziumInspector inspector, String connector) {
        this(inspector, connector, DEFAULT_WINDOW, DEFAULT_MAX_RESTARTS, Clock.systemUTC());
    }

    /**
     * @param connector   connector name; falls back to {@link CheckInput#cdcConnector()} when null
     * @param window      restart-loop window; default when null, zero or negative
     * @param maxRestarts restart-loop threshold; default when not positive
     */
    public DebeziumHealthCheck(DebeziumInspector inspector, String connector, Duration window,
                               int maxRestarts, Clock clock) {
        if (inspector == null) {
            throw new IllegalArgumentException("debezium inspector must not be null");
        }
        this.inspector = inspector;
        this.connector = connector;
        this.window = window == null || window.isZero() || window.isNegative() ? DEFAULT_WINDOW : window;
        this.maxRestarts = maxRestarts > 0 ? maxRestarts : DEFAULT_MAX_RESTARTS;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean readOnly() {
        return true;
    }

    @Override
    public List<Finding> run(ExecutionContext context, CheckInput input) {
        String target = connector != null && !connector.isBlank() ? connector : input.cdcConnector();
        if (target == null || target.isBlank()) {
            return List.of(Finding.block("connector name is required"));
        }

        ConnectorStatus status;
        try {
            status = inspector.connectorStatus(context, target);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.warn("Could not read status of connector {}", target, e);
            return List.of(Finding.block("failed to read Debezium connector status: " + e.getMessage(),
                    Findings.meta("connector", target)));
        }
        String name = status.name() != null ? status.name() : target;

        List<Finding> findings = new ArrayList<>();
        if (!status.isRunning()) {
            findings.add(Finding.block(
                    String.format("connector \"%s\" is %s (expected RUNNING)", name, status.connectorState()),
                    Findings.meta("connector", name, "state", status.connectorState())));
        }
        for (TaskStatus task : status.tasks()) {
            if (!task.isRunning()) {
                findings.add(Finding.block(
                        String.format("connector \"%s\" task %d is %s", name, task.id(), task.state()),
                        Findings.meta("connector", name, "task_id", task.id(), "state", task.state(),
                                "trace", task.trace())));
            }
        }
        if (isRestartLoop(status)) {
            log.warn("Connector {} restarted {} times, last at {}", name, status.restartCount(),
                    status.lastRestartAt());
            findings.add(Finding.block(
                    String.format("connector \"%s\" appears to be in a restart loop (%d restarts within %s)",
                            name, status.restartCount(), window),
                    Findings.meta("connector", name, "restart_count", status.restartCount(),
                            "window", window.toString())));
        }

        if (findings.isEmpty()) {
            findings.add(Finding.info(String.format("connector \"%s\" and tasks are RUNNING", name),
                    Findings.meta("connector", name)));
        }
        return findings;
    }

    boolean isRestartLoop(ConnectorStatus status) {
        Instant last = status.lastRestartAt();
        if (last == null || status.restartCount() < maxRestarts) {
            return false;
        }
        return Duration.between(last, clock.instant()).compareTo(window) <= 0;
    }

    public Duration window() {
        return window;
    }

    public int maxRestarts() {
        return maxRestarts;
    }
}
