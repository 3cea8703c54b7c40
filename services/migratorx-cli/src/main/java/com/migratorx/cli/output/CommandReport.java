package com.migratorx.cli.output;

import com.migratorx.workflow.Finding;
import com.migratorx.workflow.Summary;
import java.util.List;

/**
 * What a command produced: the counts and the findings behind them.
 *
 * @param command  command that produced the report, used as the metrics component
 * @param summary  severity counts
 * @param findings findings in output order
 */
public record CommandReport(String command, Summary summary, List<Finding> findings) {

    public CommandReport {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command must not be null or blank");
        }
        if (summary == null) {
            throw new IllegalArgumentException("summary must not be null");
        }
        findings = List.copyOf(findings);
    }

    /** Report whose summary is computed from the findings. */
    public static CommandReport of(String command, List<Finding> findings) {
        return new CommandReport(command, Summary.of(findings), findings);
    }

    public boolean hasBlock() {
        return summary.hasBlock();
    }
}
