package com.migratorx.checks.mysql;

import com.migratorx.checks.Check;
import com.migratorx.checks.CheckInput;
import com.migratorx.checks.schema.ColumnDefinition;
import com.migratorx.checks.schema.SchemaInspector;
import com.migratorx.checks.schema.SchemaSnapshot;
import com.migratorx.checks.schema.TableDefinition;
import com.migratorx.workflow.ExecutionContext;
import com.migratorx.workflow.Finding;
import com.migratorx.workflow.Findings;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Looks for MySQL 5.7 to 8.0 upgrade risks on the primary.
 *
 * <ul>
 *   <li>plan versions other than 5.7 to 8.0: WARN</li>
 *   <li>deprecated sql_mode flags: WARN each</li>
 *   <li>deprecated features in use: BLOCK each</li>
 *   <li>tables without a primary key: BLOCK each (CDC cannot key their rows)</li>
 *   <li>columns with a risky charset or collation: WARN each</li>
 * </ul>
 *
 * A clean primary yields one INFO. Inspector failures are BLOCK findings and end the run.
 */
public class MySqlCompatibilityCheck implements Check {

    public static final String NAME = "mysql_compat_57_80";

    static final String SOURCE_VERSION = "5.7";
    static final String TARGET_VERSION = "8.0";

    private final MySqlInspector inspector;
    private final SchemaInspector schemaInspector;
    private final String primaryHost;
    private final CompatibilityRules rules;

    public MySqlCompatibilityCheck(MySqlInspector inspector, SchemaInspector schemaInspector,
                                   String primaryHost, CompatibilityRules rules) {
        if (inspector == null) {
            throw new IllegalArgumentException("mysql inspector must not be null");
        }
        if (schemaInspector == null) {
            throw new IllegalArgumentException("schema inspector must not be null");
        }
        this.inspector = inspector;
        this.schemaInspector = schemaInspector;
        this.primaryHost = primaryHost;
        this.rules = rules == null ? CompatibilityRules.none() : rules;
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
        String host = primaryHost != null && !primaryHost.isBlank() ? primaryHost : input.primaryHost();
        if (host == null || host.isBlank()) {
            return List.of(Finding.block("primary host is required"));
        }

        List<Finding> findings = new ArrayList<>();
        checkVersions(input, findings);

        String sqlMode;
        try {
            sqlMode = inspector.sqlMode(context, host);
        } catch (Exception e) {
            return readFailure(findings, "failed to read sql_mode: ", host, e);
        }
        Set<String> modes = upperSet(sqlMode == null ? List.of() : List.of(sqlMode.split(",")));
        for (String mode : rules.deprecatedSqlModes()) {
            if (modes.contains(mode.toUpperCase(Locale.ROOT))) {
                findings.add(Finding.warn(
                        String.format("sql_mode includes deprecated mode \"%s\" for 8.0", mode),
                        Findings.meta("mode", mode, "host", host)));
            }
        }

        List<String> used;
        try {
            used = inspector.deprecatedFeaturesUsed(context, host);
        } catch (Exception e) {
            return readFailure(findings, "failed to read deprecated features: ", host, e);
        }
        Set<String> usedSet = upperSet(used == null ? List.of() : used);
        for (String feature : rules.deprecatedFeatures()) {
            if (usedSet.contains(feature.toUpperCase(Locale.ROOT))) {
                findings.add(Finding.block(
                        String.format("deprecated feature detected: \"%s\"", feature),
                        Findings.meta("feature", feature, "host", host)));
            }
        }

        SchemaSnapshot schema;
        try {
            schema = schemaInspector.schema(context, host);
        } catch (Exception e) {
            return readFailure(findings, "failed to read schema: ", host, e);
        }
        for (TableDefinition table : schema.tables()) {
            checkTable(table, findings);
        }

        if (findings.isEmpty()) {
            findings.add(Finding.info("no MySQL 5.7 to 8.0 compatibility risks detected",
                    Findings.meta("host", host)));
        }
        return findings;
    }

    private static void checkVersions(CheckInput input, List<Finding> findings) {
        String source = input.sourceVersion();
        String target = input.targetVersion();
        boolean declared = (source != null && !source.isEmpty()) || (target != null && !target.isEmpty());
        if (declared && !(SOURCE_VERSION.equals(source) && TARGET_VERSION.equals(target))) {
            findings.add(Finding.warn("compatibility check tuned for 5.7 to 8.0 upgrades",
                    Findings.meta("source_version", source, "target_version", target)));
        }
    }

    private void checkTable(TableDefinition table, List<Finding> findings) {
        if (!table.hasPrimaryKey()) {
            findings.add(Finding.block(
                    String.format("table \"%s\" missing primary key (CDC risk)", table.name()),
                    Findings.meta("table", table.name())));
        }
        for (ColumnDefinition column : table.columns()) {
            if (containsIgnoreCase(rules.riskyCharsets(), column.charset())) {
                findings.add(Finding.warn(
                        String.format("table \"%s\" column \"%s\" uses risky charset \"%s\"",
                                table.name(), column.name(), column.charset()),
                        Findings.meta("table", table.name(), "column", column.name(), "charset", column.charset())));
            }
            if (containsIgnoreCase(rules.riskyCollations(), column.collation())) {
                findings.add(Finding.warn(
                        String.format("table \"%s\" column \"%s\" uses risky collation \"%s\"",
                                table.name(), column.name(), column.collation()),
                        Findings.meta("table", table.name(), "column", column.name(),
                                "collation", column.collation())));
            }
        }
    }

    private static List<Finding> readFailure(List<Finding> findings, String prefix, String host, Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        findings.add(Finding.block(prefix + e.getMessage(), Findings.meta("host", host)));
        return findings;
    }

    private static Set<String> upperSet(List<String> values) {
        Set<String> set = new HashSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                set.add(value.trim().toUpperCase(Locale.ROOT));
            }
        }
        return set;
    }

    private static boolean containsIgnoreCase(List<String> list, String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        return list.stream().anyMatch(item -> item.equalsIgnoreCase(value));
    }
}
