package com.migratorx.cdc;

import com.migratorx.checks.Check;
import com.migratorx.checks.CheckInput;
import com.migratorx.workflow.ExecutionContext;
import com.migratorx.workflow.Finding;
import com.migratorx.workflow.Findings;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Verifies the Debezium schema history topic exists, is readable and covers the expected tables.
 *
 * <p>The first failing stage ends the check with a single BLOCK. Table names are compared trimmed
 * and case-insensitively.
 */
public class SchemaHistoryCheck implements Check {

    public static final String NAME = "cdc_schema_history";

    private final KafkaInspector inspector;
    private final String topic;
    private final List<String> expectedTables;

    public SchemaHistoryCheck(KafkaInspector inspector, String topic, List<String> expectedTables) {
        if (inspector == null) {
            throw new IllegalArgumentException("kafka inspector must not be null");
        }
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("schema history topic must not be null or blank");
        }
        this.inspector = inspector;
        this.topic = topic;
        this.expectedTables = expectedTables == null ? List.of() : new ArrayList<>(expectedTables);
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
        try {
            if (!inspector.topicExists(context, topic)) {
                return block(String.format("schema history topic \"%s\" is missing", topic));
            }
        } catch (Exception e) {
            return failure(String.format("failed to check schema history topic \"%s\": ", topic), e);
        }

        try {
            if (!inspector.topicReadable(context, topic)) {
                return block(String.format("schema history topic \"%s\" is not readable", topic));
            }
        } catch (Exception e) {
            return failure(String.format("failed to read schema history topic \"%s\": ", topic), e);
        }

        List<String> covered;
        try {
            covered = inspector.schemaHistoryTables(context, topic);
        } catch (Exception e) {
            return failure(String.format("failed to read schema history coverage for \"%s\": ", topic), e);
        }

        List<String> missing = missingTables(expectedTables, covered == null ? List.of() : covered);
        if (!missing.isEmpty()) {
            return List.of(Finding.block("schema history missing tables: " + String.join(", ", missing),
                    Findings.meta("topic", topic, "missing_tables", missing)));
        }
        return List.of(Finding.info(String.format("schema history topic \"%s\" is healthy", topic),
                Findings.meta("topic", topic)));
    }

    static List<String> missingTables(List<String> expected, List<String> covered) {
        Set<String> coveredSet = new HashSet<>();
        for (String table : covered) {
            if (table != null) {
                coveredSet.add(normalize(table));
            }
        }
        List<String> missing = new ArrayList<>();
        for (String table : expected) {
            if (table == null || table.isBlank()) {
                continue;
            }
            if (!coveredSet.contains(normalize(table))) {
                missing.add(table);
            }
        }
        return missing;
    }

    private static String normalize(String table) {
        return table.trim().toLowerCase(Locale.ROOT);
    }

    private List<Finding> block(String message) {
        return List.of(Finding.block(message, Findings.meta("topic", topic)));
    }

    private List<Finding> failure(String prefix, Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        return block(prefix + e.getMessage());
    }
}
