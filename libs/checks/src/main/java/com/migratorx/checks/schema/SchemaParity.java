package com.migratorx.checks.schema;

import com.migratorx.workflow.Finding;
import com.migratorx.workflow.Findings;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compares a primary schema snapshot against a replica snapshot.
 *
 * <p>Pure and deterministic: findings follow primary table order, then tables that exist only on
 * the replica. Within a table, primary-key findings come first, then columns in primary order,
 * then replica-only columns. An empty result means the schemas match.
 *
 * <ul>
 *   <li>missing table, missing column, type mismatch, missing or different primary key: BLOCK</li>
 *   <li>extra table or column, primary key only on the replica: WARN</li>
 *   <li>nullability, default and collation differences: one WARN each</li>
 * </ul>
 */
public final class SchemaParity {

    private SchemaParity() {
        // utility class
    }

    public static List<Finding> compare(SchemaSnapshot primary, SchemaSnapshot replica) {
        if (primary == null || replica == null) {
            throw new IllegalArgumentException("both schema snapshots are required");
        }
        List<Finding> findings = new ArrayList<>();
        Map<String, TableDefinition> primaryTables = tableIndex(primary);
        Map<String, TableDefinition> replicaTables = tableIndex(replica);

        primaryTables.forEach((name, primaryTable) -> {
            TableDefinition replicaTable = replicaTables.get(name);
            if (replicaTable == null) {
                findings.add(Finding.block(
                        String.format("table \"%s\" missing on replica", name),
                        Findings.meta("table", name)));
                return;
            }
            comparePrimaryKey(name, primaryTable.primaryKey(), replicaTable.primaryKey(), findings);
            compareColumns(name, primaryTable.columns(), replicaTable.columns(), findings);
        });

        for (String name : replicaTables.keySet()) {
            if (!primaryTables.containsKey(name)) {
                findings.add(Finding.warn(
                        String.format("extra table \"%s\" exists on replica", name),
                        Findings.meta("table", name)));
            }
        }
        return findings;
    }

    private static void comparePrimaryKey(String table, List<String> primaryPk, List<String> replicaPk,
                                          List<Finding> findings) {
        if (primaryPk.isEmpty() && replicaPk.isEmpty()) {
            return;
        }
        if (primaryPk.isEmpty()) {
            findings.add(Finding.warn(
                    String.format("table \"%s\" has primary key on replica but not on primary", table),
                    Findings.meta("table", table)));
        } else if (replicaPk.isEmpty()) {
            findings.add(Finding.block(
                    String.format("table \"%s\" missing primary key on replica", table),
                    Findings.meta("table", table)));
        } else if (!primaryPk.equals(replicaPk)) {
            findings.add(Finding.block(
                    String.format("table \"%s\" primary key mismatch", table),
                    Findings.meta("table", table, "primary_pk", primaryPk, "replica_pk", replicaPk)));
        }
    }

    private static void compareColumns(String table, List<ColumnDefinition> primaryColumns,
                                       List<ColumnDefinition> replicaColumns, List<Finding> findings) {
        Map<String, ColumnDefinition> primaryIndex = columnIndex(primaryColumns);
        Map<String, ColumnDefinition> replicaIndex = columnIndex(replicaColumns);

        primaryIndex.forEach((name, p) -> {
            ColumnDefinition r = replicaIndex.get(name);
            if (r == null) {
                findings.add(Finding.block(
                        String.format("table \"%s\" column \"%s\" missing on replica", table, name),
                        Findings.meta("table", table, "column", name)));
                return;
            }
            if (!Objects.equals(p.type(), r.type())) {
                findings.add(Finding.block(
                        String.format("table \"%s\" column \"%s\" type mismatch", table, name),
                        Findings.meta("table", table, "column", name,
                                "primary_type", p.type(), "replica_type", r.type())));
            }
            if (p.nullable() != r.nullable()) {
                findings.add(Finding.warn(
                        String.format("table \"%s\" column \"%s\" nullability differs", table, name),
                        Findings.meta("table", table, "column", name,
                                "primary_nullable", p.nullable(), "replica_nullable", r.nullable())));
            }
            if (!Objects.equals(p.defaultValue(), r.defaultValue())) {
                findings.add(Finding.warn(
                        String.format("table \"%s\" column \"%s\" default differs", table, name),
                        Findings.meta("table", table, "column", name,
                                "primary_default", p.defaultValue(), "replica_default", r.defaultValue())));
            }
            if (!Objects.equals(p.collation(), r.collation())) {
                findings.add(Finding.warn(
                        String.format("table \"%s\" column \"%s\" collation differs", table, name),
                        Findings.meta("table", table, "column", name,
                                "primary_collation", p.collation(), "replica_collation", r.collation())));
            }
        });

        for (String name : replicaIndex.keySet()) {
            if (!primaryIndex.containsKey(name)) {
                findings.add(Finding.warn(
                        String.format("table \"%s\" has extra column \"%s\" on replica", table, name),
                        Findings.meta("table", table, "column", name)));
            }
        }
    }

    // Later duplicates replace earlier ones but keep the first position.
    private static Map<String, TableDefinition> tableIndex(SchemaSnapshot snapshot) {
        Map<String, TableDefinition> index = new LinkedHashMap<>();
        snapshot.tables().forEach(t -> index.put(t.name(), t));
        return index;
    }

    private static Map<String, ColumnDefinition> columnIndex(List<ColumnDefinition> columns) {
        Map<String, ColumnDefinition> index = new LinkedHashMap<>();
        columns.forEach(c -> index.put(c.name(), c));
        return index;
    }
}
