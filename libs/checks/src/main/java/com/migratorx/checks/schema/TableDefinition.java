package com.migratorx.checks.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * One table of a schema snapshot.
 *
 * @param name       table name
 * @param primaryKey primary-key columns in key order; empty when the table has none
 * @param columns    columns in declaration order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TableDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("primary_key") List<String> primaryKey,
        @JsonProperty("columns") List<ColumnDefinition> columns) {

    public TableDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("table name must not be null or blank");
        }
        primaryKey = primaryKey == null ? List.of() : List.copyOf(primaryKey);
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public boolean hasPrimaryKey() {
        return !primaryKey.isEmpty();
    }
}
