package com.migratorx.checks.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Point-in-time view of a database schema.
 *
 * @param tables tables in the order the inspector reported them
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SchemaSnapshot(@JsonProperty("tables") List<TableDefinition> tables) {

    public static final SchemaSnapshot EMPTY = new SchemaSnapshot(List.of());

    public SchemaSnapshot {
        tables = tables == null ? List.of() : List.copyOf(tables);
    }

    public static SchemaSnapshot of(TableDefinition... tables) {
        return new SchemaSnapshot(List.of(tables));
    }
}
