package com.migratorx.checks.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One column of a table snapshot.
 *
 * @param name         column name
 * @param type         declared type, compared verbatim
 * @param nullable     whether NULL is allowed
 * @param defaultValue default expression; {@code null} when the column has no default
 * @param charset      character set, may be null
 * @param collation    collation, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ColumnDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("nullable") boolean nullable,
        @JsonProperty("default") String defaultValue,
        @JsonProperty("charset") String charset,
        @JsonProperty("collation") String collation) {

    public ColumnDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("column name must not be null or blank");
        }
    }

    /** Column with only a name, a type and nullability set. */
    public static ColumnDefinition of(String name, String type, boolean nullable) {
        return new ColumnDefinition(name, type, nullable, null, null, null);
    }

    public ColumnDefinition withDefault(String value) {
        return new ColumnDefinition(name, type, nullable, value, charset, collation);
    }

    public ColumnDefinition withCharset(String value) {
        return new ColumnDefinition(name, type, nullable, defaultValue, value, collation);
    }

    public ColumnDefinition withCollation(String value) {
        return new ColumnDefinition(name, type, nullable, defaultValue, charset, value);
    }
}
