package com.migratorx.checks.mysql;

import java.util.List;

/**
 * What {@link MySqlCompatibilityCheck} looks for. Matching is case-insensitive.
 *
 * @param deprecatedSqlModes sql_mode flags that raise a WARN
 * @param deprecatedFeatures feature names that raise a BLOCK
 * @param riskyCharsets      column charsets that raise a WARN
 * @param riskyCollations    column collations that raise a WARN
 */
public record CompatibilityRules(
        List<String> deprecatedSqlModes,
        List<String> deprecatedFeatures,
        List<String> riskyCharsets,
        List<String> riskyCollations) {

    public CompatibilityRules {
        deprecatedSqlModes = deprecatedSqlModes == null ? List.of() : List.copyOf(deprecatedSqlModes);
        deprecatedFeatures = deprecatedFeatures == null ? List.of() : List.copyOf(deprecatedFeatures);
        riskyCharsets = riskyCharsets == null ? List.of() : List.copyOf(riskyCharsets);
        riskyCollations = riskyCollations == null ? List.of() : List.copyOf(riskyCollations);
    }

    /** Only the structural rules (primary keys, version pair) apply. */
    public static CompatibilityRules none() {
        return new CompatibilityRules(List.of(), List.of(), List.of(), List.of());
    }

    /** Signals that commonly break a 5.7 to 8.0 upgrade. */
    public static CompatibilityRules mysql57To80() {
        return new CompatibilityRules(
                List.of("NO_AUTO_CREATE_USER", "NO_ZERO_DATE", "NO_ZERO_IN_DATE", "ERROR_FOR_DIVISION_BY_ZERO"),
                List.of("QUERY_CACHE", "OLD_PASSWORDS", "MYSQL_OLD_PASSWORD", "ENCODE_DECODE_FUNCTIONS"),
                List.of("utf8", "utf8mb3"),
                List.of("utf8_general_ci", "utf8_unicode_ci"));
    }
}
