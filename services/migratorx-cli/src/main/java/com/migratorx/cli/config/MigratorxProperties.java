package com.migratorx.cli.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for the migratorx command line.
 *
 * <p>Bound from the {@code migratorx.*} prefix:
 *
 * <pre>
 * migratorx:
 *   state-path: .migratorx/state.json
 *   confirmation-phrase: PROMOTE
 *   required-promotion-checks: [cdc_debezium_health, schema_parity]
 *   restart-loop:
 *     window: 10m
 *     max-restarts: 3
 *   allow-mutations: false
 *   block-exit-code: 0
 *   exit-codes:
 *     configuration-error: 2
 *     usage: 64
 *   schema-history-topic: dbhistory.orders
 *   expected-tables: [shop.orders, shop.customers]
 * </pre>
 *
 * @param statePath               checkpoint file used when {@code --state} is not given
 * @param confirmationPhrase      phrase {@code promote} requires when {@code --phrase} is not given
 * @param requiredPromotionChecks checks that must be registered for promotion
 * @param restartLoop             Debezium restart-loop detection settings
 * @param allowMutations          default for {@code run --allow-mutations}
 * @param blockExitCode           exit code when the output contains a BLOCK (0 keeps the JSON as the only signal)
 * @param exitCodes               exit codes for failures that produce no findings
 * @param schemaHistoryTopic      Debezium schema history topic; the history check is skipped when unset
 * @param expectedTables          tables the schema history must cover
 */
@ConfigurationProperties(prefix = "migratorx")
@Validated
public record MigratorxProperties(
        @NotBlank String statePath,
        @NotBlank String confirmationPhrase,
        List<String> requiredPromotionChecks,
        @Valid @NotNull RestartLoop restartLoop,
        boolean allowMutations,
        @Min(0) @Max(255) int blockExitCode,
        @Valid @NotNull ExitCodes exitCodes,
        String schemaHistoryTopic,
        List<String> expectedTables) {

    public static final String DEFAULT_STATE_PATH = ".migratorx/state.json";
    public static final String DEFAULT_CONFIRMATION_PHRASE = "PROMOTE";

    /**
     * Compact constructor, applies defaults for optional fields. Runs before Bean Validation.
     */
    public MigratorxProperties {
        if (statePath == null || statePath.isBlank()) {
            statePath = DEFAULT_STATE_PATH;
        }
        if (confirmationPhrase == null || confirmationPhrase.isBlank()) {
            confirmationPhrase = DEFAULT_CONFIRMATION_PHRASE;
        }
        requiredPromotionChecks = requiredPromotionChecks == null ? List.of() : List.copyOf(requiredPromotionChecks);
        if (restartLoop == null) {
            restartLoop = new RestartLoop(null, 0);
        }
        if (exitCodes == null) {
            exitCodes = new ExitCodes(0, 0);
        }
        expectedTables = expectedTables == null ? List.of() : List.copyOf(expectedTables);
    }

    /**
     * @param window      how recent the last restart must be to count as a loop (default 10m)
     * @param maxRestarts restart count at which a loop is reported (default 3)
     */
    public record RestartLoop(Duration window, @Min(1) int maxRestarts) {

        public RestartLoop {
            if (window == null || window.isZero() || window.isNegative()) {
                window = Duration.ofMinutes(10);
            }
            if (maxRestarts <= 0) {
                maxRestarts = 3;
            }
        }
    }

    /**
     * @param configurationError exit code for invalid plans, unreadable files and state errors (default 2)
     * @param usage              exit code for unknown commands and missing arguments (default 64)
     */
    public record ExitCodes(@Min(1) @Max(255) int configurationError, @Min(1) @Max(255) int usage) {

        public ExitCodes {
            if (configurationError <= 0) {
                configurationError = 2;
            }
            if (usage <= 0) {
                usage = 64;
            }
        }
    }
}
