package com.migratorx.checks;

import com.migratorx.workflow.ExecutionContext;
import com.migratorx.workflow.Finding;
import com.migratorx.workflow.Findings;
import com.migratorx.workflow.Severity;
import com.migratorx.workflow.Summary;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Final guard before a replica is promoted.
 *
 * <p>The operator must type the configured confirmation phrase exactly, every required check must
 * be registered, and a fresh run of the checks must come back with nothing above INFO. WARN is
 * treated as BLOCK here.
 */
public final class PromotionGate {

    private static final Logger log = LoggerFactory.getLogger(PromotionGate.class);

    public static final String DEFAULT_CONFIRMATION_PHRASE = "PROMOTE";
    public static final List<String> DEFAULT_REQUIRED_CHECKS = List.of("cdc_debezium_health", "schema_parity");

    private final List<Check> checks;
    private final List<String> requiredCheckNames;
    private final String confirmationPhrase;

    /**
     * @param checks             checks to re-run
     * @param requiredCheckNames names that must appear among {@code checks}; defaults when null or empty
     * @param confirmationPhrase phrase the operator must supply verbatim
     */
    public PromotionGate(List<Check> checks, List<String> requiredCheckNames, String confirmationPhrase) {
        if (checks == null) {
            throw new IllegalArgumentException("checks must not be null");
        }
        if (confirmationPhrase == null || confirmationPhrase.isBlank()) {
            throw new IllegalArgumentException("confirmation phrase must not be null or blank");
        }
        this.checks = List.copyOf(checks);
        this.requiredCheckNames = requiredCheckNames == null || requiredCheckNames.isEmpty()
                ? DEFAULT_REQUIRED_CHECKS
                : List.copyOf(requiredCheckNames);
        this.confirmationPhrase = confirmationPhrase;
    }

    public PromotionResult run(ExecutionContext context, CheckInput input, String confirmation) {
        if (!confirmationPhrase.equals(confirmation)) {
            log.warn("Promotion refused: confirmation phrase did not match");
            return PromotionResult.blocked(Finding.block("promotion requires explicit confirmation",
                    Findings.meta("required", confirmationPhrase)));
        }

        List<String> missing = missingChecks();
        if (!missing.isEmpty()) {
            log.warn("Promotion refused: missing required checks {}", missing);
            return PromotionResult.blocked(Finding.block(
                    "promotion requires checks: " + String.join(", ", missing),
                    Findings.meta("missing", missing)));
        }

        ChecksRunResult run = new ChecksRunner(checks).run(context, input);
        Summary summary = run.summary();
        List<Finding> findings = new ArrayList<>(run.flattenedFindings());
        if (summary.warn() > 0 || summary.block() > 0) {
            findings.add(Finding.block(
                    String.format("promotion blocked due to WARN/BLOCK findings (WARN=%d, BLOCK=%d)",
                            summary.warn(), summary.block()),
                    Findings.meta("warn", summary.warn(), "block", summary.block())));
            summary = summary.add(Severity.BLOCK);
            log.warn("Promotion blocked ({})", summary);
        } else {
            log.info("Promotion gate passed ({})", summary);
        }
        return new PromotionResult(summary, findings);
    }

    public List<String> requiredCheckNames() {
        return requiredCheckNames;
    }

    private List<String> missingChecks() {
        Set<String> present = new LinkedHashSet<>();
        checks.forEach(c -> present.add(c.name()));
        return requiredCheckNames.stream().filter(name -> !present.contains(name)).toList();
    }
}
