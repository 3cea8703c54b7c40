package com.migratorx.checks;

import com.migratorx.workflow.ExecutionContext;
import com.migratorx.workflow.Finding;
import com.migratorx.workflow.Findings;
import com.migratorx.workflow.Summary;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes read-only {@link Check}s sequentially and aggregates their findings.
 *
 * <p>Unlike the workflow runner this never halts early: every check runs and the overall
 * {@link Summary} is returned. A check error becomes one BLOCK tagged with the check's name, and
 * a finding without a message becomes a BLOCK flagging the offending check.
 */
public final class ChecksRunner {

    private static final Logger log = LoggerFactory.getLogger(ChecksRunner.class);

    /** Metadata key naming the check a finding came from. */
    public static final String CHECK_META = "check";

    private final List<Check> checks;

    public ChecksRunner(List<Check> checks) {
        if (checks == null) {
            throw new IllegalArgumentException("checks must not be null");
        }
        this.checks = List.copyOf(checks);
    }

    /**
     * Runs every check.
     *
     * @throws NonReadOnlyCheckException if any check is not read-only; no check runs in that case
     */
    public ChecksRunResult run(ExecutionContext context, CheckInput input) {
        for (Check check : checks) {
            if (!check.readOnly()) {
                throw new NonReadOnlyCheckException(check.name());
            }
        }

        Summary summary = Summary.EMPTY;
        List<CheckResult> results = new ArrayList<>(checks.size());

        for (Check check : checks) {
            log.info("Running check: {}", check.name());
            List<Finding> findings = enforceMessages(check.name(), execute(check, context, input));
            Summary checkSummary = Summary.of(findings);
            summary = summary.plus(checkSummary);
            results.add(new CheckResult(check.name(), findings));
            log.info("Check {} finished ({})", check.name(), checkSummary);
        }

        return new ChecksRunResult(summary, results);
    }

    public List<String> checkNames() {
        return checks.stream().map(Check::name).toList();
    }

    private static List<Finding> execute(Check check, ExecutionContext context, CheckInput input) {
        try {
            List<Finding> findings = check.run(context, input);
            return findings == null ? List.of() : findings;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of(checkError(check, e));
        } catch (Exception e) {
            return List.of(checkError(check, e));
        }
    }

    private static Finding checkError(Check check, Exception e) {
        log.error("Check {} failed", check.name(), e);
        String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return Finding.block("check error: " + detail, Findings.meta(CHECK_META, check.name()));
    }

    private static List<Finding> enforceMessages(String checkName, List<Finding> findings) {
        List<Finding> out = new ArrayList<>(findings.size());
        for (Finding finding : findings) {
            if (finding == null || finding.message() == null || finding.message().isBlank()) {
                log.warn("Check {} emitted a finding without a message", checkName);
                out.add(Finding.block(
                        String.format("check \"%s\" emitted a finding without a message", checkName),
                        Findings.meta(CHECK_META, checkName)));
            } else {
                out.add(finding);
            }
        }
        return out;
    }
}
