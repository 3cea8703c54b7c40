package com.migratorx.checks;

import com.migratorx.workflow.Finding;
import com.migratorx.workflow.Summary;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a {@link ChecksRunner} run.
 *
 * @param summary counts over every check
 * @param results per-check findings in execution order
 */
public record ChecksRunResult(Summary summary, List<CheckResult> results) {

    public ChecksRunResult {
        results = List.copyOf(results);
    }

    /**
     * Every finding in check order, tagged with a {@code check} metadata entry unless it already
     * carries one.
     */
    public List<Finding> flattenedFindings() {
        List<Finding> all = new ArrayList<>();
        for (CheckResult result : results) {
            for (Finding finding : result.findings()) {
                all.add(finding.metadata().containsKey(ChecksRunner.CHECK_META)
                        ? finding
                        : finding.withMetadata(ChecksRunner.CHECK_META, result.checkName()));
            }
        }
        return all;
    }
}
