package com.migratorx.checks;

import com.migratorx.workflow.Finding;
import com.migratorx.workflow.Summary;
import java.util.List;

/**
 * Outcome of a {@link PromotionGate} evaluation.
 *
 * @param summary  counts including any synthetic gate BLOCK
 * @param findings flattened check findings followed by gate findings
 */
public record PromotionResult(Summary summary, List<Finding> findings) {

    public PromotionResult {
        findings = List.copyOf(findings);
    }

    static PromotionResult blocked(Finding finding) {
        return new PromotionResult(Summary.EMPTY.add(finding.severity()), List.of(finding));
    }

    /** True only when every check passed with nothing above INFO. */
    public boolean promotable() {
        return summary.warn() == 0 && summary.block() == 0;
    }
}
