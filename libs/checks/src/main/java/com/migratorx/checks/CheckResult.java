package com.migratorx.checks;

import com.migratorx.workflow.Finding;
import java.util.List;

/**
 * Findings produced by one check.
 *
 * @param checkName name of the check
 * @param findings  findings after message enforcement
 */
public record CheckResult(String checkName, List<Finding> findings) {

    public CheckResult {
        findings = List.copyOf(findings);
    }
}
