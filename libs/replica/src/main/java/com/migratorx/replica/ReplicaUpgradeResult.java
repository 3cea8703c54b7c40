package com.migratorx.replica;

import com.migratorx.workflow.Finding;
import com.migratorx.workflow.Summary;
import java.util.List;

/**
 * Outcome of one {@link ReplicaUpgradeOrchestrator} run.
 *
 * @param summary  counts over {@code findings}
 * @param findings findings in the order they were produced
 */
public record ReplicaUpgradeResult(Summary summary, List<Finding> findings) {

    public ReplicaUpgradeResult {
        findings = List.copyOf(findings);
    }

    static ReplicaUpgradeResult of(List<Finding> findings) {
        return new ReplicaUpgradeResult(Summary.of(findings), findings);
    }

    public boolean blocked() {
        return summary.hasBlock();
    }
}
