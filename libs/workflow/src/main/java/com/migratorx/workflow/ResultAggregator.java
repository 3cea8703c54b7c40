package com.migratorx.workflow;

import java.util.Collection;

/**
 * Collects findings and decides whether progression may continue.
 *
 * <p>Once a BLOCK has been observed the aggregator stays blocked.
 */
public final class ResultAggregator {

    private Summary summary = Summary.EMPTY;
    private boolean blocked;

    /**
     * Records a batch of findings.
     *
     * @return true if progression may continue
     */
    public boolean addFindings(Collection<Finding> findings) {
        for (Finding finding : findings) {
            summary = summary.add(finding.severity());
            if (finding.severity().isHalting()) {
                blocked = true;
            }
        }
        return !blocked;
    }

    public Summary summary() {
        return summary;
    }

    public boolean blocked() {
        return blocked;
    }
}
