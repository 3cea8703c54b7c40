package com.migratorx.workflow;

import java.util.Collection;

/**
 * Counts of findings by severity.
 *
 * <p>Aggregation is purely additive, so folding findings in any order or grouping yields the same
 * totals.
 *
 * @param info  number of INFO findings
 * @param warn  number of WARN findings
 * @param block number of BLOCK findings
 */
public record Summary(int info, int warn, int block) {

    /** The empty summary. */
    public static final Summary EMPTY = new Summary(0, 0, 0);

    public Summary {
        if (info < 0 || warn < 0 || block < 0) {
            throw new IllegalArgumentException("counts must not be negative");
        }
    }

    /** Summarises a batch of findings. */
    public static Summary of(Collection<Finding> findings) {
        Summary summary = EMPTY;
        for (Finding finding : findings) {
            summary = summary.add(finding.severity());
        }
        return summary;
    }

    /** Returns a summary with one more finding of the given severity. */
    public Summary add(Severity severity) {
        return switch (severity) {
            case INFO -> new Summary(info + 1, warn, block);
            case WARN -> new Summary(info, warn + 1, block);
            case BLOCK -> new Summary(info, warn, block + 1);
        };
    }

    /** Returns the element-wise sum of both summaries. */
    public Summary plus(Summary other) {
        return new Summary(info + other.info, warn + other.warn, block + other.block);
    }

    /** Returns the count for a single severity. */
    public int count(Severity severity) {
        return switch (severity) {
            case INFO -> info;
            case WARN -> warn;
            case BLOCK -> block;
        };
    }

    public boolean hasBlock() {
        return block > 0;
    }

    /** True when there is neither a WARN nor a BLOCK. */
    public boolean isClean() {
        return warn == 0 && block == 0;
    }

    public int total() {
        return info + warn + block;
    }

    @Override
    public String toString() {
        return String.format("Summary: %d INFO / %d WARN / %d BLOCK", info, warn, block);
    }
}
