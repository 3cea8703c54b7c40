package com.migratorx.checks;

import com.migratorx.workflow.ExecutionContext;
import com.migratorx.workflow.Finding;
import java.util.List;

/**
 * A read-only validation that emits findings.
 *
 * <p>Operational problems (an unreachable inspector, a detected divergence) should be returned as
 * findings. A thrown exception is converted by {@link ChecksRunner} into a single BLOCK tagged
 * with the check's name.
 */
public interface Check {

    /** Stable name, used for required-check matching and finding tags. */
    String name();

    List<Finding> run(ExecutionContext context, CheckInput input) throws Exception;

    /** Must return true; {@link ChecksRunner} refuses to run anything otherwise. */
    boolean readOnly();
}
