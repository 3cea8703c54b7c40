package com.migratorx.checks;

import com.migratorx.workflow.ExecutionContext;
import com.migratorx.workflow.Finding;
import java.util.List;

/**
 * Body of a lambda-backed {@link ReadOnlyCheck}.
 */
@FunctionalInterface
public interface CheckFunction {

    List<Finding> run(ExecutionContext context, CheckInput input) throws Exception;
}
