package com.migratorx.checks;

import com.migratorx.workflow.ExecutionContext;
import com.migratorx.workflow.Finding;
import java.util.List;

/**
 * {@link Check} built from a name and a function.
 */
public final class ReadOnlyCheck implements Check {

    private final String name;
    private final CheckFunction function;

    public ReadOnlyCheck(String name, CheckFunction function) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (function == null) {
            throw new IllegalArgumentException("function must not be null");
        }
        this.name = name;
        this.function = function;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<Finding> run(ExecutionContext context, CheckInput input) throws Exception {
        return function.run(context, input);
    }

    @Override
    public boolean readOnly() {
        return true;
    }
}
