package com.migratorx.checks.testing;

import com.migratorx.checks.mysql.MySqlInspector;
import com.migratorx.workflow.ExecutionContext;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A controllable MySQL settings inspector. Reports the same values for every host.
 */
public final class InMemoryMySqlInspector implements MySqlInspector {

    private final AtomicReference<String> sqlMode = new AtomicReference<>("");
    private final AtomicReference<List<String>> features = new AtomicReference<>(List.of());
    private final AtomicReference<String> failure = new AtomicReference<>(null);

    @Override
    public String sqlMode(ExecutionContext context, String host) {
        throwIfFailing();
        return sqlMode.get();
    }

    @Override
    public List<String> deprecatedFeaturesUsed(ExecutionContext context, String host) {
        throwIfFailing();
        return features.get();
    }

    public InMemoryMySqlInspector withSqlMode(String mode) {
        sqlMode.set(mode);
        return this;
    }

    public InMemoryMySqlInspector withFeatures(String... used) {
        features.set(List.of(used));
        return this;
    }

    public InMemoryMySqlInspector failing(String message) {
        failure.set(message);
        return this;
    }

    private void throwIfFailing() {
        String message = failure.get();
        if (message != null) {
            throw new IllegalStateException(message);
        }
    }
}
