package com.migratorx.observability;

import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.MDC;

/**
 * Thread-local holder for {@link MigrationRunContext} with SLF4J MDC bridge.
 * <p>
 * Setting a context populates the {@code runId}, {@code migration}, {@code command} and
 * {@code target} MDC keys; clearing removes them. Null fields are removed from MDC rather than
 * written as empty values.
 */
public final class MigrationRunContextHolder {

    private static final ThreadLocal<MigrationRunContext> CONTEXT = new ThreadLocal<>();

    private MigrationRunContextHolder() {
        // utility class
    }

    /**
     * Sets the run context for the current thread and populates MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(MigrationRunContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        putOrRemove(MigrationRunContext.MDC_RUN_ID, context.runId());
        putOrRemove(MigrationRunContext.MDC_MIGRATION, context.migration());
        putOrRemove(MigrationRunContext.MDC_COMMAND, context.command());
        putOrRemove(MigrationRunContext.MDC_TARGET, context.target());
    }

    public static Optional<MigrationRunContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static void clear() {
        CONTEXT.remove();
        MDC.remove(MigrationRunContext.MDC_RUN_ID);
        MDC.remove(MigrationRunContext.MDC_MIGRATION);
        MDC.remove(MigrationRunContext.MDC_COMMAND);
        MDC.remove(MigrationRunContext.MDC_TARGET);
    }

    /**
     * Runs {@code work} with {@code context} installed, then restores whatever was set before.
     */
    public static void runWithContext(MigrationRunContext context, Runnable work) {
        callWithContext(context, () -> {
            work.run();
            return null;
        });
    }

    /**
     * Like {@link #runWithContext} but returns the supplier's value.
     */
    public static <T> T callWithContext(MigrationRunContext context, Supplier<T> work) {
        MigrationRunContext previous = CONTEXT.get();
        try {
            set(context);
            return work.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void putOrRemove(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
