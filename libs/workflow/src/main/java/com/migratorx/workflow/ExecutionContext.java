package com.migratorx.workflow;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellation and deadline signal threaded through every step, check, inspector and action call.
 *
 * <p>Cancellation is cooperative: components poll {@link #isCancelled()} at their own boundaries
 * (the workflow runner once per step). A context becomes cancelled either explicitly through
 * {@link #cancel(String)} or implicitly once its deadline has passed.
 */
public final class ExecutionContext {

    private final String runId;
    private final Instant deadline;
    private final Clock clock;
    private final AtomicReference<String> cancelReason = new AtomicReference<>();

    private ExecutionContext(String runId, Instant deadline, Clock clock) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId must not be null or blank");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.runId = runId;
        this.deadline = deadline;
        this.clock = clock;
    }

    /** A context with a random run id, no deadline and the system clock. */
    public static ExecutionContext create() {
        return new ExecutionContext(UUID.randomUUID().toString(), null, Clock.systemUTC());
    }

    /** A context with the given run id, no deadline and the system clock. */
    public static ExecutionContext create(String runId) {
        return new ExecutionContext(runId, null, Clock.systemUTC());
    }

    /**
     * A context that reports itself cancelled once {@code clock} passes {@code deadline}.
     */
    public static ExecutionContext withDeadline(String runId, Instant deadline, Clock clock) {
        if (deadline == null) {
            throw new IllegalArgumentException("deadline must not be null");
        }
        return new ExecutionContext(runId, deadline, clock);
    }

    /**
     * Requests cancellation. The first reason wins; later calls are ignored.
     */
    public void cancel(String reason) {
        cancelReason.compareAndSet(null, reason == null || reason.isBlank() ? "cancelled" : reason);
    }

    public boolean isCancelled() {
        return cancellationCause().isPresent();
    }

    /**
     * Returns why this context is cancelled, or empty while it is still live.
     */
    public Optional<String> cancellationCause() {
        String reason = cancelReason.get();
        if (reason != null) {
            return Optional.of(reason);
        }
        if (deadline != null && clock.instant().isAfter(deadline)) {
            return Optional.of("deadline exceeded at " + deadline);
        }
        return Optional.empty();
    }

    public String runId() {
        return runId;
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    public Clock clock() {
        return clock;
    }
}
