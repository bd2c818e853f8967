package com.eainde.insight.orchestration;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of one task's state. Every transition returns a new snapshot; illegal
 * transitions (anything out of a terminal state, skipping a running task) throw
 * {@link IllegalStateException}.
 *
 * @param <T> payload type of a successful task
 */
public final class TaskResult<T> {

    private final String name;
    private final TaskStatus status;
    private final T payload;
    private final String error;
    private final Instant startedAt;
    private final Duration elapsed;
    private final Clock clock;

    private TaskResult(String name, TaskStatus status, T payload, String error,
                       Instant startedAt, Duration elapsed, Clock clock) {
        this.name = name;
        this.status = status;
        this.payload = payload;
        this.error = error;
        this.startedAt = startedAt;
        this.elapsed = elapsed;
        this.clock = clock;
    }

    public static <T> TaskResult<T> pending(String name) {
        return pending(name, Clock.systemUTC());
    }

    static <T> TaskResult<T> pending(String name, Clock clock) {
        return new TaskResult<>(Objects.requireNonNull(name, "name"), TaskStatus.PENDING,
                null, null, null, Duration.ZERO, clock);
    }

    // =========================================================================
    //  Transitions
    // =========================================================================

    public TaskResult<T> start() {
        require(TaskStatus.PENDING, TaskStatus.RUNNING);
        return new TaskResult<>(name, TaskStatus.RUNNING, null, null, clock.instant(), Duration.ZERO, clock);
    }

    public TaskResult<T> succeed(T payload) {
        require(TaskStatus.RUNNING, TaskStatus.SUCCEEDED);
        return new TaskResult<>(name, TaskStatus.SUCCEEDED, payload, null, startedAt, sinceStart(), clock);
    }

    public TaskResult<T> fail(String error) {
        require(TaskStatus.RUNNING, TaskStatus.FAILED);
        return new TaskResult<>(name, TaskStatus.FAILED, null, error, startedAt, sinceStart(), clock);
    }

    public TaskResult<T> fail(Throwable error) {
        return fail(error.getClass().getSimpleName() + ": " + error.getMessage());
    }

    public TaskResult<T> skip(String reason) {
        require(TaskStatus.PENDING, TaskStatus.SKIPPED);
        return new TaskResult<>(name, TaskStatus.SKIPPED, null, reason, null, Duration.ZERO, clock);
    }

    private void require(TaskStatus expected, TaskStatus target) {
        if (status != expected) {
            throw new IllegalStateException(
                    "Task '" + name + "' cannot move from " + status + " to " + target);
        }
    }

    private Duration sinceStart() {
        return Duration.between(startedAt, clock.instant());
    }

    // =========================================================================
    //  Accessors
    // =========================================================================

    public String getName() {
        return name;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public Optional<T> getPayload() {
        return Optional.ofNullable(payload);
    }

    /** Failure detail for FAILED, reason for SKIPPED; empty otherwise. */
    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public Optional<Instant> getStartedAt() {
        return Optional.ofNullable(startedAt);
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public boolean isSucceeded() {
        return status == TaskStatus.SUCCEEDED;
    }

    @Override
    public String toString() {
        return name + "=" + status + (error != null ? " (" + error + ")" : "")
                + (status.isTerminal() && status != TaskStatus.SKIPPED ? " in " + elapsed.toMillis() + "ms" : "");
    }
}
