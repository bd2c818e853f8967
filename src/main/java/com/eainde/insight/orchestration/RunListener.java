package com.eainde.insight.orchestration;

/**
 * Receives every task status change of a run, e.g. to drive a progress display.
 * Analysis updates arrive on worker threads, so implementations must be thread-safe.
 */
@FunctionalInterface
public interface RunListener {

    RunListener NO_OP = result -> { };

    void onTaskUpdate(TaskResult<?> result);
}
