package com.eainde.insight.orchestration;

/**
 * Lifecycle of a task: {@code PENDING → RUNNING → SUCCEEDED | FAILED}, or
 * {@code PENDING → SKIPPED}. Terminal states never change.
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }
}
