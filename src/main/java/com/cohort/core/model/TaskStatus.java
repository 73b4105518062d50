package com.cohort.core.model;

/**
 * Status of a queued task. Transitions only move forward:
 * {@code PENDING -> IN_PROGRESS -> COMPLETED | FAILED}.
 */
public enum TaskStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
