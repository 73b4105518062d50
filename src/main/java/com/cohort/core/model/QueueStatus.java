package com.cohort.core.model;

import java.io.Serializable;

/**
 * Read-only snapshot of one agent's queue.
 */
public record QueueStatus(
    boolean hasPendingWork,
    int pendingCount,
    int inProgressCount
) implements Serializable {

    public static QueueStatus of(int pendingCount, int inProgressCount) {
        return new QueueStatus(pendingCount > 0, pendingCount, inProgressCount);
    }
}
