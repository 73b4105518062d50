package com.cohort.core.model;

/**
 * Where a task came from.
 */
public enum TaskSource {
    /** Pushed by a lead onto one of its subordinates. */
    DELEGATION,
    /** Created from a user message in the foreground. */
    USER,
    /** Created by the platform (bootstrap, proactive runs, requeues). */
    SYSTEM,
    /** Assigned by the agent to itself. */
    SELF
}
