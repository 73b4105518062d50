package com.cohort.core.model;

/**
 * Run status of an agent. {@code IDLE -> RUNNING -> IDLE} brackets exactly one work session.
 */
public enum AgentStatus {
    IDLE,
    RUNNING,
    PAUSED
}
