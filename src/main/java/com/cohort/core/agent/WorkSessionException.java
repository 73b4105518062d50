package com.cohort.core.agent;

/**
 * A work session aborted outside per-task processing. The agent has already been set
 * back to idle when this reaches the caller; its queue is left as it was.
 */
public class WorkSessionException extends RuntimeException {

    private final String agentId;

    public WorkSessionException(String agentId, Throwable cause) {
        super("Work session failed for agent " + agentId + ": " + cause.getMessage(), cause);
        this.agentId = agentId;
    }

    public String getAgentId() {
        return agentId;
    }
}
