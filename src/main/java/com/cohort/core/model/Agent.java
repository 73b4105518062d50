package com.cohort.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * An autonomous worker belonging to a team or aide.
 *
 * @param id                  unique identifier
 * @param owner               owning team or aide
 * @param parentAgentId       lead of this agent; {@code null} for a lead
 * @param name                display name
 * @param role                short role description used in prompts
 * @param systemPrompt        base system prompt text (nullable, a default is derived from name and role)
 * @param status              run status
 * @param leadNextRunAt       next proactive run; only ever set for leads
 * @param backoffNextRunAt    agent is suppressed from scheduling until this time (nullable)
 * @param backoffAttemptCount consecutive failed sessions
 * @param createdAt           creation time
 */
public record Agent(
    String id,
    Owner owner,
    String parentAgentId,
    String name,
    String role,
    String systemPrompt,
    AgentStatus status,
    Instant leadNextRunAt,
    Instant backoffNextRunAt,
    int backoffAttemptCount,
    Instant createdAt
) implements Serializable {

    public boolean isLead() {
        return parentAgentId == null;
    }
}
