package com.cohort.core.tools;

import com.cohort.core.model.Agent;
import com.cohort.core.model.Owner;

/**
 * Who is calling a tool.
 */
public record ToolContext(String agentId, Owner owner, boolean isLead) {

    public static ToolContext of(Agent agent) {
        return new ToolContext(agent.id(), agent.owner(), agent.isLead());
    }
}
