package com.cohort.core.agent;

import com.cohort.core.model.Agent;
import com.cohort.core.model.OwnerRecord;
import com.cohort.core.model.TaskSource;
import com.cohort.core.persistence.AgentRepository;
import com.cohort.core.persistence.OwnerRepository;
import com.cohort.core.queue.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Creates teams and aides together with their lead agent, and adds subordinates to a lead.
 * A new lead starts with a system task that gets it working on its mission.
 */
@Service
public class OwnerBootstrapService {

    private static final Logger log = LoggerFactory.getLogger(OwnerBootstrapService.class);

    private final OwnerRepository owners;
    private final AgentRepository agents;
    private final TaskQueue taskQueue;

    public OwnerBootstrapService(OwnerRepository owners, AgentRepository agents, TaskQueue taskQueue) {
        this.owners = owners;
        this.agents = agents;
        this.taskQueue = taskQueue;
    }

    public record Bootstrapped(OwnerRecord owner, Agent lead) {}

    public Bootstrapped createTeam(String userId, String name, String mission, String leadName, String leadRole) {
        return bootstrap(owners.createTeam(userId, name, mission), leadName, leadRole);
    }

    public Bootstrapped createAide(String userId, String name, String mission, String leadName, String leadRole) {
        return bootstrap(owners.createAide(userId, name, mission), leadName, leadRole);
    }

    /**
     * @throws AgentNotFoundException   if the lead does not exist
     * @throws IllegalArgumentException if {@code leadId} is itself a subordinate
     */
    public Agent addSubordinate(String leadId, String name, String role, String systemPrompt) {
        Agent lead = agents.findById(leadId).orElseThrow(() -> new AgentNotFoundException(leadId));
        if (!lead.isLead()) {
            throw new IllegalArgumentException("Agent " + leadId + " is not a lead");
        }
        Agent subordinate = agents.create(lead.owner(), lead.id(), name, role, systemPrompt);
        log.info("Added subordinate {} ({}) under lead {}", subordinate.name(), subordinate.id(), lead.id());
        return subordinate;
    }

    private Bootstrapped bootstrap(OwnerRecord owner, String leadName, String leadRole) {
        Agent lead = agents.create(owner.owner(), null, leadName, leadRole, null);
        String mission = owner.mission() == null || owner.mission().isBlank() ? owner.name() : owner.mission();
        taskQueue.enqueue(lead.id(), owner.owner(), AgentPrompts.bootstrap(mission), TaskSource.SYSTEM);
        log.info("Created {} {} with lead {}", owner.owner().table(), owner.owner().id(), lead.id());
        return new Bootstrapped(owner, lead);
    }
}
