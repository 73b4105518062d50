package com.cohort.core.scheduler;

import com.cohort.core.agent.WorkSessionResult;
import com.cohort.core.metrics.CohortMetrics;
import com.cohort.core.model.Agent;
import com.cohort.core.persistence.AgentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Exponential backoff for agents whose sessions keep failing.
 * <p>
 * A session that throws, or that ran without completing a single task (all failed, or
 * none could be claimed), counts as a failed attempt and suppresses the agent for {@code base * 2^(attempt-1)}, capped at
 * {@code max}. Any session that completes a task resets the count.
 */
@Component
public class BackoffPolicy {

    private static final Logger log = LoggerFactory.getLogger(BackoffPolicy.class);

    private final AgentRepository agents;
    private final RunnerProperties properties;
    private final CohortMetrics metrics;
    private final Clock clock;

    public BackoffPolicy(AgentRepository agents, RunnerProperties properties, CohortMetrics metrics, Clock clock) {
        this.agents = agents;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    public Duration delayFor(int attempt) {
        Duration base = properties.getBackoffBase();
        Duration max = properties.getBackoffMax();
        if (attempt <= 1) {
            return base.compareTo(max) < 0 ? base : max;
        }
        int shift = Math.min(attempt - 1, 30);
        Duration delay = base.multipliedBy(1L << shift);
        return delay.compareTo(max) < 0 ? delay : max;
    }

    /**
     * Updates the agent's backoff state after a session that ran.
     */
    public void onSessionResult(String agentId, WorkSessionResult result) {
        if (!result.ran()) {
            return;
        }
        if (result.completedCount() > 0) {
            agents.clearBackoff(agentId);
        } else {
            recordFailure(agentId);
        }
    }

    public void onSessionFailure(String agentId) {
        recordFailure(agentId);
    }

    private void recordFailure(String agentId) {
        int attempt = agents.findById(agentId).map(Agent::backoffAttemptCount).orElse(0) + 1;
        Duration delay = delayFor(attempt);
        Instant nextRunAt = clock.instant().plus(delay);
        agents.recordBackoff(agentId, attempt, nextRunAt);
        metrics.incrementBackoff();
        log.warn("Agent {} backing off for {} (attempt {})", agentId, delay, attempt);
    }
}
