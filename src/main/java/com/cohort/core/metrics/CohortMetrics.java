package com.cohort.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Micrometer metrics for work sessions, tasks and briefings.
 */
@Service
public class CohortMetrics {

    private final MeterRegistry registry;

    public CohortMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSessionDuration(boolean lead, long ms) {
        Timer.builder("cohort.session.duration")
                .tag("role", lead ? "lead" : "subordinate")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param outcome "completed" or "failed"
     */
    public void recordTaskOutcome(String outcome) {
        Counter.builder("cohort.tasks.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordBriefingDecision(boolean briefed) {
        Counter.builder("cohort.briefing.decisions")
                .tag("result", briefed ? "briefed" : "skipped")
                .register(registry)
                .increment();
    }

    public void incrementBackoff() {
        Counter.builder("cohort.agent.backoffs")
                .description("Work sessions that pushed an agent into backoff")
                .register(registry)
                .increment();
    }

    public void incrementCompactions() {
        Counter.builder("cohort.thread.compactions")
                .description("Thread compactions performed")
                .register(registry)
                .increment();
    }

    public void incrementStaleTasksRequeued() {
        Counter.builder("cohort.tasks.stale_requeued")
                .description("In-progress tasks failed and re-enqueued after timing out")
                .register(registry)
                .increment();
    }
}
