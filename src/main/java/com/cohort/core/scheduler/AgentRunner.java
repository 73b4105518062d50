package com.cohort.core.scheduler;

import com.cohort.core.agent.AgentNotFoundException;
import com.cohort.core.agent.AgentWorker;
import com.cohort.core.agent.WorkSessionException;
import com.cohort.core.agent.WorkSessionResult;
import com.cohort.core.events.CohortEvent;
import com.cohort.core.events.EventBus;
import com.cohort.core.model.QueueStatus;
import com.cohort.core.persistence.AgentRepository;
import com.cohort.core.queue.TaskQueue;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polling loop that decides which agents get a work session.
 * <p>
 * Each tick attends to the union of agents with open tasks, leads whose proactive run is
 * due, and agents woken by a {@value CohortEvent#TASK_QUEUED} event since the last tick.
 * Agents in backoff are left out of the first two groups. Decisions happen on one
 * scheduling thread; sessions run on a bounded pool. Whether a session actually runs is
 * decided by {@link AgentWorker}, which refuses to start a second one for the same agent.
 */
@Service
public class AgentRunner {

    private static final Logger log = LoggerFactory.getLogger(AgentRunner.class);

    private final AgentWorker worker;
    private final AgentRepository agents;
    private final TaskQueue taskQueue;
    private final BackoffPolicy backoffPolicy;
    private final StaleTaskJanitor janitor;
    private final EventBus eventBus;
    private final RunnerProperties properties;
    private final Clock clock;

    private final Set<String> wakeSignals = ConcurrentHashMap.newKeySet();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    private ScheduledExecutorService scheduler;
    private ExecutorService sessionPool;
    private EventBus.Subscription subscription;

    public AgentRunner(AgentWorker worker, AgentRepository agents, TaskQueue taskQueue,
                       BackoffPolicy backoffPolicy, StaleTaskJanitor janitor, EventBus eventBus,
                       RunnerProperties properties, Clock clock) {
        this.worker = worker;
        this.agents = agents;
        this.taskQueue = taskQueue;
        this.backoffPolicy = backoffPolicy;
        this.janitor = janitor;
        this.eventBus = eventBus;
        this.properties = properties;
        this.clock = clock;
        this.subscription = eventBus.subscribeAll(this::onEvent);
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cohort-runner");
            t.setDaemon(true);
            return t;
        });
        AtomicInteger sessionThreads = new AtomicInteger();
        sessionPool = Executors.newFixedThreadPool(properties.getMaxConcurrentSessions(), r -> {
            Thread t = new Thread(r, "cohort-session-" + sessionThreads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        long intervalMs = properties.getPollInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::tick, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Agent runner started (poll={}ms, maxConcurrentSessions={})",
                intervalMs, properties.getMaxConcurrentSessions());
    }

    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        sessionPool.shutdown();
        try {
            if (!sessionPool.awaitTermination(30, TimeUnit.SECONDS)) {
                sessionPool.shutdownNow();
            }
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            sessionPool.shutdownNow();
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        sessionPool = null;
        log.info("Agent runner stopped");
    }

    @PreDestroy
    void shutdown() {
        stop();
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
    }

    /**
     * Runs one full cycle on the calling thread: recovers stale tasks, computes the
     * attention set and runs each agent's session in turn.
     */
    public CycleReport runSingleCycle() {
        int requeued = janitor.requeueStaleTasks();
        Attention attention = computeAttention();
        Map<String, WorkSessionResult> results = new LinkedHashMap<>();
        Set<String> failed = new LinkedHashSet<>();
        for (String agentId : attention.agentIds()) {
            WorkSessionResult result = attend(agentId, attention.dueLeads().contains(agentId));
            if (result != null) {
                results.put(agentId, result);
            } else {
                failed.add(agentId);
            }
        }
        return new CycleReport(attention.agentIds(), results, failed, requeued);
    }

    /**
     * The agents the next cycle would attend to. Drains pending wake signals.
     */
    Attention computeAttention() {
        Instant now = clock.instant();
        Set<String> backedOff = agents.findBackedOff(now);

        Set<String> attended = new LinkedHashSet<>();
        for (String agentId : taskQueue.agentsWithOpenTasks()) {
            if (!backedOff.contains(agentId)) {
                attended.add(agentId);
            }
        }
        Set<String> dueLeads = new LinkedHashSet<>();
        for (String leadId : agents.findLeadsDueToRun(now)) {
            if (!backedOff.contains(leadId)) {
                dueLeads.add(leadId);
                attended.add(leadId);
            }
        }
        for (String agentId : List.copyOf(wakeSignals)) {
            wakeSignals.remove(agentId);
            attended.add(agentId);
        }
        return new Attention(attended, dueLeads);
    }

    private void tick() {
        try {
            janitor.requeueStaleTasks();
            Attention attention = computeAttention();
            if (!attention.agentIds().isEmpty()) {
                log.debug("Runner tick: {} agent(s) need attention", attention.agentIds().size());
            }
            for (String agentId : attention.agentIds()) {
                if (!inFlight.add(agentId)) {
                    continue;
                }
                boolean dueLead = attention.dueLeads().contains(agentId);
                sessionPool.execute(() -> {
                    try {
                        attend(agentId, dueLead);
                    } finally {
                        inFlight.remove(agentId);
                    }
                });
            }
        } catch (RuntimeException e) {
            log.error("Runner tick failed: {}", e.getMessage(), e);
        }
    }

    /**
     * @return the session result, or null if the session threw
     */
    private WorkSessionResult attend(String agentId, boolean dueLead) {
        try {
            if (dueLead) {
                QueueStatus queue = taskQueue.queueStatus(agentId);
                if (queue.pendingCount() == 0 && queue.inProgressCount() == 0) {
                    agents.findById(agentId).ifPresent(worker::enqueueProactiveReview);
                    wakeSignals.remove(agentId);
                }
            }
            WorkSessionResult result = worker.runWorkSession(agentId);
            backoffPolicy.onSessionResult(agentId, result);
            return result;
        } catch (AgentNotFoundException e) {
            log.info("Agent {} no longer exists", agentId);
            return null;
        } catch (WorkSessionException e) {
            backoffPolicy.onSessionFailure(agentId);
            return null;
        } catch (RuntimeException e) {
            log.error("Unexpected failure attending agent {}: {}", agentId, e.getMessage(), e);
            backoffPolicy.onSessionFailure(agentId);
            return null;
        }
    }

    private void onEvent(CohortEvent event) {
        if (CohortEvent.TASK_QUEUED.equals(event.eventType()) && event.agentId() != null) {
            wakeSignals.add(event.agentId());
        }
    }

    record Attention(Set<String> agentIds, Set<String> dueLeads) {}
}
