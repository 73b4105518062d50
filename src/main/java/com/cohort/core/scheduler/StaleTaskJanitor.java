package com.cohort.core.scheduler;

import com.cohort.core.metrics.CohortMetrics;
import com.cohort.core.model.AgentTask;
import com.cohort.core.persistence.TaskRepository;
import com.cohort.core.queue.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Recovers tasks left in progress by a session that died with the process.
 * <p>
 * Only tasks of idle agents are touched: a running agent may still be working on them.
 * A stale task is failed, keeping its state machine forward-only, and a fresh pending
 * copy is queued in its place.
 */
@Component
public class StaleTaskJanitor {

    private static final Logger log = LoggerFactory.getLogger(StaleTaskJanitor.class);

    private final TaskRepository tasks;
    private final TaskQueue taskQueue;
    private final RunnerProperties properties;
    private final CohortMetrics metrics;
    private final Clock clock;

    public StaleTaskJanitor(TaskRepository tasks, TaskQueue taskQueue, RunnerProperties properties,
                            CohortMetrics metrics, Clock clock) {
        this.tasks = tasks;
        this.taskQueue = taskQueue;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * @return number of tasks re-queued
     */
    public int requeueStaleTasks() {
        Instant cutoff = clock.instant().minus(properties.getStaleTaskTimeout());
        List<AgentTask> stale = tasks.findStaleInProgress(cutoff);
        int requeued = 0;
        for (AgentTask task : stale) {
            if (!taskQueue.fail(task.id(), "Abandoned: in progress since " + task.startedAt()
                    + " without a running session")) {
                continue;
            }
            AgentTask copy = taskQueue.enqueue(task.assignedToId(), task.owner(), task.description(), task.source(),
                    task.assignedById(), task.priority());
            log.warn("Re-queued stale task {} of agent {} as {}", task.id(), task.assignedToId(), copy.id());
            metrics.incrementStaleTasksRequeued();
            requeued++;
        }
        return requeued;
    }
}
