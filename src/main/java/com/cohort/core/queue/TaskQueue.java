package com.cohort.core.queue;

import com.cohort.core.events.CohortEvent;
import com.cohort.core.events.EventBus;
import com.cohort.core.model.AgentTask;
import com.cohort.core.model.Owner;
import com.cohort.core.model.QueueStatus;
import com.cohort.core.model.TaskSource;
import com.cohort.core.model.TaskStatus;
import com.cohort.core.persistence.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Per-agent durable FIFO of tasks.
 * <p>
 * Claiming is atomic at the storage layer and an agent never holds more than one
 * in-progress task. New work is announced with a {@value CohortEvent#TASK_QUEUED} event
 * so the scheduler can wake the assignee without this class knowing about it.
 */
@Service
public class TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(TaskQueue.class);

    private final TaskRepository tasks;
    private final EventBus eventBus;
    private final Clock clock;

    public TaskQueue(TaskRepository tasks, EventBus eventBus, Clock clock) {
        this.tasks = tasks;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * Enqueues a task the agent assigns to itself (user, system or self source).
     */
    public AgentTask enqueue(String agentId, Owner owner, String description, TaskSource source) {
        return enqueue(agentId, owner, description, source, agentId, 0);
    }

    public AgentTask enqueue(String agentId, Owner owner, String description, TaskSource source,
                             String assignedById, int priority) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Task description must not be blank");
        }
        var task = new AgentTask(UUID.randomUUID().toString(), owner, agentId, assignedById, description,
                null, TaskStatus.PENDING, source, priority, clock.instant(), null, null);
        tasks.insert(task);
        log.info("Queued {} task {} for agent {} (priority {})", source.name().toLowerCase(), task.id(),
                agentId, priority);
        eventBus.publish(CohortEvent.of(CohortEvent.TASK_QUEUED, agentId, task.id(),
                Map.of("source", source.name().toLowerCase(), "assignedById", assignedById)));
        return task;
    }

    /**
     * Claims the next pending task: highest priority first, then oldest.
     *
     * @return empty when the queue is empty, another caller won the race, or the
     *         agent already has a task in progress
     */
    public Optional<AgentTask> claimNext(String agentId) {
        Optional<AgentTask> claimed = tasks.claimNext(agentId, clock.instant());
        claimed.ifPresent(task -> {
            log.debug("Agent {} claimed task {}", agentId, task.id());
            eventBus.publish(CohortEvent.of(CohortEvent.TASK_CLAIMED, agentId, task.id(), Map.of()));
        });
        return claimed;
    }

    /**
     * @return false, with nothing written, unless the task was in progress
     */
    public boolean completeWithResult(String taskId, String result) {
        return finish(taskId, TaskStatus.COMPLETED, result, CohortEvent.TASK_COMPLETED);
    }

    /**
     * @return false, with nothing written, unless the task was in progress
     */
    public boolean fail(String taskId, String error) {
        return finish(taskId, TaskStatus.FAILED, error, CohortEvent.TASK_FAILED);
    }

    public QueueStatus queueStatus(String agentId) {
        return tasks.queueStatus(agentId);
    }

    /**
     * Agents with at least one pending or in-progress task.
     */
    public Set<String> agentsWithOpenTasks() {
        return tasks.findAgentIdsWithOpenTasks();
    }

    public Optional<AgentTask> mostRecentInProgress(String agentId) {
        return tasks.findMostRecentInProgress(agentId);
    }

    /** Newest first. */
    public List<AgentTask> listTasks(String agentId, int limit) {
        return tasks.findByAgent(agentId, limit);
    }

    private boolean finish(String taskId, TaskStatus terminal, String result, String eventType) {
        Optional<AgentTask> task = tasks.findById(taskId);
        if (task.isEmpty()) {
            log.debug("Ignoring {} for unknown task {}", terminal, taskId);
            return false;
        }
        if (!tasks.finish(taskId, terminal, result, clock.instant())) {
            log.debug("Ignoring {} for task {}: not in progress", terminal, taskId);
            return false;
        }
        String agentId = task.get().assignedToId();
        log.info("Task {} for agent {} {}", taskId, agentId, terminal.name().toLowerCase());
        eventBus.publish(CohortEvent.of(eventType, agentId, taskId, Map.of()));
        return true;
    }
}
