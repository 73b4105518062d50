package com.cohort.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the queue, the work sessions and the briefing service.
 *
 * @param eventType event type (e.g. "task.queued", "session.completed", "briefing.created")
 * @param agentId   the agent this event belongs to
 * @param taskId    the task this event relates to (nullable for session-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record CohortEvent(
    String eventType,
    String agentId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String TASK_QUEUED = "task.queued";
    public static final String TASK_CLAIMED = "task.claimed";
    public static final String TASK_COMPLETED = "task.completed";
    public static final String TASK_FAILED = "task.failed";
    public static final String SESSION_STARTED = "session.started";
    public static final String SESSION_COMPLETED = "session.completed";
    public static final String BRIEFING_CREATED = "briefing.created";

    public static CohortEvent of(String eventType, String agentId, String taskId, Map<String, Object> payload) {
        return new CohortEvent(eventType, agentId, taskId, payload, Instant.now());
    }
}
