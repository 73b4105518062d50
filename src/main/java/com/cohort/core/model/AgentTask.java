package com.cohort.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One unit of queued work in an agent's private queue.
 *
 * @param id           unique identifier
 * @param owner        team or aide, same as the assigned agent's
 * @param assignedToId agent whose queue holds the task
 * @param assignedById agent that created it (the assignee itself for user/system/self tasks)
 * @param description  free-text task
 * @param result       result text, or the error text for a failed task
 * @param status       current status
 * @param source       origin of the task
 * @param priority     advisory ordering hint, higher first
 * @param createdAt    enqueue time
 * @param startedAt    claim time (nullable)
 * @param completedAt  terminal transition time (nullable)
 */
public record AgentTask(
    String id,
    Owner owner,
    String assignedToId,
    String assignedById,
    String description,
    String result,
    TaskStatus status,
    TaskSource source,
    int priority,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt
) implements Serializable {}
