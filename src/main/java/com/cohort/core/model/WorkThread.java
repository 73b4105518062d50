package com.cohort.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Scratchpad of one background work session. Never reused across sessions.
 */
public record WorkThread(
    String id,
    String agentId,
    ThreadStatus status,
    Instant createdAt,
    Instant completedAt
) implements Serializable {}
