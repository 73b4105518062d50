package com.cohort.core.model;

import java.io.Serializable;
import java.time.Instant;

public record Memory(
    String id,
    String agentId,
    MemoryType type,
    String content,
    String sourceMessageId,
    Instant createdAt
) implements Serializable {}
