package com.cohort.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A durable learning loaded into background context.
 *
 * @param confidence     0..1, nullable
 * @param sourceThreadId thread it was distilled from; nulled if that thread is removed
 */
public record KnowledgeItem(
    String id,
    String agentId,
    KnowledgeItemType type,
    String content,
    Double confidence,
    String sourceThreadId,
    Instant createdAt
) implements Serializable {}
