package com.cohort.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One turn inside a {@link WorkThread}.
 *
 * @param id             unique identifier
 * @param threadId       owning thread
 * @param role           speaker
 * @param content        message text
 * @param toolCalls      JSON array of tool calls made while producing this turn (nullable)
 * @param sequenceNumber 1-based, gapless position within the thread
 * @param createdAt      append time
 */
public record ThreadMessage(
    String id,
    String threadId,
    MessageRole role,
    String content,
    String toolCalls,
    int sequenceNumber,
    Instant createdAt
) implements Serializable {}
