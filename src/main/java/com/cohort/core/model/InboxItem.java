package com.cohort.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A user notification. Briefing notifications carry only the summary and link to the briefing.
 *
 * @param briefingId linked briefing (nullable)
 */
public record InboxItem(
    String id,
    String userId,
    String agentId,
    String briefingId,
    InboxItemType type,
    String title,
    String content,
    boolean read,
    Instant createdAt
) implements Serializable {}
