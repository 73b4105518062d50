package com.cohort.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * An opt-in, lead-authored summary of a work session pushed to the user.
 */
public record Briefing(
    String id,
    String userId,
    Owner owner,
    String agentId,
    String title,
    String summary,
    String content,
    Instant createdAt
) implements Serializable {}
