package com.cohort.core.model;

import java.io.Serializable;
import java.time.Instant;

public record ConversationMessage(
    String id,
    String conversationId,
    MessageRole role,
    String content,
    Instant createdAt
) implements Serializable {}
