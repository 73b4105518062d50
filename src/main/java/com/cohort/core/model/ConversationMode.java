package com.cohort.core.model;

/**
 * Each agent has one durable conversation per mode.
 */
public enum ConversationMode {
    /** User-facing chat history. */
    FOREGROUND,
    /** Inbound messages from subordinates, read by the lead during work sessions. */
    BACKGROUND
}
