package com.cohort.core.model;

public enum MessageRole {
    USER,
    ASSISTANT,
    SYSTEM
}
