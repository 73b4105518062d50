package com.cohort.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of professional knowledge an agent keeps across sessions.
 */
public enum KnowledgeItemType {
    FACT,
    TECHNIQUE,
    PATTERN,
    LESSON;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static KnowledgeItemType fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
