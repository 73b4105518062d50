package com.cohort.core.model;

public enum InboxItemType {
    BRIEFING,
    FEEDBACK
}
