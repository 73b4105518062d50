package com.cohort.core.model;

public enum ThreadStatus {
    ACTIVE,
    COMPLETED,
    COMPACTED
}
