package com.cohort.core.model;

/**
 * Lifecycle status of a team or aide. Only {@link #ACTIVE} owners get proactive lead runs.
 */
public enum OwnerStatus {
    ACTIVE,
    PAUSED,
    ARCHIVED
}
