package com.cohort.dispatch.api;

/**
 * Request body for POST /api/v1/agents/{id}/messages.
 */
public record MessageRequest(String content) {}
