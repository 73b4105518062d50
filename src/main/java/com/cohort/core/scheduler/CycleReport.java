package com.cohort.core.scheduler;

import com.cohort.core.agent.WorkSessionResult;

import java.util.Map;
import java.util.Set;

/**
 * Outcome of one synchronous scheduler cycle.
 *
 * @param attended  agents that needed attention this cycle
 * @param results   session result per agent that returned normally
 * @param failed    agents whose session threw
 * @param requeued  stale tasks recovered before the cycle
 */
public record CycleReport(
    Set<String> attended,
    Map<String, WorkSessionResult> results,
    Set<String> failed,
    int requeued
) {}
