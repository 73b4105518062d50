package com.cohort.core.agent;

/**
 * What one call to {@link AgentWorker#runWorkSession(String)} did.
 *
 * @param outcome        whether a session ran
 * @param threadId       the session's thread, null unless it ran
 * @param completedCount tasks processed without error
 * @param failedCount    tasks that failed during processing
 * @param briefingId     briefing created at the end of the session, or null
 */
public record WorkSessionResult(
    Outcome outcome,
    String threadId,
    int completedCount,
    int failedCount,
    String briefingId
) {

    public enum Outcome {
        /** Queue was empty; nothing was touched. */
        NO_WORK,
        /** Agent was not idle: another session holds it or it is paused. */
        ALREADY_RUNNING,
        COMPLETED
    }

    public static WorkSessionResult noWork() {
        return new WorkSessionResult(Outcome.NO_WORK, null, 0, 0, null);
    }

    public static WorkSessionResult alreadyRunning() {
        return new WorkSessionResult(Outcome.ALREADY_RUNNING, null, 0, 0, null);
    }

    public boolean ran() {
        return outcome == Outcome.COMPLETED;
    }
}
