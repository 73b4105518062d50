package com.cohort.core.briefing;

/**
 * Structured output of the "is this worth telling the user?" classifier.
 *
 * @param shouldBrief whether the session produced something the user should hear about
 * @param title       concise, specific title (required when shouldBrief)
 * @param summary     one or two sentences for the inbox notification
 * @param fullMessage complete briefing text appended to the user conversation
 */
public record BriefingDecision(
    boolean shouldBrief,
    String title,
    String summary,
    String fullMessage
) {

    public boolean isComplete() {
        return shouldBrief && notBlank(title) && notBlank(summary) && notBlank(fullMessage);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
