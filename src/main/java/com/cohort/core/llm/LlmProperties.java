package com.cohort.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Token budgets for the auxiliary LLM calls. The chat model itself is configured
 * under {@code spring.ai.openai}.
 */
@Component
@ConfigurationProperties(prefix = "cohort.llm")
public class LlmProperties {

    /** Budget for the one- or two-sentence acknowledgment of a user message. */
    private int acknowledgmentMaxTokens = 150;

    /** Budget for thread compaction summaries. */
    private int summaryMaxTokens = 1000;

    public int getAcknowledgmentMaxTokens() {
        return acknowledgmentMaxTokens;
    }

    public void setAcknowledgmentMaxTokens(int acknowledgmentMaxTokens) {
        this.acknowledgmentMaxTokens = acknowledgmentMaxTokens;
    }

    public int getSummaryMaxTokens() {
        return summaryMaxTokens;
    }

    public void setSummaryMaxTokens(int summaryMaxTokens) {
        this.summaryMaxTokens = summaryMaxTokens;
    }
}
