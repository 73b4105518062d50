package com.cohort.core.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "cohort.agent")
public class AgentProperties {

    /** Model calls allowed per task, tool rounds included. */
    private int maxToolSteps = 10;

    /** Delay between proactive runs of a lead. */
    private Duration leadRerunInterval = Duration.ofHours(1);

    /** Subordinate reports and questions shown to a lead in background context. */
    private int backgroundConversationLimit = 10;

    /** Recent user conversation turns shown when acknowledging a message. */
    private int foregroundContextLimit = 10;

    public int getMaxToolSteps() {
        return maxToolSteps;
    }

    public void setMaxToolSteps(int maxToolSteps) {
        this.maxToolSteps = maxToolSteps;
    }

    public Duration getLeadRerunInterval() {
        return leadRerunInterval;
    }

    public void setLeadRerunInterval(Duration leadRerunInterval) {
        this.leadRerunInterval = leadRerunInterval;
    }

    public int getBackgroundConversationLimit() {
        return backgroundConversationLimit;
    }

    public void setBackgroundConversationLimit(int backgroundConversationLimit) {
        this.backgroundConversationLimit = backgroundConversationLimit;
    }

    public int getForegroundContextLimit() {
        return foregroundContextLimit;
    }

    public void setForegroundContextLimit(int foregroundContextLimit) {
        this.foregroundContextLimit = foregroundContextLimit;
    }
}
