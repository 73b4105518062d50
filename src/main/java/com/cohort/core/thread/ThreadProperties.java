package com.cohort.core.thread;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "cohort.thread")
public class ThreadProperties {

    /** Message count above which a thread is compacted. */
    private int compactionThreshold = 50;

    /** Newest messages that survive a compaction verbatim. */
    private int keepRecentMessages = 4;

    /**
     * A compacted thread holds the summary plus the kept messages, which must stay at or
     * below the threshold or every append would trigger another compaction.
     */
    @PostConstruct
    public void validate() {
        if (compactionThreshold < 1) {
            throw new IllegalStateException(
                    "cohort.thread.compaction-threshold must be positive, was " + compactionThreshold);
        }
        if (keepRecentMessages < 0 || keepRecentMessages >= compactionThreshold) {
            throw new IllegalStateException("cohort.thread.keep-recent-messages (" + keepRecentMessages
                    + ") must be between 0 and cohort.thread.compaction-threshold (" + compactionThreshold
                    + "), exclusive");
        }
    }

    public int getCompactionThreshold() {
        return compactionThreshold;
    }

    public void setCompactionThreshold(int compactionThreshold) {
        this.compactionThreshold = compactionThreshold;
    }

    public int getKeepRecentMessages() {
        return keepRecentMessages;
    }

    public void setKeepRecentMessages(int keepRecentMessages) {
        this.keepRecentMessages = keepRecentMessages;
    }
}
