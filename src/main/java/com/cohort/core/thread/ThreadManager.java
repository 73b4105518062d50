package com.cohort.core.thread;

import com.cohort.core.model.MessageRole;
import com.cohort.core.model.ThreadMessage;
import com.cohort.core.model.WorkThread;
import com.cohort.core.persistence.ThreadRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Owns the background scratchpad of each work session. Message content, including
 * compaction summaries, is opaque here.
 */
@Service
public class ThreadManager {

    private static final Logger log = LoggerFactory.getLogger(ThreadManager.class);

    private final ThreadRepository threads;
    private final ThreadProperties properties;
    private final Clock clock;

    public ThreadManager(ThreadRepository threads, ThreadProperties properties, Clock clock) {
        this.threads = threads;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Creates a fresh active thread for a work session.
     *
     * @return the new thread id
     */
    public String startSession(String agentId) {
        WorkThread thread = threads.create(agentId, clock.instant());
        log.debug("Started thread {} for agent {}", thread.id(), agentId);
        return thread.id();
    }

    /**
     * Appends a message with the next sequence number.
     *
     * @param toolCalls JSON record of tool calls made for this turn, or null
     */
    public ThreadMessage append(String threadId, MessageRole role, String content, String toolCalls) {
        return threads.appendMessage(threadId, role, content, toolCalls, clock.instant());
    }

    public ThreadMessage append(String threadId, MessageRole role, String content) {
        return append(threadId, role, content, null);
    }

    /**
     * The thread's messages in sequence order; after a compaction the summary comes first.
     */
    public List<ThreadMessage> buildContext(String threadId) {
        return threads.findMessages(threadId);
    }

    public boolean shouldCompact(String threadId, int threshold) {
        return threads.countMessages(threadId) > threshold;
    }

    public boolean shouldCompact(String threadId) {
        return shouldCompact(threadId, properties.getCompactionThreshold());
    }

    /**
     * Replaces all but the newest messages with {@code summary}. The thread stays open for appends.
     */
    public void compactWithSummary(String threadId, String summary) {
        int removed = threads.compact(threadId, summary, properties.getKeepRecentMessages(), clock.instant());
        log.info("Compacted thread {}: {} message(s) folded into a summary", threadId, removed);
    }

    /**
     * Marks the thread completed. Calling it again leaves the first completion time in place.
     */
    public void endSession(String threadId) {
        if (!threads.complete(threadId, clock.instant())) {
            log.debug("Thread {} already completed", threadId);
        }
    }
}
