package com.cohort.core.agent;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The immediate reply to a user message. Already persisted, with the real work queued
 * as {@code taskId}, by the time a caller sees it; streaming {@link #chunks()} any
 * number of times is safe.
 *
 * @param text      full acknowledgment text
 * @param taskId    task enqueued for the message
 * @param messageId conversation message holding the acknowledgment
 */
public record Acknowledgment(String text, String taskId, String messageId) {

    private static final Pattern WORD_WITH_TRAILING_SPACE = Pattern.compile("\\S+\\s*");

    /**
     * Splits the text into word-sized chunks whose concatenation is the text.
     */
    public List<String> chunks() {
        List<String> chunks = new ArrayList<>();
        Matcher matcher = WORD_WITH_TRAILING_SPACE.matcher(text);
        int end = 0;
        while (matcher.find()) {
            String chunk = matcher.group();
            if (chunks.isEmpty() && matcher.start() > 0) {
                chunk = text.substring(0, matcher.start()) + chunk;
            }
            chunks.add(chunk);
            end = matcher.end();
        }
        if (end < text.length()) {
            chunks.add(text.substring(end));
        }
        return chunks;
    }
}
