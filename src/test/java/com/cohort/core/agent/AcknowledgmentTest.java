package com.cohort.core.agent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AcknowledgmentTest {

    private static Acknowledgment ack(String text) {
        return new Acknowledgment(text, "task-1", "msg-1");
    }

    @Test
    @DisplayName("chunks are words with their trailing whitespace")
    void wordChunks() {
        assertEquals(List.of("On ", "it, ", "looking ", "now."), ack("On it, looking now.").chunks());
    }

    @Test
    @DisplayName("chunks always concatenate back to the text")
    void concatenation() {
        for (String text : List.of("  leading space", "trailing  ", "multi\nline\n\ntext", "single")) {
            assertEquals(text, String.join("", ack(text).chunks()), text);
        }
    }

    @Test
    @DisplayName("whitespace-only and empty texts")
    void degenerate() {
        assertEquals(List.of(), ack("").chunks());
        assertEquals(List.of("   "), ack("   ").chunks());
    }

    @Test
    @DisplayName("chunks can be streamed repeatedly")
    void repeatable() {
        Acknowledgment ack = ack("Got it.");
        assertEquals(ack.chunks(), ack.chunks());
    }
}
