package com.cohort.core.thread;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ThreadPropertiesTest {

    private static ThreadProperties properties(int threshold, int keepRecent) {
        ThreadProperties properties = new ThreadProperties();
        properties.setCompactionThreshold(threshold);
        properties.setKeepRecentMessages(keepRecent);
        return properties;
    }

    @Test
    @DisplayName("defaults are valid")
    void defaults() {
        ThreadProperties properties = new ThreadProperties();

        assertDoesNotThrow(properties::validate);
        assertEquals(50, properties.getCompactionThreshold());
        assertEquals(4, properties.getKeepRecentMessages());
    }

    @Test
    @DisplayName("keeping one message less than the threshold is the largest valid setting")
    void largestKeep() {
        assertDoesNotThrow(properties(5, 4)::validate);
    }

    @Test
    @DisplayName("keeping as many messages as the threshold is rejected")
    void keepEqualToThreshold() {
        IllegalStateException e = assertThrows(IllegalStateException.class, properties(4, 4)::validate);
        assertTrue(e.getMessage().contains("keep-recent-messages (4)"));
    }

    @Test
    @DisplayName("a threshold below the kept messages is rejected")
    void thresholdBelowKeep() {
        assertThrows(IllegalStateException.class, properties(1, 4)::validate);
    }

    @Test
    @DisplayName("non-positive thresholds and negative keep counts are rejected")
    void outOfRange() {
        assertThrows(IllegalStateException.class, properties(0, 0)::validate);
        assertThrows(IllegalStateException.class, properties(10, -1)::validate);
    }
}
