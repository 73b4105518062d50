package com.cohort.core.memory;

import com.cohort.core.model.MemoryType;

import java.util.List;

/**
 * Structured output of the memory extraction call.
 */
public record ExtractedMemories(List<Item> memories) {

    public ExtractedMemories {
        memories = memories == null ? List.of() : List.copyOf(memories);
    }

    public record Item(MemoryType type, String content) {}
}
