package com.cohort.core.knowledge;

import com.cohort.core.model.KnowledgeItemType;

import java.util.List;

/**
 * Structured output of the knowledge extraction call.
 */
public record ExtractedKnowledge(List<Item> items) {

    public ExtractedKnowledge {
        items = items == null ? List.of() : List.copyOf(items);
    }

    /**
     * @param confidence 0..1, may be omitted by the model
     */
    public record Item(KnowledgeItemType type, String content, Double confidence) {}
}
