package com.cohort.core.knowledge;

import com.cohort.core.llm.LlmService;
import com.cohort.core.model.Agent;
import com.cohort.core.model.KnowledgeItem;
import com.cohort.core.model.KnowledgeItemType;
import com.cohort.core.model.ThreadMessage;
import com.cohort.core.persistence.KnowledgeItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Professional knowledge an agent carries from one work session to the next.
 * Only ever loaded into background context.
 */
@Service
public class KnowledgeStore {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeStore.class);

    static final String EXTRACTION_SYSTEM_PROMPT = """
            You distill durable professional knowledge from an agent's work transcript.
            Extract only knowledge worth keeping for future work:
            - fact: domain knowledge that stays true
            - technique: how to do something
            - pattern: an observed trend or regularity
            - lesson: something learned from success or failure
            Skip anything already listed as known, anything transient and anything about the
            user's personal preferences. Return an empty list when nothing qualifies.
            """;

    private final KnowledgeItemRepository repository;
    private final LlmService llmService;
    private final Clock clock;

    public KnowledgeStore(KnowledgeItemRepository repository, LlmService llmService, Clock clock) {
        this.repository = repository;
        this.llmService = llmService;
        this.clock = clock;
    }

    public List<KnowledgeItem> list(String agentId) {
        return repository.findByAgent(agentId);
    }

    /**
     * @param type  only items of this type; null for all
     * @param limit maximum number of items, newest kept
     */
    public List<KnowledgeItem> list(String agentId, KnowledgeItemType type, int limit) {
        List<KnowledgeItem> matching = repository.findByAgent(agentId).stream()
                .filter(item -> type == null || item.type() == type)
                .collect(Collectors.toList());
        return matching.subList(Math.max(0, matching.size() - limit), matching.size());
    }

    /**
     * @throws IllegalArgumentException for blank content or a confidence outside [0, 1]
     */
    public KnowledgeItem add(String agentId, KnowledgeItemType type, String content, Double confidence,
                             String sourceThreadId) {
        if (type == null) {
            throw new IllegalArgumentException("Knowledge item type is required");
        }
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Knowledge item content must not be blank");
        }
        if (confidence != null && (confidence < 0.0 || confidence > 1.0)) {
            throw new IllegalArgumentException("Confidence must be between 0 and 1, got " + confidence);
        }
        var item = new KnowledgeItem(UUID.randomUUID().toString(), agentId, type, content.trim(), confidence,
                sourceThreadId, clock.instant());
        repository.insert(item);
        return item;
    }

    public boolean remove(String agentId, String itemId) {
        return repository.delete(agentId, itemId);
    }

    /**
     * Asks the model for new knowledge in a finished thread and stores every valid item.
     * Invalid items are skipped. LLM failures propagate to the caller.
     */
    public List<KnowledgeItem> extractFromThread(Agent agent, String threadId, List<ThreadMessage> transcript) {
        if (transcript.isEmpty()) {
            return List.of();
        }
        List<KnowledgeItem> existing = repository.findByAgent(agent.id());
        String userPrompt = "Agent role: " + agent.role() + "\n\n"
                + "Already known:\n" + formatForPrompt(existing) + "\n\n"
                + "Transcript:\n" + formatTranscript(transcript);

        ExtractedKnowledge extracted = llmService.structuredCall(EXTRACTION_SYSTEM_PROMPT, userPrompt,
                ExtractedKnowledge.class);

        List<KnowledgeItem> stored = new ArrayList<>();
        for (ExtractedKnowledge.Item candidate : extracted.items()) {
            try {
                stored.add(add(agent.id(), candidate.type(), candidate.content(), candidate.confidence(), threadId));
            } catch (IllegalArgumentException e) {
                log.debug("Skipping extracted knowledge item: {}", e.getMessage());
            }
        }
        log.info("Extracted {} knowledge item(s) for agent {} from thread {}", stored.size(), agent.id(), threadId);
        return stored;
    }

    /**
     * Renders items as a bullet list for a system prompt.
     */
    public static String formatForPrompt(List<KnowledgeItem> items) {
        if (items.isEmpty()) {
            return "(none)";
        }
        return items.stream()
                .map(item -> "- [" + item.type().wireName() + "] " + item.content()
                        + (item.confidence() != null
                                ? String.format(Locale.ROOT, " (confidence %.2f)", item.confidence())
                                : ""))
                .collect(Collectors.joining("\n"));
    }

    static String formatTranscript(List<ThreadMessage> transcript) {
        return transcript.stream()
                .map(m -> m.role().name().toLowerCase() + ": " + m.content())
                .collect(Collectors.joining("\n\n"));
    }
}
