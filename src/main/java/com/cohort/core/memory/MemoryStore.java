package com.cohort.core.memory;

import com.cohort.core.llm.LlmService;
import com.cohort.core.model.Agent;
import com.cohort.core.model.Memory;
import com.cohort.core.persistence.MemoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * What an agent remembers about its user. Only ever loaded into foreground context.
 */
@Service
public class MemoryStore {

    private static final Logger log = LoggerFactory.getLogger(MemoryStore.class);

    static final String EXTRACTION_SYSTEM_PROMPT = """
            You extract lasting memories about the user from one exchange between the user and
            their assistant. Use:
            - preference: how the user likes things done or what they care about
            - insight: something the assistant learned about the user's situation or goals
            - fact: a concrete fact about the user
            Ignore small talk and anything that only matters for this one request. Return an
            empty list when nothing is worth remembering.
            """;

    private final MemoryRepository repository;
    private final LlmService llmService;
    private final Clock clock;

    public MemoryStore(MemoryRepository repository, LlmService llmService, Clock clock) {
        this.repository = repository;
        this.llmService = llmService;
        this.clock = clock;
    }

    public List<Memory> load(String agentId) {
        return repository.findByAgent(agentId);
    }

    /**
     * Extracts memories from a user message and the agent's reply and stores them.
     * LLM failures propagate to the caller.
     */
    public List<Memory> extractAndPersist(Agent agent, String userMessage, String reply, String sourceMessageId) {
        String userPrompt = "Assistant role: " + agent.role() + "\n\n"
                + "User: " + userMessage + "\n\n"
                + "Assistant: " + reply;
        ExtractedMemories extracted = llmService.structuredCall(EXTRACTION_SYSTEM_PROMPT, userPrompt,
                ExtractedMemories.class);

        List<Memory> stored = new ArrayList<>();
        for (ExtractedMemories.Item item : extracted.memories()) {
            if (item.type() == null || item.content() == null || item.content().isBlank()) {
                continue;
            }
            var memory = new Memory(UUID.randomUUID().toString(), agent.id(), item.type(), item.content().trim(),
                    sourceMessageId, clock.instant());
            repository.insert(memory);
            stored.add(memory);
        }
        log.debug("Stored {} memory(ies) for agent {}", stored.size(), agent.id());
        return stored;
    }

    public static String formatForPrompt(List<Memory> memories) {
        if (memories.isEmpty()) {
            return "(nothing yet)";
        }
        return memories.stream()
                .map(m -> "- [" + m.type().wireName() + "] " + m.content())
                .collect(Collectors.joining("\n"));
    }
}
