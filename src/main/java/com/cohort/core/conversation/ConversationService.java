package com.cohort.core.conversation;

import com.cohort.core.model.ConversationMessage;
import com.cohort.core.model.ConversationMode;
import com.cohort.core.model.MessageRole;
import com.cohort.core.persistence.ConversationRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * The durable conversations of an agent: {@link ConversationMode#FOREGROUND} with its
 * user, {@link ConversationMode#BACKGROUND} with its subordinates.
 */
@Service
public class ConversationService {

    private final ConversationRepository repository;
    private final Clock clock;

    public ConversationService(ConversationRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public ConversationMessage append(String agentId, ConversationMode mode, MessageRole role, String content) {
        String conversationId = repository.getOrCreate(agentId, mode, clock.instant());
        return repository.append(conversationId, role, content, clock.instant());
    }

    /** The newest {@code limit} messages, oldest first. */
    public List<ConversationMessage> recent(String agentId, ConversationMode mode, int limit) {
        String conversationId = repository.getOrCreate(agentId, mode, clock.instant());
        return repository.findRecent(conversationId, limit);
    }
}
