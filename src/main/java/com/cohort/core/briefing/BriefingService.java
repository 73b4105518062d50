package com.cohort.core.briefing;

import com.cohort.core.conversation.ConversationService;
import com.cohort.core.events.CohortEvent;
import com.cohort.core.events.EventBus;
import com.cohort.core.llm.LlmService;
import com.cohort.core.metrics.CohortMetrics;
import com.cohort.core.model.Agent;
import com.cohort.core.model.Briefing;
import com.cohort.core.model.ConversationMode;
import com.cohort.core.model.InboxItem;
import com.cohort.core.model.InboxItemType;
import com.cohort.core.model.MessageRole;
import com.cohort.core.model.Owner;
import com.cohort.core.model.ThreadMessage;
import com.cohort.core.persistence.BriefingRepository;
import com.cohort.core.persistence.OwnerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Briefings and feedback requests: the two ways an agent reaches its user outside a
 * direct reply.
 * <p>
 * A briefing is stored together with a summary-only inbox notification, and its full
 * text is appended to the agent's foreground conversation.
 */
@Service
public class BriefingService {

    private static final Logger log = LoggerFactory.getLogger(BriefingService.class);

    static final String DECISION_SYSTEM_PROMPT = """
            You decide whether a lead agent's work session produced something its user should be
            told about now. Brief only on findings that are new, specific and useful to the user:
            a notable change, a result they asked for, a risk or an opportunity. Routine progress,
            "nothing new" outcomes and minor updates do not warrant a briefing.
            When you brief, give a concise specific title, a one or two sentence summary for the
            notification, and the full message for the user.
            """;

    private final BriefingRepository briefings;
    private final OwnerRepository owners;
    private final ConversationService conversations;
    private final LlmService llmService;
    private final EventBus eventBus;
    private final CohortMetrics metrics;
    private final Clock clock;

    public BriefingService(BriefingRepository briefings, OwnerRepository owners,
                           ConversationService conversations, LlmService llmService,
                           EventBus eventBus, CohortMetrics metrics, Clock clock) {
        this.briefings = briefings;
        this.owners = owners;
        this.conversations = conversations;
        this.llmService = llmService;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Lets the classifier decide whether the thread is worth a briefing, and creates it if so.
     * <p>
     * A compaction summary counts as session output, so findings folded into it are still
     * considered. Subordinates, transcripts with neither assistant output nor a summary, a
     * negative decision and a failing classifier all return empty without writing anything.
     */
    public Optional<Briefing> decide(Agent agent, List<ThreadMessage> transcript) {
        if (!agent.isLead()) {
            return Optional.empty();
        }
        String sessionOutput = sessionOutput(transcript);
        if (sessionOutput.isBlank()) {
            log.debug("No session output for agent {}; skipping briefing", agent.id());
            return Optional.empty();
        }

        BriefingDecision decision;
        try {
            decision = llmService.structuredCall(DECISION_SYSTEM_PROMPT,
                    "Agent: " + agent.name() + " (" + agent.role() + ")\n\n" + sessionOutput,
                    BriefingDecision.class);
        } catch (RuntimeException e) {
            log.warn("Briefing decision failed for agent {}: {}", agent.id(), e.getMessage());
            return Optional.empty();
        }

        if (decision == null || !decision.isComplete()) {
            metrics.recordBriefingDecision(false);
            log.debug("Agent {} decided not to brief", agent.id());
            return Optional.empty();
        }
        Optional<Briefing> created = createBriefing(agent, decision.title(), decision.summary(),
                decision.fullMessage());
        metrics.recordBriefingDecision(created.isPresent());
        return created;
    }

    /**
     * Stores the briefing and its inbox notification atomically, then appends the full
     * message to the foreground conversation.
     *
     * @return empty if no user could be resolved for the agent's team or aide
     */
    public Optional<Briefing> createBriefing(Agent agent, String title, String summary, String fullMessage) {
        Optional<String> userId = owners.findUserId(agent.owner());
        if (userId.isEmpty()) {
            log.warn("No user found for {} {}; briefing dropped", agent.owner().table(), agent.owner().id());
            return Optional.empty();
        }
        Instant now = clock.instant();
        var briefing = new Briefing(UUID.randomUUID().toString(), userId.get(), agent.owner(), agent.id(),
                title, summary, fullMessage, now);
        var notification = new InboxItem(UUID.randomUUID().toString(), userId.get(), agent.id(), briefing.id(),
                InboxItemType.BRIEFING, title, summary, false, now);
        briefings.insertWithInboxItem(briefing, notification);
        conversations.append(agent.id(), ConversationMode.FOREGROUND, MessageRole.ASSISTANT, fullMessage);

        log.info("Agent {} created briefing {}: {}", agent.id(), briefing.id(), title);
        eventBus.publish(CohortEvent.of(CohortEvent.BRIEFING_CREATED, agent.id(), null,
                Map.of("briefingId", briefing.id(), "title", title)));
        return Optional.of(briefing);
    }

    /**
     * Asks the user for feedback: a summary-only inbox item plus the full message in the
     * foreground conversation.
     *
     * @return empty if no user could be resolved for the agent's team or aide
     */
    public Optional<InboxItem> requestUserInput(Agent agent, String title, String summary, String fullMessage) {
        Optional<String> userId = owners.findUserId(agent.owner());
        if (userId.isEmpty()) {
            return Optional.empty();
        }
        var item = new InboxItem(UUID.randomUUID().toString(), userId.get(), agent.id(), null,
                InboxItemType.FEEDBACK, title, summary, false, clock.instant());
        briefings.insertInboxItem(item);
        conversations.append(agent.id(), ConversationMode.FOREGROUND, MessageRole.ASSISTANT, fullMessage);
        log.info("Agent {} requested user input: {}", agent.id(), title);
        return Optional.of(item);
    }

    public List<Briefing> list(Owner owner, String search, int limit) {
        return briefings.findByOwner(owner, search, limit);
    }

    public Optional<Briefing> get(Owner owner, String briefingId) {
        return briefings.findById(owner, briefingId);
    }

    /**
     * Unread and read inbox items for a user, newest first.
     */
    public List<InboxItem> inbox(String userId) {
        return briefings.findInbox(userId);
    }

    /**
     * The compaction summary, if the thread was compacted, followed by the assistant messages.
     * Empty when neither exists.
     */
    static String sessionOutput(List<ThreadMessage> transcript) {
        String earlier = transcript.stream()
                .filter(m -> m.role() == MessageRole.SYSTEM)
                .map(ThreadMessage::content)
                .filter(c -> c != null && !c.isBlank())
                .collect(Collectors.joining("\n\n"));
        String assistantContent = transcript.stream()
                .filter(m -> m.role() == MessageRole.ASSISTANT)
                .map(ThreadMessage::content)
                .filter(c -> c != null && !c.isBlank())
                .collect(Collectors.joining("\n\n---\n\n"));

        StringBuilder out = new StringBuilder();
        if (!earlier.isEmpty()) {
            out.append("Summary of earlier work in this session:\n").append(earlier);
        }
        if (!assistantContent.isEmpty()) {
            if (out.length() > 0) {
                out.append("\n\n");
            }
            out.append("Session output:\n").append(assistantContent);
        }
        return out.toString();
    }
}
