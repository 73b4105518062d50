package com.cohort.core.agent;

import com.cohort.core.briefing.BriefingService;
import com.cohort.core.conversation.ConversationService;
import com.cohort.core.events.CohortEvent;
import com.cohort.core.events.EventBus;
import com.cohort.core.knowledge.KnowledgeStore;
import com.cohort.core.llm.LlmProperties;
import com.cohort.core.llm.LlmResponse;
import com.cohort.core.llm.LlmService;
import com.cohort.core.logging.MdcContext;
import com.cohort.core.memory.MemoryStore;
import com.cohort.core.metrics.CohortMetrics;
import com.cohort.core.model.Agent;
import com.cohort.core.model.AgentTask;
import com.cohort.core.model.Briefing;
import com.cohort.core.model.ConversationMessage;
import com.cohort.core.model.ConversationMode;
import com.cohort.core.model.KnowledgeItem;
import com.cohort.core.model.Memory;
import com.cohort.core.model.MessageRole;
import com.cohort.core.model.TaskSource;
import com.cohort.core.model.ThreadMessage;
import com.cohort.core.persistence.AgentRepository;
import com.cohort.core.queue.TaskQueue;
import com.cohort.core.thread.ThreadManager;
import com.cohort.core.tools.AgentToolCallbacks;
import com.cohort.core.tools.ToolContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs an agent: replies to its user in the foreground and works through its task
 * queue in background work sessions.
 * <p>
 * A work session holds the agent's {@code running} status for its whole duration. The
 * status is taken with a compare-and-set and always released, so sessions for one agent
 * never overlap no matter how often they are requested.
 */
@Service
public class AgentWorker {

    private static final Logger log = LoggerFactory.getLogger(AgentWorker.class);

    private final AgentRepository agents;
    private final TaskQueue taskQueue;
    private final ThreadManager threadManager;
    private final KnowledgeStore knowledgeStore;
    private final MemoryStore memoryStore;
    private final ConversationService conversations;
    private final BriefingService briefingService;
    private final LlmService llmService;
    private final AgentToolCallbacks toolCallbacks;
    private final AgentProperties properties;
    private final LlmProperties llmProperties;
    private final EventBus eventBus;
    private final CohortMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Executor backgroundExecutor;

    public AgentWorker(AgentRepository agents, TaskQueue taskQueue, ThreadManager threadManager,
                       KnowledgeStore knowledgeStore, MemoryStore memoryStore, ConversationService conversations,
                       BriefingService briefingService, LlmService llmService, AgentToolCallbacks toolCallbacks,
                       AgentProperties properties, LlmProperties llmProperties, EventBus eventBus,
                       CohortMetrics metrics, ObjectMapper objectMapper, Clock clock,
                       @Qualifier("applicationTaskExecutor") Executor backgroundExecutor) {
        this.agents = agents;
        this.taskQueue = taskQueue;
        this.threadManager = threadManager;
        this.knowledgeStore = knowledgeStore;
        this.memoryStore = memoryStore;
        this.conversations = conversations;
        this.briefingService = briefingService;
        this.llmService = llmService;
        this.toolCallbacks = toolCallbacks;
        this.properties = properties;
        this.llmProperties = llmProperties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.backgroundExecutor = backgroundExecutor;
    }

    // ── Foreground ───────────────────────────────────────────────────────

    /**
     * Acknowledges a user message and queues the actual work.
     * <p>
     * The returned acknowledgment is already stored in the conversation and the task is
     * already queued. Memory extraction continues in the background and never fails this call.
     *
     * @throws AgentNotFoundException if the agent does not exist
     */
    public Acknowledgment handleUserMessage(String agentId, String content) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Message content must not be blank");
        }
        Agent agent = requireAgent(agentId);

        List<Memory> memories = memoryStore.load(agentId);
        List<ConversationMessage> recent = conversations.recent(agentId, ConversationMode.FOREGROUND,
                properties.getForegroundContextLimit());
        conversations.append(agentId, ConversationMode.FOREGROUND, MessageRole.USER, content);

        String text;
        try {
            text = llmService.generateText(AgentPrompts.acknowledgment(agent, memories, recent), content,
                    llmProperties.getAcknowledgmentMaxTokens());
        } catch (RuntimeException e) {
            log.warn("Acknowledgment generation failed for agent {}, using fallback: {}", agentId, e.getMessage());
            text = AgentPrompts.FALLBACK_ACKNOWLEDGMENT;
        }
        ConversationMessage reply = conversations.append(agentId, ConversationMode.FOREGROUND,
                MessageRole.ASSISTANT, text);
        AgentTask task = taskQueue.enqueue(agentId, agent.owner(), content, TaskSource.USER);

        String acknowledged = text;
        CompletableFuture
                .runAsync(() -> memoryStore.extractAndPersist(agent, content, acknowledged, reply.id()),
                        backgroundExecutor)
                .exceptionally(e -> {
                    log.warn("Memory extraction failed for agent {}: {}", agentId, e.getMessage());
                    return null;
                });

        return new Acknowledgment(text, task.id(), reply.id());
    }

    // ── Background ───────────────────────────────────────────────────────

    /**
     * Processes the agent's queue until it is empty.
     * <p>
     * With nothing pending this returns {@link WorkSessionResult.Outcome#NO_WORK} without
     * creating a thread or touching the agent. The same holds while an abandoned task is
     * still in progress, since nothing can be claimed until it is recovered. A task that
     * fails is recorded as failed and the session moves on to the next one.
     *
     * @throws AgentNotFoundException if the agent does not exist
     * @throws WorkSessionException   if the session itself breaks; the agent is idle again by then
     */
    public WorkSessionResult runWorkSession(String agentId) {
        Agent agent = requireAgent(agentId);
        if (!taskQueue.queueStatus(agentId).hasPendingWork()) {
            return WorkSessionResult.noWork();
        }
        if (!agents.tryMarkRunning(agentId)) {
            log.debug("Agent {} is already running a session", agentId);
            return WorkSessionResult.alreadyRunning();
        }
        // Holding the running flag, any in-progress task was left behind by an earlier session.
        // It blocks claiming until StaleTaskJanitor recovers it.
        if (taskQueue.queueStatus(agentId).inProgressCount() > 0) {
            agents.markIdle(agentId);
            log.debug("Agent {} has an abandoned in-progress task; waiting for stale-task recovery", agentId);
            return WorkSessionResult.noWork();
        }

        long start = System.currentTimeMillis();
        MdcContext.setAgent(agentId);
        try {
            String threadId = threadManager.startSession(agentId);
            MdcContext.setThread(agentId, threadId);
            log.info("Work session started for agent {} ({})", agent.name(), agent.isLead() ? "lead" : "subordinate");
            eventBus.publish(CohortEvent.of(CohortEvent.SESSION_STARTED, agentId, null, Map.of("threadId", threadId)));

            List<KnowledgeItem> knowledge = knowledgeStore.list(agentId);
            List<ConversationMessage> teamMessages = agent.isLead()
                    ? conversations.recent(agentId, ConversationMode.BACKGROUND, properties.getBackgroundConversationLimit())
                    : List.of();
            String systemPrompt = AgentPrompts.background(agent, knowledge, teamMessages);

            int completed = 0;
            int failed = 0;
            Optional<AgentTask> next;
            while ((next = taskQueue.claimNext(agentId)).isPresent()) {
                AgentTask task = next.get();
                MdcContext.setTask(task.id());
                try {
                    processTaskInThread(agent, threadId, task, systemPrompt);
                    completed++;
                    metrics.recordTaskOutcome("completed");
                } catch (RuntimeException e) {
                    log.warn("Task {} failed: {}", task.id(), e.getMessage(), e);
                    taskQueue.fail(task.id(), errorText(e));
                    failed++;
                    metrics.recordTaskOutcome("failed");
                } finally {
                    MdcContext.clearTask();
                }
            }

            extractKnowledge(agent, threadId);
            threadManager.endSession(threadId);

            String briefingId = null;
            if (agent.isLead()) {
                briefingId = decideBriefing(agent, threadId).map(Briefing::id).orElse(null);
                agents.updateLeadNextRunAt(agentId, clock.instant().plus(properties.getLeadRerunInterval()));
            }

            log.info("Work session finished for agent {}: {} completed, {} failed", agent.name(), completed, failed);
            eventBus.publish(CohortEvent.of(CohortEvent.SESSION_COMPLETED, agentId, null,
                    Map.of("threadId", threadId, "completed", completed, "failed", failed)));
            return new WorkSessionResult(WorkSessionResult.Outcome.COMPLETED, threadId, completed, failed, briefingId);
        } catch (RuntimeException e) {
            log.error("Work session for agent {} aborted: {}", agentId, e.getMessage(), e);
            throw new WorkSessionException(agentId, e);
        } finally {
            agents.markIdle(agentId);
            metrics.recordSessionDuration(agent.isLead(), System.currentTimeMillis() - start);
            MdcContext.clear();
        }
    }

    /**
     * Runs one task to its result inside the session thread and completes it.
     *
     * @return the assistant's final answer
     * @throws RuntimeException on LLM or tool failure; the caller fails the task
     */
    public String processTaskInThread(Agent agent, String threadId, AgentTask task, String systemPrompt) {
        threadManager.append(threadId, MessageRole.USER, task.description());

        List<Message> history = threadManager.buildContext(threadId).stream()
                .map(AgentWorker::toChatMessage)
                .toList();
        LlmResponse response = llmService.generate(systemPrompt, history,
                toolCallbacks.forAgent(ToolContext.of(agent)), properties.getMaxToolSteps());

        threadManager.append(threadId, MessageRole.ASSISTANT, response.text(), toolCallsJson(response));

        if (threadManager.shouldCompact(threadId)) {
            compact(threadId);
        }

        if (!taskQueue.completeWithResult(task.id(), response.text())) {
            log.debug("Task {} was already finished during processing", task.id());
        }
        return response.text();
    }

    /**
     * Lets a lead decide whether the session deserves a briefing.
     * Subordinates and sessions without assistant output never produce one.
     */
    public Optional<Briefing> decideBriefing(Agent agent, String threadId) {
        if (!agent.isLead()) {
            return Optional.empty();
        }
        return briefingService.decide(agent, threadManager.buildContext(threadId));
    }

    /**
     * Queues the proactive review task a due lead runs when it has nothing else to do.
     */
    public AgentTask enqueueProactiveReview(Agent lead) {
        return taskQueue.enqueue(lead.id(), lead.owner(), AgentPrompts.proactiveReview(), TaskSource.SYSTEM);
    }

    private void extractKnowledge(Agent agent, String threadId) {
        try {
            knowledgeStore.extractFromThread(agent, threadId, threadManager.buildContext(threadId));
        } catch (RuntimeException e) {
            log.warn("Knowledge extraction failed for thread {}: {}", threadId, e.getMessage());
        }
    }

    private void compact(String threadId) {
        List<ThreadMessage> context = threadManager.buildContext(threadId);
        String transcript = context.stream()
                .map(m -> m.role().name().toLowerCase() + ": " + m.content())
                .reduce((a, b) -> a + "\n\n" + b)
                .orElse("");
        try {
            String summary = llmService.generateText(AgentPrompts.COMPACTION_SYSTEM_PROMPT, transcript,
                    llmProperties.getSummaryMaxTokens());
            threadManager.compactWithSummary(threadId, summary);
            metrics.incrementCompactions();
        } catch (RuntimeException e) {
            log.warn("Compaction of thread {} failed, continuing uncompacted: {}", threadId, e.getMessage());
        }
    }

    private String toolCallsJson(LlmResponse response) {
        if (!response.usedTools()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(response.toolCalls());
        } catch (JsonProcessingException e) {
            log.debug("Could not serialize tool calls: {}", e.getMessage());
            return null;
        }
    }

    private Agent requireAgent(String agentId) {
        return agents.findById(agentId).orElseThrow(() -> new AgentNotFoundException(agentId));
    }

    private static Message toChatMessage(ThreadMessage message) {
        return switch (message.role()) {
            case USER -> new UserMessage(message.content());
            case ASSISTANT -> new AssistantMessage(message.content());
            case SYSTEM -> new SystemMessage(message.content());
        };
    }

    private static String errorText(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
