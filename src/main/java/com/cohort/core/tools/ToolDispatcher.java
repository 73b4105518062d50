package com.cohort.core.tools;

import com.cohort.core.briefing.BriefingService;
import com.cohort.core.conversation.ConversationService;
import com.cohort.core.knowledge.KnowledgeStore;
import com.cohort.core.model.Agent;
import com.cohort.core.model.AgentTask;
import com.cohort.core.model.Briefing;
import com.cohort.core.model.ConversationMode;
import com.cohort.core.model.InboxItem;
import com.cohort.core.model.KnowledgeItem;
import com.cohort.core.model.MessageRole;
import com.cohort.core.model.QueueStatus;
import com.cohort.core.model.TaskSource;
import com.cohort.core.persistence.AgentRepository;
import com.cohort.core.queue.TaskQueue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Executes tool calls on behalf of an agent.
 * <p>
 * Catalog membership, argument decoding and ownership are checked before anything is
 * written; every rejection comes back as {@link ToolResult#failure(String)}.
 */
@Service
public class ToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    static final int DEFAULT_LIST_LIMIT = 20;
    static final int MAX_KNOWLEDGE_LIST_LIMIT = 50;

    private final AgentRepository agents;
    private final TaskQueue taskQueue;
    private final BriefingService briefingService;
    private final ConversationService conversations;
    private final KnowledgeStore knowledgeStore;
    private final ObjectMapper objectMapper;

    public ToolDispatcher(AgentRepository agents, TaskQueue taskQueue, BriefingService briefingService,
                          ConversationService conversations, KnowledgeStore knowledgeStore,
                          ObjectMapper objectMapper) {
        this.agents = agents;
        this.taskQueue = taskQueue;
        this.briefingService = briefingService;
        this.conversations = conversations;
        this.knowledgeStore = knowledgeStore;
        this.objectMapper = objectMapper;
    }

    /**
     * Decodes {@code argumentsJson} for {@code tool} and executes it.
     */
    public ToolResult dispatch(ToolName tool, String argumentsJson, ToolContext context) {
        if (!tool.catalog().allows(context.isLead())) {
            return ToolResult.failure("Tool " + tool.wireName() + " is not available to "
                    + (context.isLead() ? "leads" : "subordinates"));
        }
        ToolCall call;
        try {
            call = tool.decode(argumentsJson, objectMapper);
        } catch (JsonProcessingException e) {
            return ToolResult.failure("Invalid parameters: " + e.getOriginalMessage());
        }
        return dispatch(call, context);
    }

    public ToolResult dispatch(ToolCall call, ToolContext context) {
        log.debug("Agent {} calling {}", context.agentId(), call.getClass().getSimpleName());
        try {
            return call.accept(new Executor(context));
        } catch (IllegalArgumentException e) {
            return ToolResult.failure(e.getMessage());
        }
    }

    private static boolean blank(String value) {
        return value == null || value.isBlank();
    }

    private static int limitOrDefault(Integer limit, int max) {
        if (limit == null) {
            return DEFAULT_LIST_LIMIT;
        }
        if (limit < 1 || limit > max) {
            throw new IllegalArgumentException("Invalid parameters: limit must be between 1 and " + max);
        }
        return limit;
    }

    private final class Executor implements ToolCall.Visitor<ToolResult> {

        private final ToolContext context;

        Executor(ToolContext context) {
            this.context = context;
        }

        @Override
        public ToolResult visit(ToolCall.DelegateToAgent call) {
            if (!context.isLead()) {
                return ToolResult.failure("Only leads can delegate tasks");
            }
            if (blank(call.agentId()) || blank(call.task())) {
                return ToolResult.failure("Invalid parameters: agentId and task are required");
            }
            boolean isChild = agents.findChildren(context.agentId()).stream()
                    .anyMatch(child -> child.id().equals(call.agentId()));
            if (!isChild) {
                log.info("Agent {} tried to delegate to non-child agent {}", context.agentId(), call.agentId());
                return ToolResult.failure("Can only delegate to agents on your team");
            }
            AgentTask task = taskQueue.enqueue(call.agentId(), context.owner(), call.task(), TaskSource.DELEGATION,
                    context.agentId(), 0);
            return ToolResult.success(Map.of(
                    "taskId", task.id(),
                    "message", "Task delegated successfully to agent " + call.agentId()));
        }

        @Override
        public ToolResult visit(ToolCall.GetTeamStatus call) {
            if (!context.isLead()) {
                return ToolResult.failure("Only leads can check team status");
            }
            List<Map<String, Object>> members = agents.findChildren(context.agentId()).stream()
                    .map(this::memberStatus)
                    .toList();
            long idle = members.stream().filter(m -> "idle".equals(m.get("status"))).count();
            long running = members.stream().filter(m -> "running".equals(m.get("status"))).count();
            return ToolResult.success(Map.of(
                    "agents", members,
                    "summary", Map.of("totalAgents", members.size(), "idleAgents", idle, "runningAgents", running)));
        }

        private Map<String, Object> memberStatus(Agent agent) {
            QueueStatus queue = taskQueue.queueStatus(agent.id());
            Map<String, Object> status = new LinkedHashMap<>();
            status.put("agentId", agent.id());
            status.put("name", agent.name());
            status.put("role", agent.role());
            status.put("status", agent.status().name().toLowerCase());
            status.put("pendingTasks", queue.pendingCount());
            status.put("inProgressTasks", queue.inProgressCount());
            return status;
        }

        @Override
        public ToolResult visit(ToolCall.CreateBriefing call) {
            if (!context.isLead()) {
                return ToolResult.failure("Only leads can create briefings");
            }
            if (blank(call.title()) || blank(call.summary()) || blank(call.fullMessage())) {
                return ToolResult.failure("Invalid parameters: title, summary and fullMessage are required");
            }
            Optional<Briefing> briefing = callerAgent().flatMap(agent ->
                    briefingService.createBriefing(agent, call.title(), call.summary(), call.fullMessage()));
            return briefing
                    .map(b -> ToolResult.success(Map.of(
                            "briefingId", b.id(),
                            "message", "Created briefing and inbox notification: " + b.title())))
                    .orElseGet(() -> ToolResult.failure("Could not find user for this team/aide"));
        }

        @Override
        public ToolResult visit(ToolCall.RequestUserInput call) {
            if (blank(call.title()) || blank(call.summary()) || blank(call.fullMessage())) {
                return ToolResult.failure("Invalid parameters: title, summary and fullMessage are required");
            }
            Optional<InboxItem> item = callerAgent().flatMap(agent ->
                    briefingService.requestUserInput(agent, call.title(), call.summary(), call.fullMessage()));
            return item
                    .map(i -> ToolResult.success(Map.of(
                            "inboxItemId", i.id(),
                            "message", "Requested user feedback and added message to conversation: " + i.title())))
                    .orElseGet(() -> ToolResult.failure("Could not find user for this team/aide"));
        }

        @Override
        public ToolResult visit(ToolCall.ListBriefings call) {
            if (!context.isLead()) {
                return ToolResult.failure("Only leads can list briefings");
            }
            int limit = limitOrDefault(call.limit(), 100);
            List<Map<String, Object>> listed = briefingService.list(context.owner(), call.query(), limit).stream()
                    .map(b -> Map.<String, Object>of(
                            "id", b.id(),
                            "title", b.title(),
                            "summary", b.summary(),
                            "createdAt", b.createdAt().toString()))
                    .toList();
            return ToolResult.success(Map.of("briefings", listed));
        }

        @Override
        public ToolResult visit(ToolCall.GetBriefing call) {
            if (!context.isLead()) {
                return ToolResult.failure("Only leads can fetch briefings");
            }
            if (blank(call.briefingId())) {
                return ToolResult.failure("Invalid parameters: briefingId is required");
            }
            return briefingService.get(context.owner(), call.briefingId())
                    .map(ToolResult::success)
                    .orElseGet(() -> ToolResult.failure("Briefing not found"));
        }

        @Override
        public ToolResult visit(ToolCall.ReportToLead call) {
            if (context.isLead()) {
                return ToolResult.failure("Leads cannot use this tool");
            }
            if (blank(call.result()) || call.status() == null) {
                return ToolResult.failure("Invalid parameters: result and status are required");
            }
            Optional<AgentTask> current = taskQueue.mostRecentInProgress(context.agentId());
            if (current.isEmpty()) {
                return ToolResult.failure("No in-progress task found to report on");
            }
            String taskId = current.get().id();
            boolean success = call.status() == ToolCall.ReportStatus.SUCCESS;
            if (success) {
                taskQueue.completeWithResult(taskId, call.result());
            } else {
                taskQueue.fail(taskId, call.result());
            }

            Optional<Agent> self = callerAgent();
            String leadId = self.map(Agent::parentAgentId).orElse(null);
            if (leadId != null) {
                conversations.append(leadId, ConversationMode.BACKGROUND, MessageRole.USER,
                        "Subordinate " + self.get().name() + " reports: " + call.result());
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("taskId", taskId);
            data.put("reportedTo", leadId);
            data.put("message", "Task " + (success ? "completed" : "failed") + ". Result reported to lead.");
            return ToolResult.success(data);
        }

        @Override
        public ToolResult visit(ToolCall.RequestInput call) {
            if (context.isLead()) {
                return ToolResult.failure("Leads cannot use this tool");
            }
            if (blank(call.question())) {
                return ToolResult.failure("Invalid parameters: question is required");
            }
            Optional<Agent> self = callerAgent();
            if (self.isEmpty() || self.get().parentAgentId() == null) {
                return ToolResult.failure("Could not find lead");
            }
            conversations.append(self.get().parentAgentId(), ConversationMode.BACKGROUND, MessageRole.USER,
                    "Subordinate " + self.get().name() + " asks: " + call.question());
            return ToolResult.success(Map.of("message", "Question sent to lead. Awaiting response."));
        }

        @Override
        public ToolResult visit(ToolCall.AddKnowledgeItem call) {
            KnowledgeItem item = knowledgeStore.add(context.agentId(), call.type(), call.content(),
                    call.confidence(), null);
            return ToolResult.success(Map.of("knowledgeItemId", item.id(), "message", "Knowledge item stored"));
        }

        @Override
        public ToolResult visit(ToolCall.ListKnowledgeItems call) {
            int limit = limitOrDefault(call.limit(), MAX_KNOWLEDGE_LIST_LIMIT);
            List<Map<String, Object>> items = knowledgeStore.list(context.agentId(), call.type(), limit).stream()
                    .map(k -> {
                        Map<String, Object> row = new LinkedHashMap<>();
                        row.put("id", k.id());
                        row.put("type", k.type().wireName());
                        row.put("content", k.content());
                        row.put("confidence", k.confidence());
                        return row;
                    })
                    .toList();
            return ToolResult.success(Map.of("knowledgeItems", items));
        }

        @Override
        public ToolResult visit(ToolCall.RemoveKnowledgeItem call) {
            if (blank(call.knowledgeItemId())) {
                return ToolResult.failure("Invalid parameters: knowledgeItemId is required");
            }
            if (!knowledgeStore.remove(context.agentId(), call.knowledgeItemId())) {
                return ToolResult.failure("Knowledge item not found");
            }
            return ToolResult.success(Map.of("message", "Knowledge item removed"));
        }

        private Optional<Agent> callerAgent() {
            return agents.findById(context.agentId());
        }
    }
}
