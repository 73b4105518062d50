package com.cohort.dispatch.api;

import com.cohort.core.agent.Acknowledgment;
import com.cohort.core.agent.AgentNotFoundException;
import com.cohort.core.agent.AgentWorker;
import com.cohort.core.model.AgentTask;
import com.cohort.core.model.QueueStatus;
import com.cohort.core.persistence.AgentRepository;
import com.cohort.core.queue.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for talking to agents and inspecting their queues.
 */
@RestController
@RequestMapping("/api/v1/agents")
public class AgentController {

    private static final Logger log = LoggerFactory.getLogger(AgentController.class);

    static final int MAX_TASK_LIMIT = 100;

    private final AgentWorker agentWorker;
    private final AgentRepository agents;
    private final TaskQueue taskQueue;

    public AgentController(AgentWorker agentWorker, AgentRepository agents, TaskQueue taskQueue) {
        this.agentWorker = agentWorker;
        this.agents = agents;
        this.taskQueue = taskQueue;
    }

    /**
     * POST /api/v1/agents/{id}/messages: Send a user message.
     * <p>
     * Streams the acknowledgment as {@code chunk} events followed by one {@code done} event
     * carrying the queued task id. The work itself runs later in a background session.
     */
    @PostMapping(value = "/{agentId}/messages", produces = "text/event-stream")
    public SseEmitter sendMessage(@PathVariable String agentId, @RequestBody MessageRequest request) {
        if (request == null || request.content() == null || request.content().isBlank()) {
            throw new IllegalArgumentException("content is required");
        }
        Acknowledgment ack = agentWorker.handleUserMessage(agentId, request.content());

        SseEmitter emitter = new SseEmitter();
        try {
            for (String chunk : ack.chunks()) {
                emitter.send(SseEmitter.event().name("chunk").data(chunk));
            }
            Map<String, Object> done = new LinkedHashMap<>();
            done.put("taskId", ack.taskId());
            done.put("messageId", ack.messageId());
            emitter.send(SseEmitter.event().name("done").data(done));
            emitter.complete();
        } catch (IOException e) {
            // Message and task are already persisted; only the stream is lost.
            log.debug("Client went away while streaming acknowledgment for agent {}: {}", agentId, e.getMessage());
            emitter.completeWithError(e);
        }
        return emitter;
    }

    /**
     * GET /api/v1/agents/{id}/queue: Pending and in-progress counts.
     */
    @GetMapping("/{agentId}/queue")
    public ResponseEntity<QueueStatus> queue(@PathVariable String agentId) {
        requireAgent(agentId);
        return ResponseEntity.ok(taskQueue.queueStatus(agentId));
    }

    /**
     * GET /api/v1/agents/{id}/tasks: Most recent tasks, newest first.
     */
    @GetMapping("/{agentId}/tasks")
    public ResponseEntity<List<AgentTask>> tasks(@PathVariable String agentId,
                                                 @RequestParam(defaultValue = "20") int limit) {
        if (limit < 1 || limit > MAX_TASK_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_TASK_LIMIT);
        }
        requireAgent(agentId);
        return ResponseEntity.ok(taskQueue.listTasks(agentId, limit));
    }

    @ExceptionHandler(AgentNotFoundException.class)
    ResponseEntity<Map<String, String>> handleNotFound(AgentNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    private void requireAgent(String agentId) {
        if (agents.findById(agentId).isEmpty()) {
            throw new AgentNotFoundException(agentId);
        }
    }
}
