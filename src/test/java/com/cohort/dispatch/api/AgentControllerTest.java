package com.cohort.dispatch.api;

import com.cohort.core.agent.Acknowledgment;
import com.cohort.core.agent.AgentNotFoundException;
import com.cohort.core.agent.AgentWorker;
import com.cohort.core.model.Agent;
import com.cohort.core.model.AgentStatus;
import com.cohort.core.model.AgentTask;
import com.cohort.core.model.Owner;
import com.cohort.core.model.QueueStatus;
import com.cohort.core.model.TaskSource;
import com.cohort.core.model.TaskStatus;
import com.cohort.core.persistence.AgentRepository;
import com.cohort.core.queue.TaskQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AgentController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class AgentControllerTest {

    private static final Owner TEAM = Owner.team("team-1");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AgentWorker agentWorker;

    @MockitoBean
    private AgentRepository agentRepository;

    @MockitoBean
    private TaskQueue taskQueue;

    @BeforeEach
    void setUp() {
        var lead = new Agent("agent-1", TEAM, null, "Lena", "Research lead", null, AgentStatus.IDLE,
                null, null, 0, Instant.parse("2026-03-02T08:00:00Z"));
        when(agentRepository.findById("agent-1")).thenReturn(Optional.of(lead));
        when(agentRepository.findById("missing")).thenReturn(Optional.empty());
    }

    // ── POST /api/v1/agents/{id}/messages ────────────────────────────

    @Nested
    @DisplayName("POST /agents/{id}/messages")
    class SendMessage {

        @Test
        @DisplayName("streams acknowledgment chunks, then a done event with the task id")
        void streamsAcknowledgment() throws Exception {
            when(agentWorker.handleUserMessage("agent-1", "Research NVDA"))
                    .thenReturn(new Acknowledgment("On it now.", "task-1", "msg-1"));

            MvcResult result = mockMvc.perform(post("/api/v1/agents/agent-1/messages")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"content\":\"Research NVDA\"}"))
                    .andExpect(request().asyncStarted())
                    .andReturn();

            String body = result.getResponse().getContentAsString();
            assertTrue(body.contains("event:chunk\ndata:On \n\n"), body);
            assertTrue(body.contains("data:now."), body);
            assertTrue(body.indexOf("event:done") > body.lastIndexOf("event:chunk"), body);
            assertTrue(body.contains("\"taskId\":\"task-1\""), body);
            assertTrue(body.contains("\"messageId\":\"msg-1\""), body);
        }

        @Test
        @DisplayName("blank content returns 400 without touching the agent")
        void blankContent() throws Exception {
            mockMvc.perform(post("/api/v1/agents/agent-1/messages")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"content\":\"  \"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("content is required"));

            verify(agentWorker, never()).handleUserMessage(anyString(), anyString());
        }

        @Test
        @DisplayName("unknown agent returns 404")
        void unknownAgent() throws Exception {
            when(agentWorker.handleUserMessage("missing", "hi")).thenThrow(new AgentNotFoundException("missing"));

            mockMvc.perform(post("/api/v1/agents/missing/messages")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"content\":\"hi\"}"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error", containsString("missing")));
        }
    }

    // ── GET /api/v1/agents/{id}/queue ────────────────────────────────

    @Test
    @DisplayName("GET /agents/{id}/queue returns counts")
    void queue() throws Exception {
        when(taskQueue.queueStatus("agent-1")).thenReturn(QueueStatus.of(2, 1));

        mockMvc.perform(get("/api/v1/agents/agent-1/queue"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hasPendingWork").value(true))
                .andExpect(jsonPath("$.pendingCount").value(2))
                .andExpect(jsonPath("$.inProgressCount").value(1));
    }

    @Test
    @DisplayName("GET /agents/{id}/queue for unknown agent returns 404")
    void queueUnknownAgent() throws Exception {
        mockMvc.perform(get("/api/v1/agents/missing/queue"))
                .andExpect(status().isNotFound());
    }

    // ── GET /api/v1/agents/{id}/tasks ────────────────────────────────

    @Test
    @DisplayName("GET /agents/{id}/tasks lists recent tasks")
    void tasks() throws Exception {
        var task = new AgentTask("task-1", TEAM, "agent-1", null, "Research NVDA", null, TaskStatus.PENDING,
                TaskSource.USER, 0, Instant.parse("2026-03-02T08:00:00Z"), null, null);
        when(taskQueue.listTasks("agent-1", 5)).thenReturn(List.of(task));

        mockMvc.perform(get("/api/v1/agents/agent-1/tasks").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value("task-1"))
                .andExpect(jsonPath("$[0].description").value("Research NVDA"));
    }

    @Test
    @DisplayName("GET /agents/{id}/tasks rejects an out-of-range limit")
    void tasksBadLimit() throws Exception {
        mockMvc.perform(get("/api/v1/agents/agent-1/tasks").param("limit", "500"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("limit")));
    }
}
