package com.cohort.core.health;

import com.cohort.core.scheduler.AgentRunner;
import com.cohort.core.scheduler.RunnerProperties;
import com.cohort.core.testsupport.TestDatabase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.model.ChatModel;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    private final RunnerProperties runnerProperties = new RunnerProperties();

    @Test
    @DisplayName("All components null -> all DOWN")
    void allComponentsNullAllDown() {
        var service = new HealthCheckService(null, null, null, runnerProperties);
        List<HealthStatus> results = service.checkAll();

        assertEquals(3, results.size());
        for (var status : results) {
            assertEquals(HealthStatus.Status.DOWN, status.status(),
                    status.component() + " should be DOWN when null");
        }
    }

    @Test
    @DisplayName("checkAll returns database, llm, runner components")
    void checkAllReturnsAllComponents() {
        var service = new HealthCheckService(null, null, null, runnerProperties);

        var components = service.checkAll().stream().map(HealthStatus::component).toList();
        assertEquals(List.of("database", "llm", "runner"), components);
    }

    @Test
    @DisplayName("Reachable database -> database UP with product name")
    void databaseUp() {
        var service = new HealthCheckService(TestDatabase.create(), null, null, runnerProperties);

        HealthStatus status = service.checkDatabase();

        assertEquals(HealthStatus.Status.UP, status.status());
        assertEquals("H2", status.metadata().get("product"));
    }

    @Test
    @DisplayName("ChatModel available -> llm UP")
    void llmUp() {
        var service = new HealthCheckService(null, mock(ChatModel.class), null, runnerProperties);

        assertEquals(HealthStatus.Status.UP, service.checkLlm().status());
    }

    @Test
    @DisplayName("Runner polling -> UP, stopped -> DEGRADED")
    void runnerStates() {
        AgentRunner runner = mock(AgentRunner.class);
        var service = new HealthCheckService(null, null, runner, runnerProperties);

        when(runner.isRunning()).thenReturn(true);
        HealthStatus running = service.checkRunner();
        assertEquals(HealthStatus.Status.UP, running.status());
        assertEquals("4", running.metadata().get("maxConcurrentSessions"));

        when(runner.isRunning()).thenReturn(false);
        assertEquals(HealthStatus.Status.DEGRADED, service.checkRunner().status());
        assertEquals("Agent runner not started", service.checkRunner().detail());

        runnerProperties.setEnabled(false);
        assertEquals("Agent runner disabled", service.checkRunner().detail());
    }
}
