package com.cohort.core.scheduler;

import com.cohort.core.agent.AgentWorker;
import com.cohort.core.agent.WorkSessionException;
import com.cohort.core.agent.WorkSessionResult;
import com.cohort.core.briefing.BriefingDecision;
import com.cohort.core.knowledge.ExtractedKnowledge;
import com.cohort.core.llm.LlmResponse;
import com.cohort.core.model.Agent;
import com.cohort.core.model.AgentTask;
import com.cohort.core.model.TaskSource;
import com.cohort.core.model.TaskStatus;
import com.cohort.core.testsupport.CohortFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AgentRunnerTest {

    private CohortFixture fx;
    private RunnerProperties properties;
    private BackoffPolicy backoffPolicy;
    private StaleTaskJanitor janitor;
    private AgentRunner runner;
    private Agent lead;
    private Agent analyst;

    @BeforeEach
    void setUp() {
        fx = new CohortFixture();
        properties = new RunnerProperties();
        backoffPolicy = new BackoffPolicy(fx.agents, properties, fx.metrics, fx.clock);
        janitor = new StaleTaskJanitor(fx.taskRepository, fx.taskQueue, properties, fx.metrics, fx.clock);
        runner = runnerWith(fx.worker);
        lead = fx.createTeamLead();
        analyst = fx.createSubordinate(lead, "Sam");

        when(fx.llm.generate(anyString(), anyList(), anyList(), anyInt()))
                .thenReturn(new LlmResponse("done", List.of(), 1));
        when(fx.llm.structuredCall(anyString(), anyString(), eq(ExtractedKnowledge.class)))
                .thenReturn(new ExtractedKnowledge(List.of()));
        when(fx.llm.structuredCall(anyString(), anyString(), eq(BriefingDecision.class)))
                .thenReturn(new BriefingDecision(false, null, null, null));
    }

    @AfterEach
    void tearDown() {
        runner.shutdown();
    }

    private AgentRunner runnerWith(AgentWorker worker) {
        return new AgentRunner(worker, fx.agents, fx.taskQueue, backoffPolicy, janitor, fx.eventBus,
                properties, fx.clock);
    }

    @Nested
    @DisplayName("computeAttention")
    class ComputeAttention {

        @Test
        @DisplayName("nothing queued and no lead due means nobody is attended")
        void empty() {
            assertTrue(runner.computeAttention().agentIds().isEmpty());
        }

        @Test
        @DisplayName("agents with open tasks are attended")
        void openTasks() {
            fx.taskQueue.enqueue(analyst.id(), lead.owner(), "task", TaskSource.DELEGATION, lead.id(), 0);

            assertEquals(Set.of(analyst.id()), runner.computeAttention().agentIds());
            // still open on the next cycle, even with the wake signal drained
            assertEquals(Set.of(analyst.id()), runner.computeAttention().agentIds());
        }

        @Test
        @DisplayName("a backed-off agent is skipped until a new task wakes it")
        void backoffAndWake() {
            fx.taskQueue.enqueue(analyst.id(), lead.owner(), "task", TaskSource.DELEGATION, lead.id(), 0);
            runner.computeAttention();
            backoffPolicy.onSessionFailure(analyst.id());

            assertTrue(runner.computeAttention().agentIds().isEmpty());

            fx.taskQueue.enqueue(analyst.id(), lead.owner(), "urgent", TaskSource.DELEGATION, lead.id(), 0);
            assertEquals(Set.of(analyst.id()), runner.computeAttention().agentIds());
            assertTrue(runner.computeAttention().agentIds().isEmpty());
        }

        @Test
        @DisplayName("backoff expires with time")
        void backoffExpires() {
            fx.taskQueue.enqueue(analyst.id(), lead.owner(), "task", TaskSource.DELEGATION, lead.id(), 0);
            runner.computeAttention();
            backoffPolicy.onSessionFailure(analyst.id());

            fx.clock.advance(Duration.ofSeconds(31));

            assertEquals(Set.of(analyst.id()), runner.computeAttention().agentIds());
        }

        @Test
        @DisplayName("a lead is due once its next run time has passed")
        void dueLead() {
            fx.agents.updateLeadNextRunAt(lead.id(), fx.clock.instant().plus(Duration.ofMinutes(5)));
            assertTrue(runner.computeAttention().dueLeads().isEmpty());

            fx.clock.advance(Duration.ofMinutes(5));

            AgentRunner.Attention attention = runner.computeAttention();
            assertEquals(Set.of(lead.id()), attention.dueLeads());
            assertEquals(Set.of(lead.id()), attention.agentIds());
        }
    }

    @Nested
    @DisplayName("runSingleCycle")
    class RunSingleCycle {

        @Test
        @DisplayName("runs a session for every attended agent")
        void runsSessions() {
            AgentTask delegated = fx.taskQueue.enqueue(analyst.id(), lead.owner(), "task", TaskSource.DELEGATION,
                    lead.id(), 0);

            CycleReport report = runner.runSingleCycle();

            assertEquals(Set.of(analyst.id()), report.attended());
            assertTrue(report.results().get(analyst.id()).ran());
            assertTrue(report.failed().isEmpty());
            assertEquals(TaskStatus.COMPLETED, fx.taskRepository.findById(delegated.id()).orElseThrow().status());
        }

        @Test
        @DisplayName("a due lead with an empty queue runs a proactive review")
        void proactiveReview() {
            fx.agents.updateLeadNextRunAt(lead.id(), fx.clock.instant().minusSeconds(1));

            CycleReport report = runner.runSingleCycle();

            WorkSessionResult result = report.results().get(lead.id());
            assertEquals(1, result.completedCount());
            AgentTask review = fx.taskQueue.listTasks(lead.id(), 10).get(0);
            assertEquals(TaskSource.SYSTEM, review.source());
            assertEquals(fx.clock.instant().plus(Duration.ofHours(1)), fx.reload(lead).leadNextRunAt());
            assertTrue(runner.computeAttention().agentIds().isEmpty());
        }

        @Test
        @DisplayName("a due lead with queued work gets no extra review task")
        void dueLeadWithWork() {
            fx.taskQueue.enqueue(lead.id(), lead.owner(), "user ask", TaskSource.USER);
            fx.agents.updateLeadNextRunAt(lead.id(), fx.clock.instant().minusSeconds(1));

            runner.runSingleCycle();

            List<AgentTask> tasks = fx.taskQueue.listTasks(lead.id(), 10);
            assertEquals(1, tasks.size());
            assertEquals(TaskSource.USER, tasks.get(0).source());
        }

        @Test
        @DisplayName("a failing session is reported and puts the agent into backoff")
        void failingSession() {
            AgentWorker failingWorker = mock(AgentWorker.class);
            when(failingWorker.runWorkSession(analyst.id()))
                    .thenThrow(new WorkSessionException(analyst.id(), new IllegalStateException("db down")));
            AgentRunner failingRunner = runnerWith(failingWorker);
            try {
                fx.taskQueue.enqueue(analyst.id(), lead.owner(), "task", TaskSource.DELEGATION, lead.id(), 0);

                CycleReport report = failingRunner.runSingleCycle();

                assertEquals(Set.of(analyst.id()), report.failed());
                assertEquals(1, fx.reload(analyst).backoffAttemptCount());
                assertTrue(failingRunner.computeAttention().agentIds().isEmpty());
            } finally {
                failingRunner.shutdown();
            }
        }

        @Test
        @DisplayName("stale tasks are recovered before attention is computed")
        void recoversStaleTasks() {
            fx.taskQueue.enqueue(analyst.id(), lead.owner(), "orphan", TaskSource.DELEGATION, lead.id(), 0);
            fx.taskQueue.claimNext(analyst.id());
            fx.clock.advance(Duration.ofHours(1));

            CycleReport report = runner.runSingleCycle();

            assertEquals(1, report.requeued());
            assertEquals(1, report.results().get(analyst.id()).completedCount());
        }
    }

    @Test
    @DisplayName("start and stop toggle the polling loop")
    void startStop() {
        properties.setPollInterval(Duration.ofHours(1));

        runner.start();
        runner.start();
        assertTrue(runner.isRunning());

        runner.stop();
        assertFalse(runner.isRunning());
    }
}
