package com.cohort.dispatch.cli;

import com.cohort.core.model.Agent;
import com.cohort.core.model.AgentTask;
import com.cohort.core.model.TaskSource;
import com.cohort.core.persistence.AgentRepository;
import com.cohort.core.queue.TaskQueue;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: cohort enqueue &lt;agent-id&gt; "&lt;task&gt;"
 * <p>
 * Puts a task straight onto an agent's queue without going through the foreground
 * acknowledgment.
 */
@Command(name = "enqueue", mixinStandardHelpOptions = true, description = "Queue a task for an agent")
@Component
public class EnqueueCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Agent ID")
    private String agentId;

    @Parameters(index = "1", description = "Task description")
    private String description;

    @Option(names = {"--priority", "-p"}, defaultValue = "0",
            description = "Higher runs first among pending tasks (default: ${DEFAULT-VALUE})")
    private int priority;

    @Option(names = {"--source", "-s"}, defaultValue = "USER",
            description = "Task source: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private TaskSource source;

    private final AgentRepository agents;
    private final TaskQueue taskQueue;

    public EnqueueCommand(AgentRepository agents, TaskQueue taskQueue) {
        this.agents = agents;
        this.taskQueue = taskQueue;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        Optional<Agent> agent = agents.findById(agentId);
        if (agent.isEmpty()) {
            ConsoleOutput.error("Agent not found: " + agentId);
            return 1;
        }
        try {
            AgentTask task = taskQueue.enqueue(agentId, agent.get().owner(), description, source, agentId, priority);
            ConsoleOutput.success("Queued task " + task.id() + " for " + agent.get().name());
            return 0;
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
