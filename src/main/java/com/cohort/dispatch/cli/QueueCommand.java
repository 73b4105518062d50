package com.cohort.dispatch.cli;

import com.cohort.core.model.AgentTask;
import com.cohort.core.persistence.AgentRepository;
import com.cohort.core.queue.TaskQueue;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: cohort queue &lt;agent-id&gt;
 */
@Command(name = "queue", mixinStandardHelpOptions = true, description = "Show an agent's queue and recent tasks")
@Component
public class QueueCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Agent ID")
    private String agentId;

    @Option(names = {"--limit", "-l"}, defaultValue = "20", description = "Tasks to list (default: ${DEFAULT-VALUE})")
    private int limit;

    private final AgentRepository agents;
    private final TaskQueue taskQueue;

    public QueueCommand(AgentRepository agents, TaskQueue taskQueue) {
        this.agents = agents;
        this.taskQueue = taskQueue;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (agents.findById(agentId).isEmpty()) {
            ConsoleOutput.error("Agent not found: " + agentId);
            return 1;
        }
        ConsoleOutput.queue(agentId, taskQueue.queueStatus(agentId));
        List<AgentTask> tasks = taskQueue.listTasks(agentId, Math.max(1, limit));
        if (tasks.isEmpty()) {
            ConsoleOutput.info("No tasks yet.");
        } else {
            System.out.println();
            ConsoleOutput.taskTable(tasks);
        }
        return 0;
    }
}
