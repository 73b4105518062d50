package com.cohort.dispatch.cli;

import com.cohort.core.agent.AgentNotFoundException;
import com.cohort.core.agent.AgentWorker;
import com.cohort.core.agent.WorkSessionException;
import com.cohort.core.agent.WorkSessionResult;
import com.cohort.core.scheduler.AgentRunner;
import com.cohort.core.scheduler.CycleReport;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: cohort run-once [--agent &lt;id&gt;]
 * <p>
 * Runs one scheduler cycle in the foreground, or one work session for a single agent.
 */
@Command(name = "run-once", mixinStandardHelpOptions = true,
        description = "Run one scheduling cycle (or one agent's session) and exit")
@Component
public class RunOnceCommand implements Callable<Integer> {

    @Option(names = {"--agent", "-a"}, description = "Only run this agent's work session")
    private String agentId;

    private final AgentRunner agentRunner;
    private final AgentWorker agentWorker;

    public RunOnceCommand(AgentRunner agentRunner, AgentWorker agentWorker) {
        this.agentRunner = agentRunner;
        this.agentWorker = agentWorker;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (agentId != null) {
            return runAgent();
        }
        CycleReport report = agentRunner.runSingleCycle();
        if (report.requeued() > 0) {
            ConsoleOutput.info("Requeued " + report.requeued() + " stale task(s)");
        }
        if (report.attended().isEmpty()) {
            ConsoleOutput.info("No agent needed attention.");
            return 0;
        }
        for (Map.Entry<String, WorkSessionResult> entry : report.results().entrySet()) {
            printResult(entry.getKey(), entry.getValue());
        }
        for (String failed : report.failed()) {
            ConsoleOutput.error(failed + ": session failed");
        }
        return report.failed().isEmpty() ? 0 : 1;
    }

    private int runAgent() {
        try {
            printResult(agentId, agentWorker.runWorkSession(agentId));
            return 0;
        } catch (AgentNotFoundException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        } catch (WorkSessionException e) {
            ConsoleOutput.error(agentId + ": session failed: " + e.getMessage());
            return 1;
        }
    }

    private static void printResult(String agentId, WorkSessionResult result) {
        switch (result.outcome()) {
            case NO_WORK -> ConsoleOutput.info(agentId + ": nothing to do");
            case ALREADY_RUNNING -> ConsoleOutput.info(agentId + ": busy or paused, skipped");
            case COMPLETED -> {
                String line = agentId + ": " + result.completedCount() + " completed, "
                        + result.failedCount() + " failed";
                if (result.briefingId() != null) {
                    line += ", briefing " + result.briefingId();
                }
                if (result.failedCount() > 0 && result.completedCount() == 0) {
                    ConsoleOutput.error(line);
                } else {
                    ConsoleOutput.success(line);
                }
            }
        }
    }
}
