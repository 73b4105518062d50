package com.cohort.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Cohort.
 */
@Command(
        name = "cohort",
        mixinStandardHelpOptions = true,
        version = "Cohort 0.1.0",
        description = "Agent teams with private task queues and background work sessions",
        subcommands = {
                ServeCommand.class,
                BootstrapCommand.class,
                AddAgentCommand.class,
                EnqueueCommand.class,
                QueueCommand.class,
                RunOnceCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class CohortCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
