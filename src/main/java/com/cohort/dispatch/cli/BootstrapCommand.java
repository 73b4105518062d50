package com.cohort.dispatch.cli;

import com.cohort.core.agent.OwnerBootstrapService;
import com.cohort.core.agent.OwnerBootstrapService.Bootstrapped;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: cohort bootstrap team|aide --user &lt;id&gt; --name &lt;name&gt;
 * <p>
 * Creates a team or aide together with its lead and queues the lead's first task.
 */
@Command(name = "bootstrap", mixinStandardHelpOptions = true,
        description = "Create a team or aide with its lead agent")
@Component
public class BootstrapCommand implements Runnable {

    enum Kind { team, aide }

    @Parameters(index = "0", description = "What to create: ${COMPLETION-CANDIDATES}")
    private Kind kind;

    @Option(names = {"--user", "-u"}, required = true, description = "User the team or aide works for")
    private String userId;

    @Option(names = {"--name", "-n"}, required = true, description = "Display name")
    private String name;

    @Option(names = {"--mission", "-m"}, description = "Purpose handed to the lead")
    private String mission;

    @Option(names = "--lead-name", defaultValue = "Lead", description = "Lead agent name (default: ${DEFAULT-VALUE})")
    private String leadName;

    @Option(names = "--lead-role", defaultValue = "Team lead", description = "Lead agent role (default: ${DEFAULT-VALUE})")
    private String leadRole;

    private final OwnerBootstrapService bootstrapService;

    public BootstrapCommand(OwnerBootstrapService bootstrapService) {
        this.bootstrapService = bootstrapService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        Bootstrapped created = kind == Kind.team
                ? bootstrapService.createTeam(userId, name, mission, leadName, leadRole)
                : bootstrapService.createAide(userId, name, mission, leadName, leadRole);
        ConsoleOutput.success("Created " + kind + " " + created.owner().owner().id() + " (" + name + ")");
        ConsoleOutput.success("Lead " + created.lead().name() + ": " + created.lead().id());
        ConsoleOutput.info("Bootstrap task queued; run 'cohort run-once' or 'cohort serve' to start it.");
    }
}
