package com.cohort.dispatch.cli;

import com.cohort.core.agent.AgentNotFoundException;
import com.cohort.core.agent.OwnerBootstrapService;
import com.cohort.core.model.Agent;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: cohort add-agent &lt;lead-id&gt; &lt;name&gt; &lt;role&gt;
 */
@Command(name = "add-agent", mixinStandardHelpOptions = true,
        description = "Add a subordinate agent under a lead")
@Component
public class AddAgentCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Lead agent ID")
    private String leadId;

    @Parameters(index = "1", description = "Agent name")
    private String name;

    @Parameters(index = "2", description = "Agent role")
    private String role;

    @Option(names = "--prompt", description = "Custom system prompt")
    private String systemPrompt;

    private final OwnerBootstrapService bootstrapService;

    public AddAgentCommand(OwnerBootstrapService bootstrapService) {
        this.bootstrapService = bootstrapService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            Agent agent = bootstrapService.addSubordinate(leadId, name, role, systemPrompt);
            ConsoleOutput.success("Added " + agent.name() + " (" + agent.role() + "): " + agent.id());
            return 0;
        } catch (AgentNotFoundException | IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
