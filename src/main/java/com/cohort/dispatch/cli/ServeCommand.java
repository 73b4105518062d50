package com.cohort.dispatch.cli;

import com.cohort.core.scheduler.AgentRunner;
import com.cohort.core.scheduler.RunnerProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: cohort serve
 * <p>
 * Starts Cohort as a long-running HTTP server. The web server is enabled by
 * {@link com.cohort.CohortApplication#main} detecting "serve" in args; once it is up the
 * agent runner starts polling, unless {@code cohort.runner.enabled} is false.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 cohort serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the HTTP server and the background agent runner")
@Component
public class ServeCommand implements Runnable {

    private final AgentRunner agentRunner;
    private final RunnerProperties runnerProperties;

    @Value("${server.port:8080}")
    private int port;

    public ServeCommand(AgentRunner agentRunner, RunnerProperties runnerProperties) {
        this.agentRunner = agentRunner;
        this.runnerProperties = runnerProperties;
    }

    @Override
    public void run() {
        // Only reached through --help style invocations; CliRunner skips picocli for serve.
        printBanner(port, false);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        boolean runnerStarted = false;
        if (runnerProperties.isEnabled()) {
            agentRunner.start();
            runnerStarted = true;
        }
        printBanner(event.getWebServer().getPort(), runnerStarted);
    }

    private void printBanner(int port, boolean runnerStarted) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Cohort server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1");
        System.out.println("  Health:  http://localhost:" + port + "/api/v1/health");
        System.out.println();
        if (runnerStarted) {
            ConsoleOutput.info("Agent runner polling every " + runnerProperties.getPollInterval());
        } else {
            ConsoleOutput.info("Agent runner disabled (cohort.runner.enabled=false)");
        }
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
