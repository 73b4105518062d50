package com.cohort.core.health;

import com.cohort.core.scheduler.AgentRunner;
import com.cohort.core.scheduler.RunnerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final DataSource dataSource;
    private final ChatModel chatModel;
    private final AgentRunner agentRunner;
    private final RunnerProperties runnerProperties;

    public HealthCheckService(
            @Autowired(required = false) DataSource dataSource,
            @Autowired(required = false) ChatModel chatModel,
            @Autowired(required = false) AgentRunner agentRunner,
            RunnerProperties runnerProperties) {
        this.dataSource = dataSource;
        this.chatModel = chatModel;
        this.agentRunner = agentRunner;
        this.runnerProperties = runnerProperties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkDatabase());
        results.add(checkLlm());
        results.add(checkRunner());
        return results;
    }

    HealthStatus checkDatabase() {
        if (dataSource == null) {
            return HealthStatus.down("database", "No DataSource configured");
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("database", HealthStatus.Status.UP, "Database connection valid",
                        Map.of("product", conn.getMetaData().getDatabaseProductName()));
            }
            return HealthStatus.down("database", "Database connection invalid");
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return HealthStatus.down("database", "Database error: " + e.getMessage());
        }
    }

    HealthStatus checkLlm() {
        if (chatModel == null) {
            return HealthStatus.down("llm", "No ChatModel configured");
        }
        return HealthStatus.up("llm", "ChatModel available (" + chatModel.getClass().getSimpleName() + ")");
    }

    HealthStatus checkRunner() {
        if (agentRunner == null) {
            return HealthStatus.down("runner", "Agent runner not available");
        }
        if (agentRunner.isRunning()) {
            return new HealthStatus("runner", HealthStatus.Status.UP, "Agent runner polling",
                    Map.of("pollInterval", runnerProperties.getPollInterval().toString(),
                           "maxConcurrentSessions", String.valueOf(runnerProperties.getMaxConcurrentSessions())));
        }
        // Not running is normal for one-shot CLI commands.
        return new HealthStatus("runner", HealthStatus.Status.DEGRADED,
                runnerProperties.isEnabled() ? "Agent runner not started" : "Agent runner disabled",
                Map.of());
    }
}
