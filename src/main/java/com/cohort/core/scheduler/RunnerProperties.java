package com.cohort.core.scheduler;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "cohort.runner")
public class RunnerProperties {

    /** Start the polling loop when the server comes up. */
    private boolean enabled = true;

    private Duration pollInterval = Duration.ofSeconds(10);

    /** Work sessions allowed to run at the same time across all agents. */
    private int maxConcurrentSessions = 4;

    private Duration backoffBase = Duration.ofSeconds(30);

    private Duration backoffMax = Duration.ofHours(1);

    /** In-progress tasks of idle agents older than this are failed and queued again. */
    private Duration staleTaskTimeout = Duration.ofMinutes(30);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public int getMaxConcurrentSessions() {
        return maxConcurrentSessions;
    }

    public void setMaxConcurrentSessions(int maxConcurrentSessions) {
        this.maxConcurrentSessions = maxConcurrentSessions;
    }

    public Duration getBackoffBase() {
        return backoffBase;
    }

    public void setBackoffBase(Duration backoffBase) {
        this.backoffBase = backoffBase;
    }

    public Duration getBackoffMax() {
        return backoffMax;
    }

    public void setBackoffMax(Duration backoffMax) {
        this.backoffMax = backoffMax;
    }

    public Duration getStaleTaskTimeout() {
        return staleTaskTimeout;
    }

    public void setStaleTaskTimeout(Duration staleTaskTimeout) {
        this.staleTaskTimeout = staleTaskTimeout;
    }
}
