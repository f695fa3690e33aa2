package com.flowkeeper.core.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Tuning of the agent loop.
 */
@Component
@ConfigurationProperties(prefix = "flowkeeper.agent")
public class AgentProperties {

    /** Iterations per run before the conversation is checkpointed and the run restarted. */
    private int continueAsNewThreshold = 50;

    /** Unsaved messages are flushed to the conversation store every this many iterations. */
    private int persistInterval = 10;

    private Duration userInputTimeout = Duration.ofMinutes(5);

    /** Used when an agent config has no maxIterations. */
    private int defaultMaxIterations = 100;

    public int getContinueAsNewThreshold() {
        return continueAsNewThreshold;
    }

    public void setContinueAsNewThreshold(int continueAsNewThreshold) {
        this.continueAsNewThreshold = continueAsNewThreshold;
    }

    public int getPersistInterval() {
        return persistInterval;
    }

    public void setPersistInterval(int persistInterval) {
        this.persistInterval = persistInterval;
    }

    public Duration getUserInputTimeout() {
        return userInputTimeout;
    }

    public void setUserInputTimeout(Duration userInputTimeout) {
        this.userInputTimeout = userInputTimeout;
    }

    public int getDefaultMaxIterations() {
        return defaultMaxIterations;
    }

    public void setDefaultMaxIterations(int defaultMaxIterations) {
        this.defaultMaxIterations = defaultMaxIterations;
    }
}
