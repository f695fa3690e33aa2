package com.flowkeeper.core.engine;

import com.flowkeeper.core.substrate.ActivityOptions;
import com.flowkeeper.core.substrate.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Host pool sizes and the activity options used by the orchestrators.
 */
@Component
@ConfigurationProperties(prefix = "flowkeeper.engine")
public class EngineProperties {

    private int orchestrationPoolSize = 8;
    private ActivitySettings node = new ActivitySettings();
    private ActivitySettings llm = new ActivitySettings();
    private ActivitySettings tool = new ActivitySettings();
    private ActivitySettings persistence = new ActivitySettings();

    public int getOrchestrationPoolSize() {
        return orchestrationPoolSize;
    }

    public void setOrchestrationPoolSize(int orchestrationPoolSize) {
        this.orchestrationPoolSize = orchestrationPoolSize;
    }

    public ActivitySettings getNode() {
        return node;
    }

    public void setNode(ActivitySettings node) {
        this.node = node;
    }

    public ActivitySettings getLlm() {
        return llm;
    }

    public void setLlm(ActivitySettings llm) {
        this.llm = llm;
    }

    public ActivitySettings getTool() {
        return tool;
    }

    public void setTool(ActivitySettings tool) {
        this.tool = tool;
    }

    public ActivitySettings getPersistence() {
        return persistence;
    }

    public void setPersistence(ActivitySettings persistence) {
        this.persistence = persistence;
    }

    /**
     * Defaults: ten minute attempts, three attempts, doubling from one second.
     */
    public static class ActivitySettings {

        private Duration timeout = Duration.ofMinutes(10);
        private int maxAttempts = 3;
        private double backoffCoefficient = 2.0;
        private Duration initialInterval = Duration.ofSeconds(1);
        private Duration maxInterval = Duration.ofSeconds(100);

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public double getBackoffCoefficient() {
            return backoffCoefficient;
        }

        public void setBackoffCoefficient(double backoffCoefficient) {
            this.backoffCoefficient = backoffCoefficient;
        }

        public Duration getInitialInterval() {
            return initialInterval;
        }

        public void setInitialInterval(Duration initialInterval) {
            this.initialInterval = initialInterval;
        }

        public Duration getMaxInterval() {
            return maxInterval;
        }

        public void setMaxInterval(Duration maxInterval) {
            this.maxInterval = maxInterval;
        }

        public ActivityOptions toOptions() {
            return ActivityOptions.of(timeout,
                    new RetryPolicy(maxAttempts, backoffCoefficient, initialInterval, maxInterval));
        }
    }
}
