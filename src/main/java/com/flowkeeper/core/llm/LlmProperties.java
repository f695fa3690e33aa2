package com.flowkeeper.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Provider and model used when an agent config leaves them blank.
 */
@Component
@ConfigurationProperties(prefix = "flowkeeper.llm")
public class LlmProperties {

    private String provider = "";
    private String model = "";

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String providerOr(String configured) {
        return configured != null && !configured.isBlank() ? configured : provider;
    }

    public String modelOr(String configured) {
        return configured != null && !configured.isBlank() ? configured : model;
    }
}
