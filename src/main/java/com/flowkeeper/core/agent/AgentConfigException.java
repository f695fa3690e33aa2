package com.flowkeeper.core.agent;

import com.flowkeeper.core.model.ConfigurationException;

public class AgentConfigException extends ConfigurationException {

    public AgentConfigException(String message) {
        super(message);
    }
}
