package com.flowkeeper.core.workflow;

import com.flowkeeper.core.model.ConfigurationException;

public class WorkflowDefinitionException extends ConfigurationException {

    public WorkflowDefinitionException(String message) {
        super(message);
    }
}
