package com.flowkeeper.core.agent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A tool invocation requested by the model.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolCall(String id, String name, ObjectNode arguments) {

    public ToolCall {
        if (arguments == null) {
            arguments = JsonNodeFactory.instance.objectNode();
        }
    }
}
