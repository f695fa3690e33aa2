package com.flowkeeper.core.agent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A tool an agent may call.
 *
 * @param type   {@code workflow} or {@code function}
 * @param schema JSON schema of the arguments, passed to the model
 * @param config type-specific settings ({@code workflowId}, {@code functionName})
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolDefinition(String name, String description, String type, JsonNode schema, ObjectNode config) {

    public ToolDefinition {
        if (config == null) {
            config = JsonNodeFactory.instance.objectNode();
        }
    }
}
