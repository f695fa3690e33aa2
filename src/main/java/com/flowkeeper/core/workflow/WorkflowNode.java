package com.flowkeeper.core.workflow;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One node of a workflow definition. Canvas metadata such as {@code position}
 * is accepted and ignored.
 *
 * @param type    open type tag resolved by the node executor ({@code input} is built in)
 * @param name    display name
 * @param config  node configuration, never null
 * @param onError failure policy, never null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowNode(String type, String name, ObjectNode config, ErrorPolicy onError) {

    public WorkflowNode {
        if (config == null) {
            config = JsonNodeFactory.instance.objectNode();
        }
        if (onError == null) {
            onError = ErrorPolicy.FAIL;
        }
    }

    public static WorkflowNode of(String type, ObjectNode config) {
        return new WorkflowNode(type, type, config, null);
    }

    @JsonIgnore
    public boolean isInput() {
        return "input".equals(type);
    }
}
