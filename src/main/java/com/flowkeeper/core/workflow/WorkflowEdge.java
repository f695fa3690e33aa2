package com.flowkeeper.core.workflow;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowEdge(String id, String source, String target, String sourceHandle) {

    public static WorkflowEdge of(String source, String target) {
        return new WorkflowEdge(source + "->" + target, source, target, null);
    }
}
