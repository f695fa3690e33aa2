package com.flowkeeper.core.workflow;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A workflow as stored: nodes keyed by id, in definition order, plus edges.
 * Editor settings and other unknown fields are ignored.
 *
 * @param name       display name
 * @param nodes      node id to node; iteration order is the definition order
 * @param edges      directed edges, {@code source} must finish before {@code target}
 * @param entryPoint optional start node visited first
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowDefinition(
    String name,
    Map<String, WorkflowNode> nodes,
    List<WorkflowEdge> edges,
    String entryPoint
) {

    public WorkflowDefinition {
        nodes = nodes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(nodes)) : Map.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
    }
}
