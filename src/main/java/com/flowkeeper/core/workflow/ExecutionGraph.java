package com.flowkeeper.core.workflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated adjacency view of a {@link WorkflowDefinition}.
 */
public final class ExecutionGraph {

    private final WorkflowDefinition definition;
    private final Map<String, List<String>> outgoing = new LinkedHashMap<>();
    private final Map<String, List<String>> incoming = new LinkedHashMap<>();
    private final List<String> startNodes;

    private ExecutionGraph(WorkflowDefinition definition) {
        this.definition = definition;
        for (String id : definition.nodes().keySet()) {
            outgoing.put(id, new ArrayList<>());
            incoming.put(id, new ArrayList<>());
        }
        for (WorkflowEdge edge : definition.edges()) {
            outgoing.get(edge.source()).add(edge.target());
            incoming.get(edge.target()).add(edge.source());
        }
        this.startNodes = computeStartNodes();
    }

    /**
     * @throws WorkflowDefinitionException if the definition has no nodes, an edge
     *         names a missing node, or a goto policy targets a missing node
     */
    public static ExecutionGraph of(WorkflowDefinition definition) {
        if (definition == null || definition.nodes().isEmpty()) {
            throw new WorkflowDefinitionException("Workflow definition has no nodes");
        }
        Map<String, WorkflowNode> nodes = definition.nodes();
        for (WorkflowEdge edge : definition.edges()) {
            if (edge.source() == null || !nodes.containsKey(edge.source())) {
                throw new WorkflowDefinitionException(
                        "Edge " + edge.id() + " references unknown source node '" + edge.source() + "'");
            }
            if (edge.target() == null || !nodes.containsKey(edge.target())) {
                throw new WorkflowDefinitionException(
                        "Edge " + edge.id() + " references unknown target node '" + edge.target() + "'");
            }
        }
        nodes.forEach((id, node) -> {
            if (node.type() == null || node.type().isBlank()) {
                throw new WorkflowDefinitionException("Node '" + id + "' has no type");
            }
            ErrorPolicy policy = node.onError();
            if (policy.strategy() == ErrorStrategy.GOTO
                    && (policy.gotoNode() == null || !nodes.containsKey(policy.gotoNode()))) {
                throw new WorkflowDefinitionException(
                        "Node '" + id + "' has goto policy to unknown node '" + policy.gotoNode() + "'");
            }
        });
        return new ExecutionGraph(definition);
    }

    private List<String> computeStartNodes() {
        List<String> starts = new ArrayList<>();
        definition.nodes().forEach((id, node) -> {
            if (node.isInput() || incoming.get(id).isEmpty()) {
                starts.add(id);
            }
        });
        String entry = definition.entryPoint();
        if (entry != null && starts.remove(entry)) {
            starts.add(0, entry);
        }
        return Collections.unmodifiableList(starts);
    }

    public WorkflowNode node(String id) {
        return definition.nodes().get(id);
    }

    public List<String> dependencies(String id) {
        return Collections.unmodifiableList(incoming.get(id));
    }

    public List<String> dependents(String id) {
        return Collections.unmodifiableList(outgoing.get(id));
    }

    public List<String> startNodes() {
        return startNodes;
    }

    public int size() {
        return definition.nodes().size();
    }
}
