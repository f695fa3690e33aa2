package com.flowkeeper.core.nodes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Default {@link NodeExecutor}: routes each call to the {@link NodeHandler}
 * registered for the node type.
 */
@Component
public class NodeHandlerRegistry implements NodeExecutor {

    private static final Logger log = LoggerFactory.getLogger(NodeHandlerRegistry.class);

    /** Branching and iteration belong to the orchestrator, never to a handler. */
    private static final Set<String> CONTROL_FLOW_TYPES = Set.of("conditional", "switch", "loop");

    private final Map<String, NodeHandler> handlers = new LinkedHashMap<>();

    public NodeHandlerRegistry(List<NodeHandler> handlers) {
        for (NodeHandler handler : handlers) {
            register(handler.type(), handler);
            for (String alias : handler.aliases()) {
                register(alias, handler);
            }
        }
        log.info("Registered node handlers: {}", this.handlers.keySet());
    }

    private void register(String type, NodeHandler handler) {
        NodeHandler previous = handlers.putIfAbsent(type, handler);
        if (previous != null && previous != handler) {
            throw new IllegalStateException("Node type '" + type + "' is served by both "
                    + previous.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
        }
    }

    public Set<String> registeredTypes() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    @Override
    public ObjectNode execute(String nodeType, ObjectNode config, ObjectNode context) {
        log.debug("Executing {} node", nodeType);
        if (CONTROL_FLOW_TYPES.contains(nodeType)) {
            throw NodeTypeNotImplementedException.orchestratorOnly(nodeType);
        }
        if ("input".equals(nodeType)) {
            // Normally resolved by the orchestrator; kept for direct callers.
            String inputName = config.path("inputName").asText("input");
            ObjectNode result = JsonNodeFactory.instance.objectNode();
            JsonNode value = context.get(inputName);
            result.set(inputName, value != null ? value.deepCopy() : JsonNodeFactory.instance.nullNode());
            return result;
        }
        NodeHandler handler = handlers.get(nodeType);
        if (handler == null) {
            throw new NodeTypeNotImplementedException(nodeType);
        }
        return handler.execute(config, context);
    }
}
