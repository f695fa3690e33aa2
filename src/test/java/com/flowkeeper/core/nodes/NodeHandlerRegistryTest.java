package com.flowkeeper.core.nodes;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowkeeper.core.substrate.NonRetryable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.flowkeeper.core.substrate.TestWorkflows.MAPPER;
import static org.junit.jupiter.api.Assertions.*;

class NodeHandlerRegistryTest {

    private final TemplateInterpolator interpolator = new TemplateInterpolator(MAPPER);

    @Test
    @DisplayName("routes by type and alias")
    void routes() {
        NodeHandler aliased = new NodeHandler() {
            @Override
            public String type() {
                return "httpRequest";
            }

            @Override
            public Set<String> aliases() {
                return Set.of("http_request");
            }

            @Override
            public ObjectNode execute(ObjectNode config, ObjectNode context) {
                return MAPPER.createObjectNode().put("called", true);
            }
        };
        var registry = new NodeHandlerRegistry(List.of(new EchoNodeHandler(interpolator), aliased));

        assertTrue(registry.registeredTypes().containsAll(Set.of("echo", "httpRequest", "http_request")));
        assertTrue(registry.execute("http_request", MAPPER.createObjectNode(), MAPPER.createObjectNode())
                .get("called").asBoolean());
    }

    @Test
    @DisplayName("unknown and control-flow types fail as not implemented and are not retried")
    void unknownTypes() {
        var registry = new NodeHandlerRegistry(List.of());

        var unknown = assertThrows(NodeTypeNotImplementedException.class,
                () -> registry.execute("teleport", MAPPER.createObjectNode(), MAPPER.createObjectNode()));
        assertEquals("Node type 'teleport' not yet implemented", unknown.getMessage());
        assertInstanceOf(NonRetryable.class, unknown);
        assertThrows(NodeTypeNotImplementedException.class,
                () -> registry.execute("loop", MAPPER.createObjectNode(), MAPPER.createObjectNode()));
    }

    @Test
    @DisplayName("two handlers for one type are rejected")
    void duplicateType() {
        assertThrows(IllegalStateException.class, () -> new NodeHandlerRegistry(
                List.of(new EchoNodeHandler(interpolator), new EchoNodeHandler(interpolator))));
    }

    @Test
    @DisplayName("input nodes resolve directly from the context")
    void inputFallback() {
        var registry = new NodeHandlerRegistry(List.of());
        ObjectNode out = registry.execute("input", MAPPER.createObjectNode().put("inputName", "x"),
                MAPPER.createObjectNode().put("x", "v"));
        assertEquals("v", out.get("x").asText());
    }
}
