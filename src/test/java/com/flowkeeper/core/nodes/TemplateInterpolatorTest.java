package com.flowkeeper.core.nodes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.flowkeeper.core.substrate.TestWorkflows.MAPPER;
import static org.junit.jupiter.api.Assertions.*;

class TemplateInterpolatorTest {

    private TemplateInterpolator interpolator;
    private ObjectNode context;

    @BeforeEach
    void setUp() throws Exception {
        interpolator = new TemplateInterpolator(MAPPER);
        context = (ObjectNode) MAPPER.readTree("""
                {
                  "name": "Ada",
                  "count": 3,
                  "user": { "address": { "city": "London" } },
                  "users": [ { "name": "first" }, { "name": "second" } ],
                  "doc": { "content-type": "text/plain" },
                  "tags": ["a", "b"],
                  "nothing": null
                }
                """);
    }

    @Test
    @DisplayName("replaces simple, nested, indexed and quoted-bracket references")
    void resolvesPaths() {
        assertEquals("Hi Ada (3)", interpolator.interpolate("Hi ${name} (${count})", context));
        assertEquals("London", interpolator.interpolate("${user.address.city}", context));
        assertEquals("second", interpolator.interpolate("${users[1].name}", context));
        assertEquals("text/plain", interpolator.interpolate("${doc['content-type']}", context));
    }

    @Test
    @DisplayName("unresolved references are left verbatim")
    void unresolvedLeftAlone() {
        assertEquals("${missing} and ${users[9].name}",
                interpolator.interpolate("${missing} and ${users[9].name}", context));
    }

    @Test
    @DisplayName("containers render as JSON and null renders as null")
    void rendersContainers() {
        assertEquals("[\"a\",\"b\"] null", interpolator.interpolate("${tags} ${nothing}", context));
    }

    @Test
    @DisplayName("interpolateToJson parses object and array results")
    void toJson() {
        JsonNode parsed = interpolator.interpolateToJson("{\"who\": \"${name}\"}", context);
        assertEquals("Ada", parsed.get("who").asText());
        assertEquals(TextNode.valueOf("{broken"), interpolator.interpolateToJson("{broken", context));
        assertEquals(TextNode.valueOf("Ada"), interpolator.interpolateToJson("${name}", context));
    }

    @Test
    @DisplayName("resolveReference accepts wrapped and bare paths")
    void resolveReference() {
        assertEquals("Ada", interpolator.resolveReference("${name}", context).orElseThrow().asText());
        assertEquals("first", interpolator.resolveReference("users[0].name", context).orElseThrow().asText());
        assertTrue(interpolator.resolveReference(null, context).isEmpty());
    }

    @Test
    @DisplayName("path splitting normalises brackets to dots")
    void splitPath() {
        assertEquals(List.of("a", "0", "b c"), TemplateInterpolator.splitPath("a[0]['b c']"));
    }
}
