package com.flowkeeper.core.nodes;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.flowkeeper.core.substrate.TestWorkflows.MAPPER;
import static org.junit.jupiter.api.Assertions.*;

class NodeHandlersTest {

    private TemplateInterpolator interpolator;
    private ObjectNode context;

    @BeforeEach
    void setUp() throws Exception {
        interpolator = new TemplateInterpolator(MAPPER);
        context = (ObjectNode) MAPPER.readTree("""
                {
                  "name": "Ada",
                  "raw": "{\\"k\\": [1, 2]}",
                  "people": [ { "name": "b", "age": 30 }, { "name": "a", "age": 4 }, { "name": "c" } ],
                  "base": { "x": 1 },
                  "extra": { "y": 2 },
                  "more": [3]
                }
                """);
    }

    private static ObjectNode cfg(String json) throws Exception {
        return (ObjectNode) MAPPER.readTree(json);
    }

    @Nested
    @DisplayName("echo and output")
    class EchoAndOutput {

        @Test
        @DisplayName("echo interpolates its message into outputVariable")
        void echo() throws Exception {
            ObjectNode out = new EchoNodeHandler(interpolator)
                    .execute(cfg("{\"message\": \"Hi ${name}\", \"outputVariable\": \"greeting\"}"), context);
            assertEquals("Hi Ada", out.get("greeting").asText());
        }

        @Test
        @DisplayName("output keeps literal JSON values and parses interpolated objects")
        void output() throws Exception {
            var handler = new OutputNodeHandler(interpolator);
            assertEquals(5, handler.execute(cfg("{\"outputName\": \"n\", \"value\": 5}"), context).get("n").asInt());
            assertEquals(1, handler.execute(cfg("{\"outputName\": \"o\", \"value\": \"${base}\"}"), context)
                    .get("o").get("x").asInt());
            assertTrue(handler.execute(cfg("{}"), context).get("output").isNull());
        }
    }

    @Nested
    @DisplayName("variable")
    class Variable {

        private VariableNodeHandler handler;

        @BeforeEach
        void setUp() {
            handler = new VariableNodeHandler(interpolator, MAPPER);
        }

        @Test
        @DisplayName("set converts to the declared value type")
        void setTyped() throws Exception {
            assertEquals(42L, handler.execute(cfg("""
                    {"variableName": "n", "value": "42", "valueType": "number"}"""), context).get("n").asLong());
            assertTrue(handler.execute(cfg("""
                    {"variableName": "b", "value": "true", "valueType": "boolean"}"""), context).get("b").asBoolean());
            assertEquals("Ada", handler.execute(cfg("""
                    {"variableName": "s", "value": "${name}"}"""), context).get("s").asText());
        }

        @Test
        @DisplayName("get copies from the context and delete returns nothing")
        void getAndDelete() throws Exception {
            assertEquals("Ada", handler.execute(cfg("""
                    {"variableName": "name", "operation": "get"}"""), context).get("name").asText());
            assertTrue(handler.execute(cfg("""
                    {"variableName": "name", "operation": "delete"}"""), context).isEmpty());
        }

        @Test
        @DisplayName("invalid configuration fails the node")
        void invalid() {
            assertThrows(NodeExecutionException.class, () -> handler.execute(cfg("{}"), context));
            assertThrows(NodeExecutionException.class, () -> handler.execute(cfg("""
                    {"variableName": "n", "scope": "user"}"""), context));
            assertThrows(NodeExecutionException.class, () -> handler.execute(cfg("""
                    {"variableName": "n", "value": "abc", "valueType": "number"}"""), context));
        }
    }

    @Nested
    @DisplayName("transform")
    class Transform {

        private TransformNodeHandler handler;

        @BeforeEach
        void setUp() {
            handler = new TransformNodeHandler(interpolator, MAPPER);
        }

        @Test
        @DisplayName("parseJSON parses a string value")
        void parseJson() throws Exception {
            ObjectNode out = handler.execute(cfg("""
                    {"operation": "parseJSON", "inputData": "${raw}", "outputVariable": "parsed"}"""), context);
            assertEquals(2, out.get("parsed").get("k").get(1).asInt());
        }

        @Test
        @DisplayName("extract follows a path inside the input")
        void extract() throws Exception {
            ObjectNode out = handler.execute(cfg("""
                    {"operation": "extract", "inputData": "${people}", "expression": "[1].name"}"""), context);
            assertEquals("a", out.get("result").asText());
        }

        @Test
        @DisplayName("extract returns a detached copy and null for a missing path")
        void extractCopies() throws Exception {
            ObjectNode out = handler.execute(cfg("""
                    {"operation": "extract", "inputData": "${people}", "expression": "[0]", "outputVariable": "first"}"""),
                    context);
            ((ObjectNode) out.get("first")).put("name", "changed");
            assertEquals("b", context.get("people").get(0).get("name").asText());

            ObjectNode missing = handler.execute(cfg("""
                    {"operation": "extract", "inputData": "${people}", "expression": "[7].name"}"""), context);
            assertTrue(missing.get("result").isNull());
        }

        @Test
        @DisplayName("sort orders numerically with missing values first")
        void sort() throws Exception {
            ObjectNode out = handler.execute(cfg("""
                    {"operation": "sort", "inputData": "${people}", "expression": "age"}"""), context);
            List<String> names = new java.util.ArrayList<>();
            out.get("result").forEach(p -> names.add(p.get("name").asText()));
            assertEquals(List.of("c", "a", "b"), names);
        }

        @Test
        @DisplayName("merge combines referenced objects into the input object")
        void merge() throws Exception {
            ObjectNode out = handler.execute(cfg("""
                    {"operation": "merge", "inputData": "${base}", "expression": "${extra}"}"""), context);
            assertEquals(1, out.get("result").get("x").asInt());
            assertEquals(2, out.get("result").get("y").asInt());
        }

        @Test
        @DisplayName("unsupported operations fail")
        void unsupported() {
            var ex = assertThrows(NodeExecutionException.class, () -> handler.execute(cfg("""
                    {"operation": "map", "inputData": "${people}"}"""), context));
            assertEquals("Unsupported transform operation: map", ex.getMessage());
        }
    }
}
