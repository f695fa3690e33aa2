package com.flowkeeper.core.nodes;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * {@code variable}: set, get or delete a workflow-scoped variable.
 * <p>
 * Only workflow scope exists; the context is the store. Because node results
 * are merged into the context, {@code delete} returns nothing and the variable
 * keeps its last value.
 */
@Component
public class VariableNodeHandler implements NodeHandler {

    private static final Logger log = LoggerFactory.getLogger(VariableNodeHandler.class);

    private final TemplateInterpolator interpolator;
    private final ObjectMapper objectMapper;

    public VariableNodeHandler(TemplateInterpolator interpolator, ObjectMapper objectMapper) {
        this.interpolator = interpolator;
        this.objectMapper = objectMapper;
    }

    @Override
    public String type() {
        return "variable";
    }

    @Override
    public ObjectNode execute(ObjectNode config, ObjectNode context) {
        String name = config.path("variableName").asText("");
        if (name.isBlank()) {
            throw new NodeExecutionException("Variable node requires 'variableName'");
        }
        String scope = config.path("scope").asText("workflow");
        if (!"workflow".equals(scope) && !"temporary".equals(scope)) {
            throw new NodeExecutionException("Storage for scope '" + scope + "' not available");
        }

        String operation = config.path("operation").asText("set");
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        switch (operation) {
            case "set" -> {
                String raw = interpolator.interpolate(config.path("value").asText(""), context);
                JsonNode value = convert(raw, config.path("valueType").asText("auto"));
                result.set(name, value);
                log.debug("Set '{}'", name);
            }
            case "get" -> {
                JsonNode value = context.get(name);
                result.set(name, value != null ? value.deepCopy() : JsonNodeFactory.instance.nullNode());
            }
            case "delete" -> log.debug("Deleted '{}'", name);
            default -> throw new NodeExecutionException("Unsupported variable operation: " + operation);
        }
        return result;
    }

    private JsonNode convert(String raw, String valueType) {
        switch (valueType) {
            case "number":
                try {
                    BigDecimal number = new BigDecimal(raw.trim());
                    return number.scale() <= 0 && number.abs().compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) <= 0
                            ? JsonNodeFactory.instance.numberNode(number.longValueExact())
                            : JsonNodeFactory.instance.numberNode(number.doubleValue());
                } catch (NumberFormatException | ArithmeticException e) {
                    throw new NodeExecutionException("Cannot convert '" + raw + "' to number", e);
                }
            case "boolean":
                return BooleanNode.valueOf("true".equals(raw));
            case "json":
                try {
                    return objectMapper.readTree(raw);
                } catch (JsonProcessingException e) {
                    throw new NodeExecutionException("Invalid JSON for variable: " + e.getOriginalMessage(), e);
                }
            default:
                return TextNode.valueOf(raw);
        }
    }
}
