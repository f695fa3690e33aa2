package com.flowkeeper.core.nodes;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code transform}: reshapes the value referenced by {@code inputData} and
 * stores the result under {@code outputVariable}.
 * <p>
 * Operations: {@code parseJSON}, {@code extract} (path in {@code expression}),
 * {@code sort} (by the property path in {@code expression}) and {@code merge}
 * (the {@code ${...}} references in {@code expression} are merged into the input:
 * object keys for objects, elements for arrays).
 */
@Component
public class TransformNodeHandler implements NodeHandler {

    private static final Pattern REFERENCE = Pattern.compile("\\$\\{[^}]+}");

    private final TemplateInterpolator interpolator;
    private final ObjectMapper objectMapper;

    public TransformNodeHandler(TemplateInterpolator interpolator, ObjectMapper objectMapper) {
        this.interpolator = interpolator;
        this.objectMapper = objectMapper;
    }

    @Override
    public String type() {
        return "transform";
    }

    @Override
    public ObjectNode execute(ObjectNode config, ObjectNode context) {
        String operation = config.path("operation").asText("");
        String expression = config.path("expression").asText("");
        String outputVariable = config.path("outputVariable").asText("result");
        JsonNode input = interpolator.resolveReference(config.path("inputData").asText(""), context)
                .orElse(MissingNode.getInstance());

        JsonNode result = switch (operation) {
            case "parseJSON" -> parseJson(input);
            case "extract" -> interpolator.resolve(input, expression)
                    .<JsonNode>map(JsonNode::deepCopy)
                    .orElse(JsonNodeFactory.instance.nullNode());
            case "sort" -> sort(input, expression);
            case "merge" -> merge(input, expression, context);
            default -> throw new NodeExecutionException("Unsupported transform operation: " + operation);
        };

        ObjectNode out = JsonNodeFactory.instance.objectNode();
        out.set(outputVariable, result);
        return out;
    }

    private JsonNode parseJson(JsonNode input) {
        if (!input.isTextual()) {
            throw new NodeExecutionException("parseJSON requires string input");
        }
        try {
            return objectMapper.readTree(input.asText());
        } catch (JsonProcessingException e) {
            throw new NodeExecutionException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private JsonNode sort(JsonNode input, String path) {
        if (!input.isArray()) {
            throw new NodeExecutionException("Sort operation requires array input");
        }
        List<JsonNode> items = new ArrayList<>();
        input.forEach(items::add);
        items.sort(Comparator.comparing(
                (JsonNode item) -> interpolator.resolve(item, path).orElse(MissingNode.getInstance()),
                TransformNodeHandler::compareValues));
        ArrayNode sorted = JsonNodeFactory.instance.arrayNode();
        items.forEach(item -> sorted.add(item.deepCopy()));
        return sorted;
    }

    private JsonNode merge(JsonNode input, String expression, ObjectNode context) {
        List<JsonNode> values = new ArrayList<>();
        Matcher matcher = REFERENCE.matcher(expression);
        while (matcher.find()) {
            interpolator.resolveReference(matcher.group(), context).ifPresent(values::add);
        }

        if (input.isArray()) {
            ArrayNode merged = (ArrayNode) input.deepCopy();
            values.stream().filter(JsonNode::isArray).forEach(v -> merged.addAll((ArrayNode) v.deepCopy()));
            return merged;
        }
        ObjectNode merged = input.isObject() ? (ObjectNode) input.deepCopy() : JsonNodeFactory.instance.objectNode();
        values.stream().filter(JsonNode::isObject).forEach(v -> merged.setAll((ObjectNode) v.deepCopy()));
        return merged;
    }

    /** Numbers numerically, everything else by text; missing values sort first. */
    private static int compareValues(JsonNode a, JsonNode b) {
        if (a.isMissingNode() || b.isMissingNode()) {
            return Boolean.compare(!a.isMissingNode(), !b.isMissingNode());
        }
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue());
        }
        return a.asText().compareTo(b.asText());
    }
}
