package com.flowkeeper.core.nodes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

/**
 * {@code output}: publishes {@code value} under {@code outputName}. A value that
 * interpolates to a JSON object or array literal is stored parsed.
 */
@Component
public class OutputNodeHandler implements NodeHandler {

    private final TemplateInterpolator interpolator;

    public OutputNodeHandler(TemplateInterpolator interpolator) {
        this.interpolator = interpolator;
    }

    @Override
    public String type() {
        return "output";
    }

    @Override
    public ObjectNode execute(ObjectNode config, ObjectNode context) {
        String outputName = config.path("outputName").asText("output");
        JsonNode value = config.get("value");

        JsonNode resolved;
        if (value == null || value.isNull()) {
            resolved = JsonNodeFactory.instance.nullNode();
        } else if (value.isTextual()) {
            resolved = interpolator.interpolateToJson(value.asText(), context);
        } else {
            resolved = value.deepCopy();
        }

        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.set(outputName, resolved);
        return result;
    }
}
