package com.flowkeeper.core.nodes;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

@Component
public class EchoNodeHandler implements NodeHandler {

    private final TemplateInterpolator interpolator;

    public EchoNodeHandler(TemplateInterpolator interpolator) {
        this.interpolator = interpolator;
    }

    @Override
    public String type() {
        return "echo";
    }

    @Override
    public ObjectNode execute(ObjectNode config, ObjectNode context) {
        String outputVariable = config.path("outputVariable").asText("echo");
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put(outputVariable, interpolator.interpolate(config.path("message").asText(""), context));
        return result;
    }
}
