package com.flowkeeper.core.nodes;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Set;

/**
 * Implementation of one node type. Every handler bean is picked up by the
 * {@link NodeHandlerRegistry}.
 */
public interface NodeHandler {

    String type();

    /** Additional type tags served by this handler, e.g. snake_case spellings. */
    default Set<String> aliases() {
        return Set.of();
    }

    ObjectNode execute(ObjectNode config, ObjectNode context);
}
