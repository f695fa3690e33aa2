package com.flowkeeper.core.workflow;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A node's {@code onError} setting.
 *
 * @param strategy      defaults to {@link ErrorStrategy#FAIL}
 * @param fallbackValue merged into the context by {@link ErrorStrategy#FALLBACK}; an
 *                      object contributes its keys, anything else is stored under the node id
 * @param gotoNode      node visited by {@link ErrorStrategy#GOTO}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ErrorPolicy(ErrorStrategy strategy, JsonNode fallbackValue, String gotoNode) {

    public static final ErrorPolicy FAIL = new ErrorPolicy(ErrorStrategy.FAIL, null, null);

    public ErrorPolicy {
        if (strategy == null) {
            strategy = ErrorStrategy.FAIL;
        }
    }
}
