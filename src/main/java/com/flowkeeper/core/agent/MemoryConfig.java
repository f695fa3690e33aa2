package com.flowkeeper.core.agent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Conversation memory settings. Only {@code buffer} memory is supported:
 * the most recent {@code maxMessages} entries survive a checkpoint.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MemoryConfig(String type, int maxMessages) {

    public static final int DEFAULT_MAX_MESSAGES = 20;

    public static MemoryConfig defaults() {
        return new MemoryConfig("buffer", DEFAULT_MAX_MESSAGES);
    }

    public MemoryConfig {
        if (type == null || type.isBlank()) {
            type = "buffer";
        }
        if (maxMessages < 1) {
            maxMessages = DEFAULT_MAX_MESSAGES;
        }
    }
}
