package com.flowkeeper.core.llm;

/**
 * Thrown when a model call fails or returns nothing usable.
 */
public class LlmException extends RuntimeException {

    public LlmException(String message) {
        super(message);
    }

    public LlmException(String message, Throwable cause) {
        super(message, cause);
    }
}
