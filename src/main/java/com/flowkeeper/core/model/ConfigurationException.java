package com.flowkeeper.core.model;

import com.flowkeeper.core.substrate.NonRetryable;

/**
 * Invalid or missing configuration: a malformed workflow definition, an
 * unknown agent, an agent the caller does not own. Fatal for the run and
 * surfaced to the caller; never retried.
 */
public class ConfigurationException extends RuntimeException implements NonRetryable {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
