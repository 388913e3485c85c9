package com.topdeck.riskgraph.exception;

/**
 * Analysis input or configuration that cannot be used as given, e.g. a negative
 * traversal depth or a scenario table whose probabilities do not sum to 1.
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
