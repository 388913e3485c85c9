package com.topdeck.riskgraph.exception;

/**
 * The graph store could not be read (unreachable, timed out, query failure).
 * Never converted into an empty result.
 */
public class GraphAccessException extends RuntimeException {

    public GraphAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
