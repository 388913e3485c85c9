package com.topdeck.riskgraph.dto.graph;

import com.topdeck.riskgraph.exception.InvalidConfigurationException;

import java.util.Locale;

public enum TraversalDirection {
    OUTGOING,   // what the origin depends on
    INCOMING,   // what depends on the origin
    BOTH;

    public static TraversalDirection fromParam(String value) {
        if (value == null || value.isBlank()) {
            return INCOMING;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "outgoing", "upstream", "dependencies" -> OUTGOING;
            case "incoming", "downstream", "dependents" -> INCOMING;
            case "both" -> BOTH;
            default -> throw new InvalidConfigurationException("Unknown traversal direction: " + value);
        };
    }
}
