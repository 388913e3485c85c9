package com.topdeck.riskgraph.dto.risk;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Overall impact of a failure scenario, also used to derive a scenario risk score.
 */
public enum ImpactLevel {
    MINIMAL(10),
    LOW(25),
    MEDIUM(50),
    HIGH(75),
    SEVERE(95);

    private final int riskScore;

    ImpactLevel(int riskScore) {
        this.riskScore = riskScore;
    }

    public int getRiskScore() {
        return riskScore;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
