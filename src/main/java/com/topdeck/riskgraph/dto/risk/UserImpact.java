package com.topdeck.riskgraph.dto.risk;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum UserImpact {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
