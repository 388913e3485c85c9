package com.topdeck.riskgraph.dto.risk;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Locale;

/**
 * Risk assessment for a single resource.
 */
@Value
@Builder(toBuilder = true)
public class RiskAssessment {

    String resourceId;
    String resourceName;
    String resourceType;

    /**
     * 0 - 100
     */
    double riskScore;
    RiskLevel riskLevel;

    int dependenciesCount;      // fan-out
    int dependentsCount;        // fan-in
    int blastRadius;
    boolean singlePointOfFailure;
    boolean hasRedundancy;

    @Builder.Default
    List<String> recommendations = List.of();

    public enum RiskLevel {
        LOW,
        MEDIUM,
        HIGH,
        CRITICAL;

        public static RiskLevel fromScore(double score) {
            if (score >= 75) return CRITICAL;
            if (score >= 50) return HIGH;
            if (score >= 25) return MEDIUM;
            return LOW;
        }

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
