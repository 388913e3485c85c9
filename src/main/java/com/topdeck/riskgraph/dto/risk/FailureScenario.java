package com.topdeck.riskgraph.dto.risk;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.topdeck.riskgraph.exception.InvalidConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Probability-weighted outcomes of one failure mode of a resource.
 * Outcome probabilities sum to 1.
 */
@Value
@Builder
public class FailureScenario {

    String resourceId;
    String resourceName;
    FailureType failureType;

    @Builder.Default
    List<Outcome> outcomes = List.of();

    ImpactLevel overallImpact;

    @Builder.Default
    List<String> mitigationStrategies = List.of();

    @Builder.Default
    List<String> monitoringRecommendations = List.of();

    @Builder.Default
    List<String> recoverySteps = List.of();

    public double totalProbability() {
        return outcomes.stream().mapToDouble(Outcome::getProbability).sum();
    }

    @Value
    @Builder
    public static class Outcome {
        OutcomeType outcomeType;
        double probability;
        double durationSeconds;
        double affectedPercentage;
        String userImpactDescription;
        String technicalDetails;
    }

    public enum FailureType {
        DEGRADED_PERFORMANCE,
        INTERMITTENT_FAILURE,
        PARTIAL_OUTAGE,     // some zones or instances down
        FULL_OUTAGE;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static FailureType fromValue(String value) {
            return Arrays.stream(values())
                    .filter(type -> type.name().equalsIgnoreCase(value) || type.value().equalsIgnoreCase(value))
                    .findFirst()
                    .orElseThrow(() -> new InvalidConfigurationException("Unknown failure type: " + value));
        }
    }

    public enum OutcomeType {
        DOWNTIME(5.0),
        PARTIAL_OUTAGE(4.0),
        CASCADING_FAILURE(4.0),
        ERROR_RATE(3.0),
        TIMEOUT(3.0),
        DEGRADED(2.0),
        BLIP(1.0),
        SELF_RECOVERY(0.5);

        private final double severityWeight;

        OutcomeType(double severityWeight) {
            this.severityWeight = severityWeight;
        }

        public double getSeverityWeight() {
            return severityWeight;
        }

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
