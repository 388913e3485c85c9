package com.topdeck.riskgraph.config;

import com.topdeck.riskgraph.dto.risk.FailureScenario.FailureType;
import com.topdeck.riskgraph.dto.risk.FailureScenario.OutcomeType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Tunable constants for the blast-radius and risk analysis, bound from {@code topdeck.analysis.*}.
 * All weighting constants live here so they can be tuned without code changes.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "topdeck.analysis")
public class RiskAnalysisProperties {

    @Min(0)
    private int maxTraversalDepth = 5;

    /**
     * A resource can only be a SPOF when its dependents count exceeds this value.
     */
    @Min(0)
    private int spofFanInThreshold = 0;

    /**
     * Dependents count above which decoupling is recommended.
     */
    @Min(0)
    private int highFanInThreshold = 10;

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Downtime downtime = new Downtime();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Impact impact = new Impact();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Scoring scoring = new Scoring();

    /**
     * Outcome tables for the partial failure modes. Full outages are not table driven.
     */
    @NotNull
    private Map<FailureType, List<OutcomePolicy>> scenarios = defaultScenarios();

    @Data
    public static class Downtime {
        private double baseSeconds = 300;
        @Positive
        private double scale = 2.0;
        private double maxSeconds = 3600;
    }

    @Data
    public static class Impact {
        private int lowMax = 5;
        private int mediumMax = 15;
    }

    @Data
    public static class Scoring {
        @Positive
        private double dependentsNormalization = 50;
        private double dependentsWeight = 50;
        private double spofBonus = 30;
        private double strengthWeight = 20;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OutcomePolicy {
        private OutcomeType outcomeType;
        private double probability;
        private double durationFactor;      // multiplied with the estimated downtime, at least the base downtime
        private double affectedPercentage;
    }

    private static Map<FailureType, List<OutcomePolicy>> defaultScenarios() {
        Map<FailureType, List<OutcomePolicy>> tables = new EnumMap<>(FailureType.class);
        tables.put(FailureType.DEGRADED_PERFORMANCE, new ArrayList<>(List.of(
                new OutcomePolicy(OutcomeType.DEGRADED, 0.6, 0.5, 40),
                new OutcomePolicy(OutcomeType.CASCADING_FAILURE, 0.3, 1.5, 80),
                new OutcomePolicy(OutcomeType.SELF_RECOVERY, 0.1, 0.05, 5))));
        tables.put(FailureType.INTERMITTENT_FAILURE, new ArrayList<>(List.of(
                new OutcomePolicy(OutcomeType.BLIP, 0.6, 0.1, 5),
                new OutcomePolicy(OutcomeType.ERROR_RATE, 0.3, 0.25, 10),
                new OutcomePolicy(OutcomeType.CASCADING_FAILURE, 0.1, 1.0, 60))));
        // one of three availability zones lost; the survivors carry all traffic
        tables.put(FailureType.PARTIAL_OUTAGE, new ArrayList<>(List.of(
                new OutcomePolicy(OutcomeType.PARTIAL_OUTAGE, 0.8, 3.0, 33.3),
                new OutcomePolicy(OutcomeType.DEGRADED, 0.2, 6.0, 66.7))));
        return tables;
    }
}
