package com.topdeck.riskgraph.dto.risk;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Standard assessment plus every failure scenario for one resource.
 */
@Value
@Builder
public class ComprehensiveRiskReport {

    String resourceId;
    double combinedRiskScore;
    RiskAssessment assessment;
    BlastRadiusReport blastRadius;
    FailureScenario outageScenario;
    FailureScenario degradedScenario;
    FailureScenario intermittentScenario;

    @Builder.Default
    List<String> allRecommendations = List.of();
}
