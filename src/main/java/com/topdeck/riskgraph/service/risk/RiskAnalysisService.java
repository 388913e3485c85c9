package com.topdeck.riskgraph.service.risk;

import com.topdeck.riskgraph.dto.risk.BlastRadiusReport;
import com.topdeck.riskgraph.dto.risk.ComprehensiveRiskReport;
import com.topdeck.riskgraph.dto.risk.FailureScenario;
import com.topdeck.riskgraph.dto.risk.FailureScenario.FailureType;
import com.topdeck.riskgraph.dto.risk.RiskAssessment;
import com.topdeck.riskgraph.dto.risk.SinglePointOfFailure;
import com.topdeck.riskgraph.service.graph.GraphAccessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Entry point for risk analysis that combines the individual analyzers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RiskAnalysisService {

    static final double ASSESSMENT_WEIGHT = 0.6;
    static final double SCENARIO_WEIGHT = 0.4;

    private final GraphAccessor graphAccessor;
    private final BlastRadiusCalculator blastRadiusCalculator;
    private final RiskScorer riskScorer;
    private final FailureScenarioSimulator simulator;

    public RiskAssessment analyzeResource(String resourceId) {
        return riskScorer.assessRisk(resourceId);
    }

    public double getChangeRiskScore(String resourceId) {
        return riskScorer.assessRisk(resourceId).getRiskScore();
    }

    /**
     * Assessment, blast radius and all three failure scenarios for one resource.
     * The combined score weighs the standard assessment against the degraded scenario.
     */
    public ComprehensiveRiskReport getComprehensiveRiskAnalysis(String resourceId) {
        log.info("Building comprehensive risk report for {}", resourceId);
        BlastRadiusReport blastRadius = blastRadiusCalculator.computeBlastRadius(resourceId);
        RiskAssessment assessment = riskScorer.assessRisk(resourceId, blastRadius);

        FailureScenario outage = simulator.simulate(resourceId, FailureType.FULL_OUTAGE, blastRadius);
        FailureScenario degraded = simulator.simulate(resourceId, FailureType.DEGRADED_PERFORMANCE, blastRadius);
        FailureScenario intermittent = simulator.simulate(resourceId, FailureType.INTERMITTENT_FAILURE, blastRadius);

        double combined = ASSESSMENT_WEIGHT * assessment.getRiskScore()
                + SCENARIO_WEIGHT * degraded.getOverallImpact().getRiskScore();

        Set<String> recommendations = new LinkedHashSet<>(assessment.getRecommendations());
        recommendations.addAll(first(degraded.getMitigationStrategies(), 3));
        recommendations.addAll(first(degraded.getMonitoringRecommendations(), 2));
        recommendations.addAll(first(intermittent.getMitigationStrategies(), 3));

        log.info("Comprehensive risk for {}: combined score {}", resourceId, combined);
        return ComprehensiveRiskReport.builder()
                .resourceId(resourceId)
                .combinedRiskScore(combined)
                .assessment(assessment)
                .blastRadius(blastRadius)
                .outageScenario(outage)
                .degradedScenario(degraded)
                .intermittentScenario(intermittent)
                .allRecommendations(List.copyOf(recommendations))
                .build();
    }

    /**
     * Every resource with dependents that is a single point of failure, most dependents first.
     */
    public List<SinglePointOfFailure> identifySinglePointsOfFailure() {
        List<String> candidates = graphAccessor.findResourceIdsWithDependents();
        log.info("Checking {} resources with dependents for single points of failure", candidates.size());

        List<SinglePointOfFailure> spofs = new ArrayList<>();
        for (String resourceId : candidates) {
            RiskAssessment assessment = riskScorer.assessRisk(resourceId);
            if (!assessment.isSinglePointOfFailure()) {
                continue;
            }
            spofs.add(SinglePointOfFailure.builder()
                    .resourceId(resourceId)
                    .resourceName(assessment.getResourceName())
                    .resourceType(assessment.getResourceType())
                    .dependentsCount(assessment.getDependentsCount())
                    .blastRadius(assessment.getBlastRadius())
                    .riskScore(assessment.getRiskScore())
                    .recommendations(assessment.getRecommendations())
                    .build());
        }
        spofs.sort(Comparator.comparingInt(SinglePointOfFailure::getDependentsCount).reversed()
                .thenComparing(SinglePointOfFailure::getResourceId));

        log.info("Found {} single points of failure", spofs.size());
        return spofs;
    }

    private static List<String> first(List<String> items, int count) {
        return items.subList(0, Math.min(count, items.size()));
    }
}
