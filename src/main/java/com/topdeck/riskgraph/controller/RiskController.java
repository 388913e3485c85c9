package com.topdeck.riskgraph.controller;

import com.topdeck.riskgraph.config.RiskAnalysisProperties;
import com.topdeck.riskgraph.dto.graph.DependencyEdge;
import com.topdeck.riskgraph.dto.graph.TraversalDirection;
import com.topdeck.riskgraph.dto.graph.TraversalResult;
import com.topdeck.riskgraph.dto.risk.BlastRadiusReport;
import com.topdeck.riskgraph.dto.risk.ComprehensiveRiskReport;
import com.topdeck.riskgraph.dto.risk.FailureScenario;
import com.topdeck.riskgraph.dto.risk.RiskAssessment;
import com.topdeck.riskgraph.dto.risk.SimulationRequest;
import com.topdeck.riskgraph.dto.risk.SinglePointOfFailure;
import com.topdeck.riskgraph.service.graph.DependencyTraverser;
import com.topdeck.riskgraph.service.risk.BlastRadiusCalculator;
import com.topdeck.riskgraph.service.risk.FailureScenarioSimulator;
import com.topdeck.riskgraph.service.risk.RiskAnalysisService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * REST controller for blast radius and risk analysis of discovered resources.
 */
@RestController
@RequestMapping("/api/v1/risk")
@RequiredArgsConstructor
@Slf4j
public class RiskController {

    private final RiskAnalysisService riskAnalysisService;
    private final BlastRadiusCalculator blastRadiusCalculator;
    private final FailureScenarioSimulator failureScenarioSimulator;
    private final DependencyTraverser dependencyTraverser;
    private final RiskAnalysisProperties properties;

    /**
     * Risk assessment of a single resource, including recommendations.
     */
    @GetMapping("/resources/{resourceId}")
    public ResponseEntity<RiskAssessment> getResourceRisk(@PathVariable String resourceId) {
        log.info("Getting risk assessment for resource: {}", resourceId);
        return ResponseEntity.ok(riskAnalysisService.analyzeResource(resourceId));
    }

    @GetMapping("/resources/{resourceId}/score")
    public ResponseEntity<Map<String, Object>> getChangeRiskScore(@PathVariable String resourceId) {
        log.info("Getting change risk score for resource: {}", resourceId);
        double score = riskAnalysisService.getChangeRiskScore(resourceId);
        return ResponseEntity.ok(Map.of("resourceId", resourceId, "riskScore", score));
    }

    @GetMapping("/resources/{resourceId}/comprehensive")
    public ResponseEntity<ComprehensiveRiskReport> getComprehensiveRisk(@PathVariable String resourceId) {
        log.info("Getting comprehensive risk analysis for resource: {}", resourceId);
        return ResponseEntity.ok(riskAnalysisService.getComprehensiveRiskAnalysis(resourceId));
    }

    /**
     * Resources affected if the given resource fails.
     *
     * @param maxDepth maximum cascade depth (default: configured traversal depth)
     * @param category optional edge category to restrict propagation to
     */
    @GetMapping("/blast-radius/{resourceId}")
    public ResponseEntity<BlastRadiusReport> getBlastRadius(
            @PathVariable String resourceId,
            @RequestParam(required = false) Integer maxDepth,
            @RequestParam(required = false) String category) {
        log.info("Getting blast radius for resource: {}, maxDepth: {}, category: {}", resourceId, maxDepth, category);
        int depth = maxDepth != null ? maxDepth : properties.getMaxTraversalDepth();
        return ResponseEntity.ok(blastRadiusCalculator.computeBlastRadius(resourceId, depth, category));
    }

    /**
     * Raw dependency walk. Direction accepts outgoing/upstream, incoming/downstream or both.
     */
    @GetMapping("/dependencies/{resourceId}")
    public ResponseEntity<TraversalResult> getDependencies(
            @PathVariable String resourceId,
            @RequestParam(required = false) String direction,
            @RequestParam(required = false) Integer maxDepth,
            @RequestParam(required = false) String category) {
        log.info("Getting dependencies for resource: {}, direction: {}, maxDepth: {}", resourceId, direction, maxDepth);
        int depth = maxDepth != null ? maxDepth : properties.getMaxTraversalDepth();
        Predicate<DependencyEdge> filter = category == null || category.isBlank()
                ? null
                : edge -> category.equalsIgnoreCase(edge.getCategory());
        TraversalResult result = dependencyTraverser.traverse(resourceId, TraversalDirection.fromParam(direction),
                depth, filter);
        return ResponseEntity.ok(result);
    }

    @PostMapping("/simulate")
    public ResponseEntity<FailureScenario> simulateFailure(@Valid @RequestBody SimulationRequest request) {
        log.info("Simulating {} for resource: {}", request.getFailureType(), request.getResourceId());
        return ResponseEntity.ok(failureScenarioSimulator.simulate(request.getResourceId(), request.getFailureType()));
    }

    @GetMapping("/spof")
    public ResponseEntity<List<SinglePointOfFailure>> getSinglePointsOfFailure() {
        log.info("Identifying single points of failure");
        return ResponseEntity.ok(riskAnalysisService.identifySinglePointsOfFailure());
    }
}
