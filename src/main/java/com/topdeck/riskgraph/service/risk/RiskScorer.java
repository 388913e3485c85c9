package com.topdeck.riskgraph.service.risk;

import com.topdeck.riskgraph.config.RiskAnalysisProperties;
import com.topdeck.riskgraph.dto.graph.DependencyEdge;
import com.topdeck.riskgraph.dto.graph.RelationshipKind;
import com.topdeck.riskgraph.dto.graph.Resource;
import com.topdeck.riskgraph.dto.graph.TraversalDirection;
import com.topdeck.riskgraph.dto.graph.TraversalResult;
import com.topdeck.riskgraph.dto.risk.BlastRadiusReport;
import com.topdeck.riskgraph.dto.risk.RiskAssessment;
import com.topdeck.riskgraph.service.graph.DependencyTraverser;
import com.topdeck.riskgraph.service.graph.GraphAccessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Scores how risky it is to change or lose a resource.
 * <p>
 * {@code score = min(dependents / normalization, 1) * dependentsWeight + (spof ? spofBonus : 0)
 * + averageOutgoingStrength * strengthWeight}, clamped to [0, 100].
 * <p>
 * A resource is a single point of failure when its dependents exceed the fan-in threshold and
 * at least one direct dependent cannot reach the resource's upstream chain, or one of its
 * failover partners, once the resource is removed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RiskScorer {

    private static final Set<RelationshipKind> REDUNDANCY = EnumSet.of(RelationshipKind.REDUNDANT_WITH);

    private final GraphAccessor graphAccessor;
    private final DependencyTraverser traverser;
    private final BlastRadiusCalculator blastRadiusCalculator;
    private final RemediationRecommender recommender;
    private final RiskAnalysisProperties properties;

    public RiskAssessment assessRisk(String resourceId) {
        return assessRisk(resourceId, blastRadiusCalculator.computeBlastRadius(resourceId));
    }

    /**
     * Assess with an already computed blast radius for the same resource.
     */
    public RiskAssessment assessRisk(String resourceId, BlastRadiusReport blastRadius) {
        log.info("Assessing risk for {}", resourceId);
        Resource resource = graphAccessor.getNode(resourceId);

        Set<RelationshipKind> impactKinds = RelationshipKind.impactKinds();
        List<DependencyEdge> incoming = graphAccessor.getIncomingEdges(resourceId, impactKinds);
        List<DependencyEdge> outgoing = graphAccessor.getOutgoingEdges(resourceId, impactKinds);

        Set<String> dependents = distinctOtherEnds(resourceId, incoming);
        Set<String> dependencies = distinctOtherEnds(resourceId, outgoing);
        Set<String> partners = redundancyPartners(resourceId);

        boolean spof = isSinglePointOfFailure(resourceId, dependents, dependencies, partners);
        double averageStrength = outgoing.stream().mapToDouble(DependencyEdge::getStrength).average().orElse(0.0);
        double score = calculateRiskScore(dependents.size(), spof, averageStrength);

        RiskAssessment assessment = RiskAssessment.builder()
                .resourceId(resourceId)
                .resourceName(resource.getName())
                .resourceType(resource.getResourceType())
                .riskScore(score)
                .riskLevel(RiskAssessment.RiskLevel.fromScore(score))
                .dependenciesCount(dependencies.size())
                .dependentsCount(dependents.size())
                .blastRadius(blastRadius.getTotalAffected())
                .singlePointOfFailure(spof)
                .hasRedundancy(!partners.isEmpty())
                .build();

        List<String> recommendations = recommender.recommend(resource, assessment, blastRadius);
        log.info("Risk for {}: score {} ({}), {} dependents, spof {}",
                resourceId, score, assessment.getRiskLevel(), dependents.size(), spof);
        return assessment.toBuilder().recommendations(recommendations).build();
    }

    public double calculateRiskScore(int dependentsCount, boolean singlePointOfFailure, double averageOutgoingStrength) {
        RiskAnalysisProperties.Scoring scoring = properties.getScoring();
        double fanIn = Math.min(dependentsCount / scoring.getDependentsNormalization(), 1.0)
                * scoring.getDependentsWeight();
        double spofBonus = singlePointOfFailure ? scoring.getSpofBonus() : 0.0;
        double strength = averageOutgoingStrength * scoring.getStrengthWeight();
        return Math.max(0.0, Math.min(100.0, fanIn + spofBonus + strength));
    }

    private boolean isSinglePointOfFailure(String resourceId, Set<String> dependents,
                                           Set<String> dependencies, Set<String> partners) {
        if (dependents.size() <= properties.getSpofFanInThreshold()) {
            return false;
        }
        for (String dependent : dependents) {
            if (losesUpstreamChain(resourceId, dependent, dependencies, partners)) {
                log.debug("{} loses its upstream chain without {}", dependent, resourceId);
                return true;
            }
        }
        return false;
    }

    // Re-walk the dependent's own dependencies with the resource removed.
    private boolean losesUpstreamChain(String resourceId, String dependent,
                                       Set<String> dependencies, Set<String> partners) {
        TraversalResult upstream = traverser.traverse(dependent, TraversalDirection.OUTGOING,
                properties.getMaxTraversalDepth(), DependencyEdge::isImpactCarrying, Set.of(resourceId));

        boolean reachesPartner = partners.stream()
                .anyMatch(partner -> partner.equals(dependent) || upstream.contains(partner));
        if (reachesPartner) {
            return false;
        }
        boolean reachesAllDependencies = !dependencies.isEmpty() && dependencies.stream()
                .allMatch(dependency -> dependency.equals(dependent) || upstream.contains(dependency));
        return !reachesAllDependencies;
    }

    private Set<String> redundancyPartners(String resourceId) {
        Set<String> partners = new LinkedHashSet<>();
        partners.addAll(distinctOtherEnds(resourceId, graphAccessor.getOutgoingEdges(resourceId, REDUNDANCY)));
        partners.addAll(distinctOtherEnds(resourceId, graphAccessor.getIncomingEdges(resourceId, REDUNDANCY)));
        return partners;
    }

    private static Set<String> distinctOtherEnds(String resourceId, List<DependencyEdge> edges) {
        Set<String> ids = new LinkedHashSet<>();
        for (DependencyEdge edge : edges) {
            String other = edge.otherEnd(resourceId);
            if (!other.equals(resourceId)) {
                ids.add(other);
            }
        }
        return ids;
    }
}
