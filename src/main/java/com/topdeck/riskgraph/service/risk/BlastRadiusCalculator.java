package com.topdeck.riskgraph.service.risk;

import com.topdeck.riskgraph.config.RiskAnalysisProperties;
import com.topdeck.riskgraph.dto.graph.DependencyEdge;
import com.topdeck.riskgraph.dto.graph.Resource;
import com.topdeck.riskgraph.dto.graph.TraversalDirection;
import com.topdeck.riskgraph.dto.graph.TraversalResult;
import com.topdeck.riskgraph.dto.risk.BlastRadiusReport;
import com.topdeck.riskgraph.dto.risk.UserImpact;
import com.topdeck.riskgraph.exception.InvalidConfigurationException;
import com.topdeck.riskgraph.service.graph.DependencyTraverser;
import com.topdeck.riskgraph.service.graph.GraphAccessor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Computes which resources are affected when a resource fails.
 * <p>
 * Downtime grows with the strength-weighted count of affected resources:
 * {@code base * (1 + weighted / scale)}, capped at the configured maximum. Each affected
 * resource weighs the product of edge strengths along its path to the failed resource.
 */
@Service
@Slf4j
public class BlastRadiusCalculator {

    private static final String UNKNOWN_TYPE = "unknown";

    private final DependencyTraverser traverser;
    private final GraphAccessor graphAccessor;
    private final RiskAnalysisProperties properties;

    public BlastRadiusCalculator(DependencyTraverser traverser, GraphAccessor graphAccessor,
                                 RiskAnalysisProperties properties) {
        RiskAnalysisProperties.Downtime downtime = properties.getDowntime();
        if (downtime.getScale() <= 0) {
            throw new InvalidConfigurationException("Downtime scale must be positive but was " + downtime.getScale());
        }
        if (downtime.getBaseSeconds() < 0 || downtime.getMaxSeconds() < downtime.getBaseSeconds()) {
            throw new InvalidConfigurationException("Downtime bounds are unusable: base=" + downtime.getBaseSeconds()
                    + ", max=" + downtime.getMaxSeconds());
        }
        RiskAnalysisProperties.Impact impact = properties.getImpact();
        if (impact.getLowMax() < 0 || impact.getLowMax() > impact.getMediumMax()) {
            throw new InvalidConfigurationException("User impact thresholds are unusable: low-max="
                    + impact.getLowMax() + ", medium-max=" + impact.getMediumMax());
        }
        this.traverser = traverser;
        this.graphAccessor = graphAccessor;
        this.properties = properties;
    }

    public BlastRadiusReport computeBlastRadius(String resourceId) {
        return computeBlastRadius(resourceId, properties.getMaxTraversalDepth(), null);
    }

    public BlastRadiusReport computeBlastRadius(String resourceId, int maxDepth) {
        return computeBlastRadius(resourceId, maxDepth, null);
    }

    /**
     * @param category when set, only edges of this category propagate the failure
     */
    public BlastRadiusReport computeBlastRadius(String resourceId, int maxDepth, String category) {
        log.info("Computing blast radius for {} (depth {}, category {})", resourceId, maxDepth,
                category != null ? category : "any");

        Resource origin = graphAccessor.getNode(resourceId);
        Predicate<DependencyEdge> filter = DependencyEdge::isImpactCarrying;
        if (category != null && !category.isBlank()) {
            filter = filter.and(edge -> category.equalsIgnoreCase(edge.getCategory()));
        }
        TraversalResult traversal = traverser.traverse(resourceId, TraversalDirection.INCOMING, maxDepth, filter);

        List<Resource> direct = new ArrayList<>();
        List<Resource> indirect = new ArrayList<>();
        Map<String, Integer> byType = new LinkedHashMap<>();
        double weighted = 0.0;
        int cascadeDepth = 0;
        TraversalResult.Entry critical = null;

        for (TraversalResult.Entry entry : traversal.getReached().values()) {
            Resource affected = graphAccessor.getNode(entry.getResourceId());
            if (entry.getDistance() == 1) {
                direct.add(affected);
            } else {
                indirect.add(affected);
            }
            String type = affected.getResourceType() != null ? affected.getResourceType() : UNKNOWN_TYPE;
            byType.merge(type, 1, Integer::sum);

            weighted += entry.getPathStrength();
            cascadeDepth = Math.max(cascadeDepth, entry.getDistance());
            if (isMoreCritical(entry, critical)) {
                critical = entry;
            }
        }

        int total = direct.size() + indirect.size();
        BlastRadiusReport report = BlastRadiusReport.builder()
                .resourceId(resourceId)
                .resourceName(origin.getName())
                .directlyAffected(List.copyOf(direct))
                .indirectlyAffected(List.copyOf(indirect))
                .totalAffected(total)
                .estimatedDowntimeSeconds(estimateDowntime(total, weighted))
                .criticalPath(critical != null ? pathBackToOrigin(resourceId, critical) : List.of(resourceId))
                .userImpact(classifyUserImpact(total))
                .cascadeDepth(cascadeDepth)
                .affectedByType(Collections.unmodifiableMap(byType))
                .build();

        log.info("Blast radius for {}: {} direct, {} indirect, downtime {}s, impact {}",
                resourceId, direct.size(), indirect.size(), report.getEstimatedDowntimeSeconds(),
                report.getUserImpact());
        return report;
    }

    double estimateDowntime(int totalAffected, double weightedAffected) {
        if (totalAffected == 0) {
            return 0.0;
        }
        RiskAnalysisProperties.Downtime downtime = properties.getDowntime();
        double estimate = downtime.getBaseSeconds() * (1 + weightedAffected / downtime.getScale());
        return Math.min(estimate, downtime.getMaxSeconds());
    }

    UserImpact classifyUserImpact(int totalAffected) {
        RiskAnalysisProperties.Impact impact = properties.getImpact();
        if (totalAffected <= impact.getLowMax()) {
            return UserImpact.LOW;
        }
        if (totalAffected <= impact.getMediumMax()) {
            return UserImpact.MEDIUM;
        }
        return UserImpact.HIGH;
    }

    // Farther wins, then the stronger chain; equal candidates keep the earlier discovery.
    private static boolean isMoreCritical(TraversalResult.Entry candidate, TraversalResult.Entry current) {
        if (current == null) {
            return true;
        }
        if (candidate.getDistance() != current.getDistance()) {
            return candidate.getDistance() > current.getDistance();
        }
        return candidate.getPathStrength() > current.getPathStrength();
    }

    private static List<String> pathBackToOrigin(String originId, TraversalResult.Entry entry) {
        List<String> ids = new ArrayList<>();
        ids.add(originId);
        String current = originId;
        for (DependencyEdge edge : entry.getPath()) {
            current = edge.otherEnd(current);
            ids.add(current);
        }
        Collections.reverse(ids);
        return List.copyOf(ids);
    }
}
