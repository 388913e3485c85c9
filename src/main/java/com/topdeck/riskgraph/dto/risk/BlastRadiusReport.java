package com.topdeck.riskgraph.dto.risk;

import com.topdeck.riskgraph.dto.graph.Resource;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * What would be affected if a resource fails.
 * Direct and indirect lists are disjoint and listed in discovery order.
 */
@Value
@Builder
public class BlastRadiusReport {

    String resourceId;
    String resourceName;

    @Builder.Default
    List<Resource> directlyAffected = List.of();     // distance 1

    @Builder.Default
    List<Resource> indirectlyAffected = List.of();   // distance 2+

    int totalAffected;
    double estimatedDowntimeSeconds;

    /**
     * Resource ids from the most distant, most strongly coupled dependent back to {@link #resourceId}.
     */
    @Builder.Default
    List<String> criticalPath = List.of();

    UserImpact userImpact;
    int cascadeDepth;

    @Builder.Default
    Map<String, Integer> affectedByType = Map.of();
}
