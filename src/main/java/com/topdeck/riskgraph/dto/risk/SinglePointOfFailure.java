package com.topdeck.riskgraph.dto.risk;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SinglePointOfFailure {

    String resourceId;
    String resourceName;
    String resourceType;
    int dependentsCount;
    int blastRadius;
    double riskScore;

    @Builder.Default
    List<String> recommendations = List.of();
}
