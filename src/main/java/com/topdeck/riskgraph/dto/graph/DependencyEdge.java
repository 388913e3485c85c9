package com.topdeck.riskgraph.dto.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.topdeck.riskgraph.exception.InvalidConfigurationException;
import lombok.Builder;
import lombok.Value;

/**
 * Directed relationship: {@code sourceId} depends on, connects to or is secured by {@code targetId}.
 */
@Value
public class DependencyEdge {

    public static final String DEFAULT_CATEGORY = "dependency";

    String sourceId;
    String targetId;
    String category;
    double strength;            // 0.0 - 1.0, higher is more critical
    RelationshipKind relationshipKind;

    @Builder
    private DependencyEdge(String sourceId, String targetId, String category,
                           Double strength, RelationshipKind relationshipKind) {
        if (sourceId == null || targetId == null) {
            throw new InvalidConfigurationException("Dependency edge requires both source and target ids");
        }
        double value = strength != null ? strength : 1.0;
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new InvalidConfigurationException(
                    "Edge strength must be within [0, 1] but was " + value + " for " + sourceId + " -> " + targetId);
        }
        this.sourceId = sourceId;
        this.targetId = targetId;
        this.category = category != null ? category : DEFAULT_CATEGORY;
        this.strength = value;
        this.relationshipKind = relationshipKind != null ? relationshipKind : RelationshipKind.DEPENDS_ON;
    }

    @JsonIgnore
    public boolean isImpactCarrying() {
        return relationshipKind.isImpactCarrying();
    }

    /**
     * The endpoint that is not {@code resourceId}.
     */
    public String otherEnd(String resourceId) {
        return sourceId.equals(resourceId) ? targetId : sourceId;
    }
}
