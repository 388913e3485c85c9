package com.topdeck.riskgraph.dto.graph;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Relationship types between resources. For impact-carrying kinds the source
 * depends on the target, so a failure of the target propagates to the source.
 */
public enum RelationshipKind {
    DEPENDS_ON(true),
    USES(true),
    CONNECTS_TO(true),
    ROUTES_TO(true),
    ACCESSES(true),
    AUTHENTICATES_WITH(true),
    READS_FROM(true),
    WRITES_TO(true),
    REDUNDANT_WITH(false),  // failover partner, not a dependency
    OTHER(false);

    private final boolean impactCarrying;

    RelationshipKind(boolean impactCarrying) {
        this.impactCarrying = impactCarrying;
    }

    public boolean isImpactCarrying() {
        return impactCarrying;
    }

    public static Set<RelationshipKind> impactKinds() {
        EnumSet<RelationshipKind> kinds = EnumSet.noneOf(RelationshipKind.class);
        Arrays.stream(values()).filter(RelationshipKind::isImpactCarrying).forEach(kinds::add);
        return kinds;
    }

    /**
     * Map a stored relationship type onto a kind; unknown types become {@link #OTHER}.
     */
    public static RelationshipKind fromType(String type) {
        if (type == null || type.isBlank()) {
            return OTHER;
        }
        String normalized = type.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(kind -> kind.name().equals(normalized))
                .findFirst()
                .orElse(OTHER);
    }
}
