package com.topdeck.riskgraph.dto.graph;

import com.topdeck.riskgraph.exception.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DependencyEdgeTest {

    @Test
    void builder_rejectsStrengthOutsideUnitRange() {
        assertThatThrownBy(() -> DependencyEdge.builder().sourceId("api").targetId("db").strength(1.5).build())
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("1.5")
                .hasMessageContaining("api -> db");
        assertThatThrownBy(() -> DependencyEdge.builder().sourceId("api").targetId("db").strength(-0.1).build())
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> DependencyEdge.builder().sourceId("api").targetId("db").strength(Double.NaN).build())
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void builder_acceptsBoundaryStrengthsAndAppliesDefaults() {
        DependencyEdge weakest = DependencyEdge.builder().sourceId("api").targetId("db").strength(0.0).build();
        DependencyEdge unset = DependencyEdge.builder().sourceId("api").targetId("db").build();

        assertThat(weakest.getStrength()).isZero();
        assertThat(unset.getStrength()).isEqualTo(1.0);
        assertThat(unset.getCategory()).isEqualTo(DependencyEdge.DEFAULT_CATEGORY);
        assertThat(unset.getRelationshipKind()).isEqualTo(RelationshipKind.DEPENDS_ON);
    }

    @Test
    void builder_requiresBothEndpoints() {
        assertThatThrownBy(() -> DependencyEdge.builder().sourceId("api").build())
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void relationshipKind_fromType_normalizesAndFallsBackToOther() {
        assertThat(RelationshipKind.fromType(" reads_from ")).isEqualTo(RelationshipKind.READS_FROM);
        assertThat(RelationshipKind.fromType("weird")).isEqualTo(RelationshipKind.OTHER);
        assertThat(RelationshipKind.fromType("")).isEqualTo(RelationshipKind.OTHER);
        assertThat(RelationshipKind.fromType(null)).isEqualTo(RelationshipKind.OTHER);
        assertThat(RelationshipKind.impactKinds())
                .doesNotContain(RelationshipKind.REDUNDANT_WITH, RelationshipKind.OTHER)
                .contains(RelationshipKind.DEPENDS_ON, RelationshipKind.AUTHENTICATES_WITH);
    }

    @Test
    void traversalDirection_fromParam_rejectsUnknownDirection() {
        assertThat(TraversalDirection.fromParam(null)).isEqualTo(TraversalDirection.INCOMING);
        assertThat(TraversalDirection.fromParam("Upstream")).isEqualTo(TraversalDirection.OUTGOING);
        assertThatThrownBy(() -> TraversalDirection.fromParam("sideways"))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("sideways");
    }
}
