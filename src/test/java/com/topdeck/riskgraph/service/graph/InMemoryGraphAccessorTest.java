package com.topdeck.riskgraph.service.graph;

import com.topdeck.riskgraph.dto.graph.DependencyEdge;
import com.topdeck.riskgraph.dto.graph.RelationshipKind;
import com.topdeck.riskgraph.exception.InvalidConfigurationException;
import com.topdeck.riskgraph.exception.ResourceNotFoundException;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static com.topdeck.riskgraph.service.graph.GraphFixtures.dependsOn;
import static com.topdeck.riskgraph.service.graph.GraphFixtures.edge;
import static com.topdeck.riskgraph.service.graph.GraphFixtures.graphOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryGraphAccessorTest {

    @Test
    void getNode_throwsNotFound_forUnknownId() {
        InMemoryGraphAccessor graph = graphOf("A");

        assertThatThrownBy(() -> graph.getNode("missing"))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("missing");
        assertThatThrownBy(() -> graph.getIncomingEdges("missing"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void edges_keepInsertionOrder() {
        InMemoryGraphAccessor graph = graphOf("A", "B", "C", "X")
                .addEdge(dependsOn("C", "X", 0.5))
                .addEdge(dependsOn("A", "X", 0.5))
                .addEdge(dependsOn("B", "X", 0.5));

        List<DependencyEdge> incoming = graph.getIncomingEdges("X");

        assertThat(incoming).extracting(DependencyEdge::getSourceId).containsExactly("C", "A", "B");
        assertThat(graph.getOutgoingEdges("A")).extracting(DependencyEdge::getTargetId).containsExactly("X");
    }

    @Test
    void edges_filteredByRelationshipKind() {
        InMemoryGraphAccessor graph = graphOf("A", "B", "C")
                .addEdge(dependsOn("A", "B", 1.0))
                .addEdge(edge("A", "C", RelationshipKind.REDUNDANT_WITH, "compute"));

        assertThat(graph.getOutgoingEdges("A", EnumSet.of(RelationshipKind.REDUNDANT_WITH)))
                .extracting(DependencyEdge::getTargetId)
                .containsExactly("C");
        assertThat(graph.getOutgoingEdges("A", RelationshipKind.impactKinds()))
                .extracting(DependencyEdge::getTargetId)
                .containsExactly("B");
        assertThat(graph.getOutgoingEdges("A", EnumSet.noneOf(RelationshipKind.class))).hasSize(2);
    }

    @Test
    void addEdge_rejectsUnknownEndpoint() {
        InMemoryGraphAccessor graph = graphOf("A");

        assertThatThrownBy(() -> graph.addEdge(dependsOn("A", "ghost", 1.0)))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void findResourceIdsWithDependents_listsTargetsInIdOrder() {
        InMemoryGraphAccessor graph = graphOf("web", "db", "cache", "idle")
                .addEdge(dependsOn("web", "db", 1.0))
                .addEdge(dependsOn("web", "cache", 0.4));

        assertThat(graph.findResourceIdsWithDependents()).containsExactly("cache", "db");
    }
}
