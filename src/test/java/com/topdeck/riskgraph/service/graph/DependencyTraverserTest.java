package com.topdeck.riskgraph.service.graph;

import com.topdeck.riskgraph.dto.graph.DependencyEdge;
import com.topdeck.riskgraph.dto.graph.RelationshipKind;
import com.topdeck.riskgraph.dto.graph.TraversalDirection;
import com.topdeck.riskgraph.dto.graph.TraversalResult;
import com.topdeck.riskgraph.exception.InvalidConfigurationException;
import com.topdeck.riskgraph.exception.ResourceNotFoundException;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static com.topdeck.riskgraph.service.graph.GraphFixtures.chain;
import static com.topdeck.riskgraph.service.graph.GraphFixtures.dependsOn;
import static com.topdeck.riskgraph.service.graph.GraphFixtures.edge;
import static com.topdeck.riskgraph.service.graph.GraphFixtures.graphOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DependencyTraverserTest {

    @Test
    void traverse_incoming_recordsDistanceAndPath() {
        DependencyTraverser traverser = new DependencyTraverser(chain());

        TraversalResult result = traverser.traverse("C", TraversalDirection.INCOMING, 5);

        assertThat(result.getReached().keySet()).containsExactly("B", "A");
        assertThat(result.get("B").getDistance()).isEqualTo(1);
        assertThat(result.get("A").getDistance()).isEqualTo(2);
        assertThat(result.get("A").getPath())
                .extracting(DependencyEdge::getSourceId)
                .containsExactly("B", "A");
        assertThat(result.get("A").getViaEdge().getTargetId()).isEqualTo("C");
        assertThat(result.contains("C")).isFalse();
    }

    @Test
    void traverse_terminatesOnCycleThroughOrigin() {
        InMemoryGraphAccessor graph = graphOf("A", "B", "C")
                .addEdge(dependsOn("A", "B", 1.0))
                .addEdge(dependsOn("B", "C", 1.0))
                .addEdge(dependsOn("C", "A", 1.0));
        DependencyTraverser traverser = new DependencyTraverser(graph);

        TraversalResult result = traverser.traverse("A", TraversalDirection.OUTGOING, 50);

        assertThat(result.getReached().keySet()).containsExactly("B", "C");
    }

    @Test
    void traverse_keepsMinimumDistance() {
        // X is reached directly and through B
        InMemoryGraphAccessor graph = graphOf("O", "B", "X")
                .addEdge(dependsOn("O", "B", 1.0))
                .addEdge(dependsOn("B", "X", 1.0))
                .addEdge(dependsOn("O", "X", 0.2));
        DependencyTraverser traverser = new DependencyTraverser(graph);

        TraversalResult result = traverser.traverse("O", TraversalDirection.OUTGOING, 5);

        assertThat(result.get("X").getDistance()).isEqualTo(1);
        assertThat(result.get("X").getPathStrength()).isEqualTo(0.2);
    }

    @Test
    void traverse_tieGoesToFirstDiscoveredPath() {
        InMemoryGraphAccessor graph = graphOf("O", "L", "R", "T")
                .addEdge(dependsOn("O", "L", 1.0))
                .addEdge(dependsOn("O", "R", 1.0))
                .addEdge(dependsOn("R", "T", 1.0))
                .addEdge(dependsOn("L", "T", 1.0));
        DependencyTraverser traverser = new DependencyTraverser(graph);

        TraversalResult result = traverser.traverse("O", TraversalDirection.OUTGOING, 5);

        assertThat(result.get("T").getPath()).extracting(DependencyEdge::getSourceId).containsExactly("O", "L");
    }

    @Test
    void traverse_respectsDepthBound() {
        DependencyTraverser traverser = new DependencyTraverser(chain());

        assertThat(traverser.traverse("C", TraversalDirection.INCOMING, 1).getReached().keySet())
                .containsExactly("B");
        assertThat(traverser.traverse("C", TraversalDirection.INCOMING, 0).isEmpty()).isTrue();
        assertThat(traverser.traverse("C", TraversalDirection.INCOMING, 2).size())
                .isGreaterThanOrEqualTo(traverser.traverse("C", TraversalDirection.INCOMING, 1).size());
    }

    @Test
    void traverse_rejectsNegativeDepth() {
        DependencyTraverser traverser = new DependencyTraverser(chain());

        assertThatThrownBy(() -> traverser.traverse("C", TraversalDirection.INCOMING, -1))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void traverse_unknownOrigin_throwsNotFound() {
        DependencyTraverser traverser = new DependencyTraverser(chain());

        assertThatThrownBy(() -> traverser.traverse("nope", TraversalDirection.BOTH, 3))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void traverse_both_followsEdgesEitherWay() {
        DependencyTraverser traverser = new DependencyTraverser(chain());

        TraversalResult result = traverser.traverse("B", TraversalDirection.BOTH, 1);

        assertThat(result.getReached().keySet()).containsExactly("C", "A");
    }

    @Test
    void traverse_honoursEdgeFilterAndExclusions() {
        InMemoryGraphAccessor graph = graphOf("db", "api", "batch", "web")
                .addEdge(edge("api", "db", RelationshipKind.READS_FROM, "data"))
                .addEdge(edge("batch", "db", RelationshipKind.CONNECTS_TO, "network"))
                .addEdge(edge("web", "api", RelationshipKind.USES, "data"));
        DependencyTraverser traverser = new DependencyTraverser(graph);

        TraversalResult dataOnly = traverser.traverse("db", TraversalDirection.INCOMING, 5,
                e -> "data".equals(e.getCategory()));
        TraversalResult withoutApi = traverser.traverse("db", TraversalDirection.INCOMING, 5, null, Set.of("api"));

        assertThat(dataOnly.getReached().keySet()).containsExactly("api", "web");
        assertThat(withoutApi.getReached().keySet()).containsExactly("batch");
    }
}
