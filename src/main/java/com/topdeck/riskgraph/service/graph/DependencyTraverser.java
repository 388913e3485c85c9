package com.topdeck.riskgraph.service.graph;

import com.topdeck.riskgraph.dto.graph.DependencyEdge;
import com.topdeck.riskgraph.dto.graph.TraversalDirection;
import com.topdeck.riskgraph.dto.graph.TraversalResult;
import com.topdeck.riskgraph.exception.InvalidConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Bounded breadth-first walk over the resource graph.
 * <p>
 * Each reached resource is recorded once, at its minimum distance, with the path that first
 * reached it. Ties resolve to BFS discovery order, which follows the accessor's edge order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DependencyTraverser {

    public static final int DEFAULT_MAX_DEPTH = 5;

    private final GraphAccessor graphAccessor;

    public TraversalResult traverse(String originId, TraversalDirection direction) {
        return traverse(originId, direction, DEFAULT_MAX_DEPTH, null, Set.of());
    }

    public TraversalResult traverse(String originId, TraversalDirection direction, int maxDepth) {
        return traverse(originId, direction, maxDepth, null, Set.of());
    }

    public TraversalResult traverse(String originId, TraversalDirection direction, int maxDepth,
                                    Predicate<DependencyEdge> edgeFilter) {
        return traverse(originId, direction, maxDepth, edgeFilter, Set.of());
    }

    /**
     * @param edgeFilter  edges to expand; {@code null} expands every edge
     * @param excludedIds resources the walk never enters
     */
    public TraversalResult traverse(String originId, TraversalDirection direction, int maxDepth,
                                    Predicate<DependencyEdge> edgeFilter, Set<String> excludedIds) {
        if (maxDepth < 0) {
            throw new InvalidConfigurationException("Traversal depth must not be negative but was " + maxDepth);
        }
        if (direction == null) {
            throw new InvalidConfigurationException("Traversal direction is required");
        }
        graphAccessor.getNode(originId);

        Predicate<DependencyEdge> filter = edgeFilter != null ? edgeFilter : edge -> true;
        Set<String> excluded = excludedIds != null ? excludedIds : Set.of();

        Map<String, TraversalResult.Entry> reached = new LinkedHashMap<>();
        Set<String> visited = new HashSet<>();
        visited.add(originId);

        Deque<TraversalResult.Entry> queue = new ArrayDeque<>();
        queue.add(new TraversalResult.Entry(originId, 0, List.of()));

        while (!queue.isEmpty()) {
            TraversalResult.Entry current = queue.poll();
            if (current.getDistance() >= maxDepth) {
                continue;
            }
            for (DependencyEdge edge : edgesOf(current.getResourceId(), direction)) {
                if (!filter.test(edge)) {
                    continue;
                }
                String neighbour = edge.otherEnd(current.getResourceId());
                if (excluded.contains(neighbour) || !visited.add(neighbour)) {
                    continue;
                }
                List<DependencyEdge> path = new ArrayList<>(current.getPath());
                path.add(edge);
                TraversalResult.Entry entry = new TraversalResult.Entry(neighbour, current.getDistance() + 1, path);
                reached.put(neighbour, entry);
                queue.add(entry);
            }
        }

        log.debug("Traversal from {} ({}, depth {}) reached {} resources",
                originId, direction, maxDepth, reached.size());
        return new TraversalResult(originId, direction, maxDepth, reached);
    }

    private List<DependencyEdge> edgesOf(String resourceId, TraversalDirection direction) {
        switch (direction) {
            case OUTGOING:
                return graphAccessor.getOutgoingEdges(resourceId);
            case INCOMING:
                return graphAccessor.getIncomingEdges(resourceId);
            default:
                List<DependencyEdge> edges = new ArrayList<>(graphAccessor.getOutgoingEdges(resourceId));
                edges.addAll(graphAccessor.getIncomingEdges(resourceId));
                return edges;
        }
    }
}
