package com.topdeck.riskgraph.dto.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resources reached by one traversal, in BFS discovery order, each recorded once at its minimum distance.
 * The origin is never part of {@link #getReached()}.
 */
@Value
public class TraversalResult {

    String originId;
    TraversalDirection direction;
    int maxDepth;
    Map<String, Entry> reached;

    public TraversalResult(String originId, TraversalDirection direction, int maxDepth,
                           Map<String, Entry> reached) {
        this.originId = originId;
        this.direction = direction;
        this.maxDepth = maxDepth;
        this.reached = Collections.unmodifiableMap(new LinkedHashMap<>(reached));
    }

    public boolean contains(String resourceId) {
        return reached.containsKey(resourceId);
    }

    public Entry get(String resourceId) {
        return reached.get(resourceId);
    }

    public int size() {
        return reached.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return reached.isEmpty();
    }

    @Value
    public static class Entry {
        String resourceId;
        int distance;
        List<DependencyEdge> path;  // edges walked from the origin, in order

        public Entry(String resourceId, int distance, List<DependencyEdge> path) {
            this.resourceId = resourceId;
            this.distance = distance;
            this.path = List.copyOf(path);
        }

        public DependencyEdge getViaEdge() {
            return path.get(0);
        }

        /**
         * Product of edge strengths along the path; a weak link weakens everything behind it.
         */
        public double getPathStrength() {
            double product = 1.0;
            for (DependencyEdge edge : path) {
                product *= edge.getStrength();
            }
            return product;
        }
    }
}
