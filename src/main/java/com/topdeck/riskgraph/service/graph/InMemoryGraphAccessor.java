package com.topdeck.riskgraph.service.graph;

import com.topdeck.riskgraph.dto.graph.DependencyEdge;
import com.topdeck.riskgraph.dto.graph.RelationshipKind;
import com.topdeck.riskgraph.dto.graph.Resource;
import com.topdeck.riskgraph.exception.InvalidConfigurationException;
import com.topdeck.riskgraph.exception.ResourceNotFoundException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Adjacency-list graph held in memory. Edges are returned in insertion order.
 * Populate it fully before sharing it between threads.
 */
public class InMemoryGraphAccessor implements GraphAccessor {

    private final Map<String, Resource> nodes = new LinkedHashMap<>();
    private final Map<String, List<DependencyEdge>> outgoing = new LinkedHashMap<>();
    private final Map<String, List<DependencyEdge>> incoming = new LinkedHashMap<>();

    public InMemoryGraphAccessor addResource(Resource resource) {
        nodes.put(resource.getId(), resource);
        outgoing.putIfAbsent(resource.getId(), new ArrayList<>());
        incoming.putIfAbsent(resource.getId(), new ArrayList<>());
        return this;
    }

    public InMemoryGraphAccessor addEdge(DependencyEdge edge) {
        if (!nodes.containsKey(edge.getSourceId()) || !nodes.containsKey(edge.getTargetId())) {
            throw new InvalidConfigurationException(
                    "Edge " + edge.getSourceId() + " -> " + edge.getTargetId() + " references an unknown resource");
        }
        outgoing.get(edge.getSourceId()).add(edge);
        incoming.get(edge.getTargetId()).add(edge);
        return this;
    }

    @Override
    public Resource getNode(String resourceId) {
        Resource resource = nodes.get(resourceId);
        if (resource == null) {
            throw new ResourceNotFoundException(resourceId);
        }
        return resource;
    }

    @Override
    public List<DependencyEdge> getOutgoingEdges(String resourceId, Set<RelationshipKind> kinds) {
        requireExists(resourceId);
        return filter(outgoing.get(resourceId), kinds);
    }

    @Override
    public List<DependencyEdge> getIncomingEdges(String resourceId, Set<RelationshipKind> kinds) {
        requireExists(resourceId);
        return filter(incoming.get(resourceId), kinds);
    }

    @Override
    public List<String> findResourceIdsWithDependents() {
        Set<String> ids = new TreeSet<>();
        incoming.forEach((id, edges) -> {
            if (!edges.isEmpty()) {
                ids.add(id);
            }
        });
        return new ArrayList<>(ids);
    }

    private void requireExists(String resourceId) {
        if (!nodes.containsKey(resourceId)) {
            throw new ResourceNotFoundException(resourceId);
        }
    }

    private List<DependencyEdge> filter(List<DependencyEdge> edges, Set<RelationshipKind> kinds) {
        if (kinds == null || kinds.isEmpty()) {
            return List.copyOf(edges);
        }
        return edges.stream()
                .filter(edge -> kinds.contains(edge.getRelationshipKind()))
                .toList();
    }
}
