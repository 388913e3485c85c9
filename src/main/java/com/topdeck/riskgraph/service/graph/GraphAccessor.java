package com.topdeck.riskgraph.service.graph;

import com.topdeck.riskgraph.dto.graph.DependencyEdge;
import com.topdeck.riskgraph.dto.graph.RelationshipKind;
import com.topdeck.riskgraph.dto.graph.Resource;
import com.topdeck.riskgraph.exception.GraphAccessException;
import com.topdeck.riskgraph.exception.ResourceNotFoundException;

import java.util.List;
import java.util.Set;

/**
 * Read-only view of the resource graph. Implementations must be side-effect-free and
 * return edges in a deterministic order for an unchanged graph.
 *
 * @throws ResourceNotFoundException when the requested id is not in the graph
 * @throws GraphAccessException      when the backing store cannot be read
 */
public interface GraphAccessor {

    Resource getNode(String resourceId);

    /**
     * Edges whose source is {@code resourceId}.
     *
     * @param kinds relationship kinds to keep; {@code null} or empty keeps all
     */
    List<DependencyEdge> getOutgoingEdges(String resourceId, Set<RelationshipKind> kinds);

    /**
     * Edges whose target is {@code resourceId}.
     *
     * @param kinds relationship kinds to keep; {@code null} or empty keeps all
     */
    List<DependencyEdge> getIncomingEdges(String resourceId, Set<RelationshipKind> kinds);

    /**
     * Ids of every resource that is the target of at least one edge, in id order.
     */
    List<String> findResourceIdsWithDependents();

    default List<DependencyEdge> getOutgoingEdges(String resourceId) {
        return getOutgoingEdges(resourceId, null);
    }

    default List<DependencyEdge> getIncomingEdges(String resourceId) {
        return getIncomingEdges(resourceId, null);
    }
}
