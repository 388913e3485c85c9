package com.topdeck.riskgraph.service.graph;

import com.topdeck.riskgraph.dto.graph.DependencyEdge;
import com.topdeck.riskgraph.dto.graph.RelationshipKind;
import com.topdeck.riskgraph.dto.graph.Resource;
import com.topdeck.riskgraph.exception.GraphAccessException;
import com.topdeck.riskgraph.exception.InvalidConfigurationException;
import com.topdeck.riskgraph.exception.ResourceNotFoundException;
import com.topdeck.riskgraph.model.graph.nodes.ResourceNode;
import com.topdeck.riskgraph.repository.graph.ResourceNodeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Record;
import org.neo4j.driver.Value;
import org.neo4j.driver.exceptions.Neo4jException;
import org.springframework.dao.DataAccessException;
import org.springframework.data.neo4j.core.Neo4jClient;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Graph accessor over the Neo4j resource graph written by discovery.
 * Edges are ordered by the far endpoint id, then relationship type.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class Neo4jGraphAccessor implements GraphAccessor {

    private static final String OUTGOING_QUERY = """
            MATCH (s:Resource {id: $id})-[rel]->(t:Resource)
            RETURN s.id AS sourceId, t.id AS targetId, type(rel) AS type,
                   rel.category AS category, rel.strength AS strength
            ORDER BY t.id, type(rel)
            """;

    private static final String INCOMING_QUERY = """
            MATCH (s:Resource)-[rel]->(t:Resource {id: $id})
            RETURN s.id AS sourceId, t.id AS targetId, type(rel) AS type,
                   rel.category AS category, rel.strength AS strength
            ORDER BY s.id, type(rel)
            """;

    private final ResourceNodeRepository resourceNodeRepository;
    private final Neo4jClient neo4jClient;

    @Override
    public Resource getNode(String resourceId) {
        ResourceNode node = read("load resource " + resourceId,
                () -> resourceNodeRepository.findById(resourceId))
                .orElseThrow(() -> new ResourceNotFoundException(resourceId));
        return toResource(node);
    }

    @Override
    public List<DependencyEdge> getOutgoingEdges(String resourceId, Set<RelationshipKind> kinds) {
        return fetchEdges(resourceId, OUTGOING_QUERY, kinds, "outgoing");
    }

    @Override
    public List<DependencyEdge> getIncomingEdges(String resourceId, Set<RelationshipKind> kinds) {
        return fetchEdges(resourceId, INCOMING_QUERY, kinds, "incoming");
    }

    @Override
    public List<String> findResourceIdsWithDependents() {
        List<ResourceNode> nodes = read("list resources with dependents",
                resourceNodeRepository::findAllWithDependents);
        log.debug("Found {} resources with dependents", nodes.size());
        return nodes.stream().map(ResourceNode::getId).toList();
    }

    private List<DependencyEdge> fetchEdges(String resourceId, String cypher,
                                            Set<RelationshipKind> kinds, String direction) {
        boolean exists = read("check resource " + resourceId, () -> resourceNodeRepository.existsById(resourceId));
        if (!exists) {
            throw new ResourceNotFoundException(resourceId);
        }

        Map<String, Object> parameters = new HashMap<>();
        parameters.put("id", resourceId);

        Collection<DependencyEdge> edges = read("load " + direction + " edges of " + resourceId,
                () -> neo4jClient.query(cypher)
                        .bindAll(parameters)
                        .fetchAs(DependencyEdge.class)
                        .mappedBy((typeSystem, record) -> toEdge(record))
                        .all());

        List<DependencyEdge> filtered = edges.stream()
                .filter(edge -> kinds == null || kinds.isEmpty() || kinds.contains(edge.getRelationshipKind()))
                .toList();
        log.debug("Resource {} has {} {} edges ({} after kind filter)",
                resourceId, edges.size(), direction, filtered.size());
        return filtered;
    }

    private <T> T read(String operation, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException | Neo4jException e) {
            log.error("Graph store failed to {}: {}", operation, e.getMessage(), e);
            throw new GraphAccessException("Failed to " + operation, e);
        }
    }

    private DependencyEdge toEdge(Record record) {
        String sourceId = record.get("sourceId").asString();
        String targetId = record.get("targetId").asString();
        try {
            return DependencyEdge.builder()
                    .sourceId(sourceId)
                    .targetId(targetId)
                    .relationshipKind(RelationshipKind.fromType(record.get("type").asString()))
                    .category(nullableString(record.get("category")))
                    .strength(record.get("strength").isNull() ? null : record.get("strength").asDouble())
                    .build();
        } catch (InvalidConfigurationException e) {
            throw new GraphAccessException("Stored edge " + sourceId + " -> " + targetId + " is malformed", e);
        }
    }

    private static String nullableString(Value value) {
        return value.isNull() ? null : value.asString();
    }

    private Resource toResource(ResourceNode node) {
        Map<String, String> attributes = new HashMap<>();
        if (node.getBackupEnabled() != null) {
            attributes.put(Resource.BACKUP_ENABLED, node.getBackupEnabled().toString());
        }
        if (node.getNetworkSecurityGroup() != null) {
            attributes.put(Resource.NETWORK_SECURITY_GROUP, node.getNetworkSecurityGroup());
        }
        if (node.getSecretRotationEnabled() != null) {
            attributes.put(Resource.SECRET_ROTATION_ENABLED, node.getSecretRotationEnabled().toString());
        }
        return Resource.builder()
                .id(node.getId())
                .name(node.getName() != null ? node.getName() : node.getId())
                .resourceType(node.getResourceType())
                .cloudProvider(node.getCloudProvider())
                .region(node.getRegion())
                .attributes(Map.copyOf(attributes))
                .build();
    }
}
