package com.topdeck.riskgraph.repository.graph;

import com.topdeck.riskgraph.model.graph.nodes.ResourceNode;
import org.springframework.data.neo4j.repository.Neo4jRepository;
import org.springframework.data.neo4j.repository.query.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ResourceNodeRepository extends Neo4jRepository<ResourceNode, String> {

    @Query("MATCH (r:Resource) WHERE EXISTS { MATCH (r)<--(:Resource) } " +
           "RETURN r ORDER BY r.id")
    List<ResourceNode> findAllWithDependents();
}
