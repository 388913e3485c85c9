package com.topdeck.riskgraph.model.graph.nodes;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.neo4j.core.schema.Id;
import org.springframework.data.neo4j.core.schema.Node;
import org.springframework.data.neo4j.core.schema.Property;

/**
 * Resource node as written by the discovery connectors. Ids are assigned by discovery,
 * so there is no generated value. Relationships are read through {@code Neo4jClient}.
 */
@Node("Resource")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceNode {

    @Id
    private String id;

    @Property("name")
    private String name;

    @Property("resource_type")
    private String resourceType;

    @Property("cloud_provider")
    private String cloudProvider;

    @Property("region")
    private String region;

    @Property("backup_enabled")
    private Boolean backupEnabled;

    @Property("network_security_group")
    private String networkSecurityGroup;

    @Property("secret_rotation_enabled")
    private Boolean secretRotationEnabled;
}
