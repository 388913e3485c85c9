package com.topdeck.riskgraph.dto.graph;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * A discovered resource (cloud resource, Kubernetes object, identity) as seen by the analysis.
 */
@Value
@Builder
public class Resource {

    public static final String BACKUP_ENABLED = "backup_enabled";
    public static final String NETWORK_SECURITY_GROUP = "network_security_group";
    public static final String SECRET_ROTATION_ENABLED = "secret_rotation_enabled";

    String id;
    String name;
    String resourceType;
    String cloudProvider;
    String region;

    /**
     * Configuration signals reported by discovery, keyed by the names above.
     */
    @Builder.Default
    Map<String, String> attributes = Map.of();

    public Optional<String> attribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    /**
     * Empty when the signal was not reported at all.
     */
    public Optional<Boolean> flag(String key) {
        return attribute(key).map(Boolean::parseBoolean);
    }
}
