package com.topdeck.riskgraph.service.risk;

import com.topdeck.riskgraph.config.RiskAnalysisProperties;
import com.topdeck.riskgraph.dto.graph.Resource;
import com.topdeck.riskgraph.dto.risk.BlastRadiusReport;
import com.topdeck.riskgraph.dto.risk.RiskAssessment;
import com.topdeck.riskgraph.dto.risk.RiskAssessment.RiskLevel;
import com.topdeck.riskgraph.dto.risk.UserImpact;
import com.topdeck.riskgraph.service.graph.GraphAccessor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Maps detected risk conditions to human readable recommendations.
 * <p>
 * Rules are evaluated in table order and reported by priority; rules sharing a priority keep
 * their table order, so identical input always yields the same list.
 */
@Service
@Slf4j
public class RemediationRecommender {

    static final Set<String> NETWORK_TYPES = Set.of(
            "virtual_network", "subnet", "network_interface", "virtual_machine",
            "load_balancer", "application_gateway", "vpc");

    private final GraphAccessor graphAccessor;
    private final RiskAnalysisProperties properties;
    private final List<RemediationRule> rules;

    public RemediationRecommender(GraphAccessor graphAccessor, RiskAnalysisProperties properties) {
        this.graphAccessor = graphAccessor;
        this.properties = properties;
        this.rules = defaultRules();
    }

    public List<String> recommend(RiskAssessment assessment, BlastRadiusReport blastRadius) {
        return recommend(graphAccessor.getNode(assessment.getResourceId()), assessment, blastRadius);
    }

    public List<String> recommend(Resource resource, RiskAssessment assessment, BlastRadiusReport blastRadius) {
        RemediationRule.Context context = new RemediationRule.Context(resource, assessment, blastRadius, properties);

        List<RemediationRule> matched = new ArrayList<>();
        for (RemediationRule rule : rules) {
            if (rule.applies(context)) {
                matched.add(rule);
            }
        }
        matched.sort(Comparator.comparingInt(RemediationRule::getPriority));

        Set<String> recommendations = new LinkedHashSet<>();
        matched.forEach(rule -> recommendations.add(rule.render(context)));
        log.debug("Remediation rules matched for {}: {}", resource.getId(),
                matched.stream().map(RemediationRule::getName).toList());
        return List.copyOf(recommendations);
    }

    private static List<RemediationRule> defaultRules() {
        List<RemediationRule> table = new ArrayList<>();
        table.add(new RemediationRule("single-point-of-failure", 1,
                ctx -> ctx.getAssessment().isSinglePointOfFailure(),
                ctx -> "Single point of failure: add redundancy or failover capability for " + ctx.name()
                        + " by deploying redundant " + ctx.type() + " instances across availability zones"));
        table.add(new RemediationRule("high-fan-in", 2,
                ctx -> ctx.getAssessment().getDependentsCount() > ctx.getProperties().getHighFanInThreshold(),
                ctx -> "High dependency count (" + ctx.getAssessment().getDependentsCount() + " dependents): "
                        + "decouple consumers of " + ctx.name() + " with caching, queues or read replicas"));
        table.add(new RemediationRule("wide-blast-radius", 2,
                ctx -> ctx.getBlastRadius() != null && ctx.getBlastRadius().getUserImpact() == UserImpact.HIGH,
                ctx -> "Wide blast radius (" + ctx.getBlastRadius().getTotalAffected() + " affected resources): "
                        + "implement circuit breakers and fallback mechanisms in front of " + ctx.name()));
        table.add(new RemediationRule("backup-disabled", 3,
                ctx -> isFalse(ctx.getResource(), Resource.BACKUP_ENABLED),
                ctx -> "Enable automated backups for " + ctx.name() + " and verify restores regularly"));
        table.add(new RemediationRule("missing-network-security-group", 3,
                ctx -> isNetworkType(ctx.getResource())
                        && ctx.getResource().attribute(Resource.NETWORK_SECURITY_GROUP).filter(v -> !v.isBlank()).isEmpty(),
                ctx -> "Attach a network security group to " + ctx.name() + " to restrict inbound and outbound traffic"));
        table.add(new RemediationRule("secret-rotation-disabled", 3,
                ctx -> isFalse(ctx.getResource(), Resource.SECRET_ROTATION_ENABLED),
                ctx -> "Enable automatic secret rotation for " + ctx.name()));
        table.add(new RemediationRule("high-risk-canary", 4,
                ctx -> isAtLeast(ctx.getAssessment().getRiskLevel(), RiskLevel.HIGH),
                ctx -> "Implement canary deployments for changes to " + ctx.name() + " to minimize blast radius"));
        table.add(new RemediationRule("moderate-risk-monitoring", 5,
                ctx -> ctx.getAssessment().getRiskLevel() == RiskLevel.MEDIUM,
                ctx -> "Monitor " + ctx.name() + " closely during changes and be prepared to roll back"));
        return List.copyOf(table);
    }

    private static boolean isFalse(Resource resource, String flag) {
        Optional<Boolean> value = resource.flag(flag);
        return value.isPresent() && !value.get();
    }

    private static boolean isNetworkType(Resource resource) {
        return resource.getResourceType() != null
                && NETWORK_TYPES.contains(resource.getResourceType().toLowerCase(Locale.ROOT));
    }

    private static boolean isAtLeast(RiskLevel level, RiskLevel threshold) {
        return level != null && level.compareTo(threshold) >= 0;
    }
}
