package com.topdeck.riskgraph.service.risk;

import com.topdeck.riskgraph.config.RiskAnalysisProperties;
import com.topdeck.riskgraph.config.RiskAnalysisProperties.OutcomePolicy;
import com.topdeck.riskgraph.dto.graph.Resource;
import com.topdeck.riskgraph.dto.risk.BlastRadiusReport;
import com.topdeck.riskgraph.dto.risk.FailureScenario;
import com.topdeck.riskgraph.dto.risk.FailureScenario.FailureType;
import com.topdeck.riskgraph.dto.risk.FailureScenario.Outcome;
import com.topdeck.riskgraph.dto.risk.FailureScenario.OutcomeType;
import com.topdeck.riskgraph.dto.risk.ImpactLevel;
import com.topdeck.riskgraph.exception.InvalidConfigurationException;
import com.topdeck.riskgraph.service.graph.GraphAccessor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a blast radius into probability-weighted failure outcomes.
 * <p>
 * A full outage is a single certain downtime outcome. Degraded, intermittent and partial failures
 * come from the configured outcome tables, whose durations scale the estimated downtime but never
 * drop below the base downtime. A resource without dependents cannot cascade, so its table loses
 * the cascading outcomes and the remaining probabilities are rescaled to sum to 1.
 */
@Service
@Slf4j
public class FailureScenarioSimulator {

    static final double PROBABILITY_TOLERANCE = 1e-6;

    static final List<FailureType> TABLE_DRIVEN = List.of(
            FailureType.DEGRADED_PERFORMANCE, FailureType.INTERMITTENT_FAILURE, FailureType.PARTIAL_OUTAGE);

    private final BlastRadiusCalculator blastRadiusCalculator;
    private final GraphAccessor graphAccessor;
    private final double baseDowntimeSeconds;
    private final Map<FailureType, List<OutcomePolicy>> tables;

    public FailureScenarioSimulator(BlastRadiusCalculator blastRadiusCalculator, GraphAccessor graphAccessor,
                                    RiskAnalysisProperties properties) {
        this.blastRadiusCalculator = blastRadiusCalculator;
        this.graphAccessor = graphAccessor;
        this.baseDowntimeSeconds = properties.getDowntime().getBaseSeconds();
        this.tables = validateTables(properties.getScenarios());
    }

    public FailureScenario simulate(String resourceId, FailureType failureType) {
        return simulate(resourceId, failureType, blastRadiusCalculator.computeBlastRadius(resourceId));
    }

    /**
     * Simulate from an already computed blast radius of the same resource.
     */
    public FailureScenario simulate(String resourceId, FailureType failureType, BlastRadiusReport blastRadius) {
        if (failureType == null) {
            throw new InvalidConfigurationException("Failure type is required");
        }
        log.info("Simulating {} of {}", failureType.value(), resourceId);
        Resource resource = graphAccessor.getNode(resourceId);

        List<Outcome> outcomes = failureType == FailureType.FULL_OUTAGE
                ? List.of(fullOutage(resource, blastRadius))
                : fromTable(resource, blastRadius, tables.get(failureType));

        FailureScenario scenario = FailureScenario.builder()
                .resourceId(resourceId)
                .resourceName(resource.getName())
                .failureType(failureType)
                .outcomes(outcomes)
                .overallImpact(overallImpact(outcomes))
                .mitigationStrategies(mitigationStrategies(failureType, resource, blastRadius))
                .monitoringRecommendations(monitoringRecommendations(failureType, resource))
                .recoverySteps(failureType == FailureType.FULL_OUTAGE
                        ? recoverySteps(resource, blastRadius) : List.of())
                .build();

        log.info("Scenario {} for {}: {} outcomes, overall impact {}",
                failureType.value(), resourceId, outcomes.size(), scenario.getOverallImpact());
        return scenario;
    }

    static ImpactLevel overallImpact(List<Outcome> outcomes) {
        double weighted = outcomes.stream()
                .mapToDouble(o -> o.getProbability() * o.getOutcomeType().getSeverityWeight()
                        * (o.getAffectedPercentage() / 100.0))
                .sum();
        if (weighted >= 3.5) return ImpactLevel.SEVERE;
        if (weighted >= 2.5) return ImpactLevel.HIGH;
        if (weighted >= 1.5) return ImpactLevel.MEDIUM;
        if (weighted >= 0.5) return ImpactLevel.LOW;
        return ImpactLevel.MINIMAL;
    }

    private Outcome fullOutage(Resource resource, BlastRadiusReport blastRadius) {
        return Outcome.builder()
                .outcomeType(OutcomeType.DOWNTIME)
                .probability(1.0)
                .durationSeconds(blastRadius.getEstimatedDowntimeSeconds())
                .affectedPercentage(100.0)
                .userImpactDescription(describe(OutcomeType.DOWNTIME, 100.0))
                .technicalDetails(typeOf(resource) + " " + resource.getName() + " unavailable, "
                        + blastRadius.getTotalAffected() + " dependent resources affected")
                .build();
    }

    private List<Outcome> fromTable(Resource resource, BlastRadiusReport blastRadius, List<OutcomePolicy> table) {
        List<OutcomePolicy> policies = blastRadius.getTotalAffected() == 0 ? withoutCascade(table) : table;
        double duration = Math.max(blastRadius.getEstimatedDowntimeSeconds(), baseDowntimeSeconds);

        List<Outcome> outcomes = new ArrayList<>();
        for (OutcomePolicy policy : policies) {
            String outcomeName = policy.getOutcomeType().value().replace('_', ' ');
            outcomes.add(Outcome.builder()
                    .outcomeType(policy.getOutcomeType())
                    .probability(policy.getProbability())
                    .durationSeconds(duration * policy.getDurationFactor())
                    .affectedPercentage(policy.getAffectedPercentage())
                    .userImpactDescription(describe(policy.getOutcomeType(), policy.getAffectedPercentage()))
                    .technicalDetails(typeOf(resource) + " " + outcomeName + " reaching "
                            + blastRadius.getTotalAffected() + " dependent resources")
                    .build());
        }
        return List.copyOf(outcomes);
    }

    /**
     * Drops cascading outcomes and rescales the rest. A table made only of cascading outcomes
     * turns into the same outcomes confined to the resource itself.
     */
    static List<OutcomePolicy> withoutCascade(List<OutcomePolicy> table) {
        double remaining = table.stream()
                .filter(policy -> policy.getOutcomeType() != OutcomeType.CASCADING_FAILURE)
                .mapToDouble(OutcomePolicy::getProbability)
                .sum();
        List<OutcomePolicy> local = new ArrayList<>();
        for (OutcomePolicy policy : table) {
            if (remaining <= 0.0) {
                local.add(new OutcomePolicy(OutcomeType.DEGRADED, policy.getProbability(),
                        policy.getDurationFactor(), policy.getAffectedPercentage()));
            } else if (policy.getOutcomeType() != OutcomeType.CASCADING_FAILURE) {
                local.add(new OutcomePolicy(policy.getOutcomeType(), policy.getProbability() / remaining,
                        policy.getDurationFactor(), policy.getAffectedPercentage()));
            }
        }
        return local;
    }

    private static String describe(OutcomeType type, double affectedPercentage) {
        String share = String.format(Locale.ROOT, "%.0f%%", affectedPercentage);
        switch (type) {
            case DOWNTIME:
                return "Complete service unavailability affecting " + share + " of users";
            case DEGRADED:
                return "Slow response times affecting " + share + " of requests. Users experience delays but service works.";
            case BLIP:
                return "Brief intermittent issues affecting " + share + " of requests. Most users won't notice.";
            case TIMEOUT:
                return "Request timeouts affecting " + share + " of operations. Users need to retry.";
            case ERROR_RATE:
                return "Increased error rate affecting " + share + " of requests. Users see error messages.";
            case CASCADING_FAILURE:
                return "Failures spread to dependent services affecting " + share + " of requests";
            case PARTIAL_OUTAGE:
                return share + " of capacity lost. Service runs on the remaining instances but users routed"
                        + " to the failed ones see errors.";
            case SELF_RECOVERY:
                return "Service recovers on its own; " + share + " of requests see a short delay";
            default:
                return "Service impact affecting " + share + " of operations";
        }
    }

    private static List<String> mitigationStrategies(FailureType failureType, Resource resource,
                                                     BlastRadiusReport blastRadius) {
        String type = typeOf(resource).toLowerCase(Locale.ROOT);
        List<String> strategies = new ArrayList<>();
        switch (failureType) {
            case FULL_OUTAGE:
                if (blastRadius.getTotalAffected() > 10) {
                    strategies.add("Implement circuit breakers to prevent cascade failures");
                    strategies.add("Add redundancy to reduce single points of failure");
                }
                if (type.contains("database")) {
                    strategies.add("Configure automatic failover to a standby for " + resource.getName());
                    strategies.add("Set up regular backup and recovery testing");
                    strategies.add("Enable point-in-time recovery");
                } else if (type.contains("web") || type.contains("app")) {
                    strategies.add("Deploy " + resource.getName() + " across multiple availability zones");
                    strategies.add("Implement auto-scaling to handle load spikes");
                    strategies.add("Use blue-green deployments to minimize downtime");
                } else if (type.contains("load_balancer")) {
                    strategies.add("Configure redundant load balancers");
                    strategies.add("Implement DNS-based failover");
                }
                strategies.add("Create runbooks for common " + typeOf(resource) + " failure scenarios");
                strategies.add("Conduct regular disaster recovery drills");
                break;
            case DEGRADED_PERFORMANCE:
                if (type.contains("database")) {
                    strategies.add("Implement connection pooling with proper limits");
                    strategies.add("Add read replicas to distribute load");
                    strategies.add("Set up query timeouts to prevent long-running queries");
                } else if (type.contains("cache")) {
                    strategies.add("Implement cache warming strategies");
                    strategies.add("Implement graceful degradation when " + resource.getName() + " is unavailable");
                } else if (type.contains("web") || type.contains("app")) {
                    strategies.add("Implement auto-scaling based on CPU, memory and request rate");
                    strategies.add("Implement request rate limiting");
                }
                strategies.add("Set up comprehensive performance monitoring");
                strategies.add("Implement load testing to identify capacity limits of " + resource.getName());
                strategies.add("Create runbooks for performance degradation incidents");
                strategies.add("Establish SLOs and alert on SLO violations");
                break;
            case PARTIAL_OUTAGE:
                strategies.add("Implement multi-zone redundancy with automatic failover");
                strategies.add("Configure health checks to remove failed instances");
                strategies.add("Set up auto-scaling to compensate for lost capacity");
                strategies.add("Use DNS-based routing to redirect traffic from failed zones");
                strategies.add("Deploy " + typeOf(resource) + " across at least 3 availability zones");
                strategies.add("Implement graceful degradation when " + resource.getName() + " runs with reduced capacity");
                break;
            default:
                strategies.add("Implement retry logic with exponential backoff");
                strategies.add("Add circuit breakers to prevent cascade failures");
                strategies.add("Enable request hedging for critical operations");
                strategies.add("Add detailed logging around " + typeOf(resource) + " operations");
                strategies.add("Consider implementing a bulkhead pattern to isolate failures");
                break;
        }
        return List.copyOf(strategies);
    }

    private static List<String> monitoringRecommendations(FailureType failureType, Resource resource) {
        String type = typeOf(resource);
        List<String> recommendations = new ArrayList<>();
        switch (failureType) {
            case INTERMITTENT_FAILURE:
                recommendations.add("Set up alerting on error rate thresholds (>1%, >5%, >10%)");
                recommendations.add("Monitor retry rates and success rates");
                recommendations.add("Implement distributed tracing to identify error sources");
                recommendations.add("Create dashboards for " + type + " health metrics");
                break;
            case DEGRADED_PERFORMANCE:
                recommendations.add("Set up alerts on P95/P99 latency thresholds for " + resource.getName());
                recommendations.add("Track resource utilization (CPU, memory, connections)");
                String lowered = type.toLowerCase(Locale.ROOT);
                if (lowered.contains("database")) {
                    recommendations.add("Monitor query execution times and slow query counts");
                } else if (lowered.contains("cache")) {
                    recommendations.add("Track cache eviction rates and hit/miss ratios");
                }
                recommendations.add("Implement health check endpoints");
                break;
            case PARTIAL_OUTAGE:
                recommendations.add("Monitor per-zone health and traffic distribution of " + resource.getName());
                recommendations.add("Set up alerts for zone-level failures");
                recommendations.add("Track capacity utilization per zone");
                recommendations.add("Monitor failover success rates");
                break;
            default:
                recommendations.add("Alert on availability of " + resource.getName());
                recommendations.add("Implement health check endpoints with automatic recovery");
                recommendations.add("Set up proper logging and tracing");
                break;
        }
        return List.copyOf(recommendations);
    }

    private static List<String> recoverySteps(Resource resource, BlastRadiusReport blastRadius) {
        String type = typeOf(resource).toLowerCase(Locale.ROOT);
        List<String> steps = new ArrayList<>();
        steps.add("Confirm the failure of " + resource.getName() + " and its impact scope");
        steps.add("Activate the incident response team");
        steps.add("Notify stakeholders and affected users");
        if (type.contains("database")) {
            steps.add("Attempt a database service restart");
            steps.add("Check for corrupted data or locks");
            steps.add("Restore from backup if necessary");
        } else if (type.contains("web") || type.contains("app")) {
            steps.add("Restart the application service");
            steps.add("Check application logs for errors");
            steps.add("Verify connectivity to dependencies");
        } else if (type.contains("load_balancer")) {
            steps.add("Verify backend pool health");
            steps.add("Route traffic to a backup load balancer if available");
        } else {
            steps.add("Investigate the root cause");
            steps.add("Restart the affected service");
        }
        if (blastRadius.getTotalAffected() > 0) {
            steps.add("Monitor and restart " + blastRadius.getTotalAffected() + " dependent resources");
        }
        steps.add("Confirm full system recovery");
        steps.add("Conduct a post-mortem analysis");
        return List.copyOf(steps);
    }

    private static String typeOf(Resource resource) {
        return resource.getResourceType() != null ? resource.getResourceType() : "resource";
    }

    private static Map<FailureType, List<OutcomePolicy>> validateTables(Map<FailureType, List<OutcomePolicy>> configured) {
        if (configured == null) {
            throw new InvalidConfigurationException("Failure scenario tables are missing");
        }
        Map<FailureType, List<OutcomePolicy>> validated = new EnumMap<>(FailureType.class);
        for (FailureType type : TABLE_DRIVEN) {
            List<OutcomePolicy> table = configured.get(type);
            if (table == null || table.isEmpty()) {
                throw new InvalidConfigurationException("No outcome table configured for " + type.value());
            }
            double total = 0.0;
            for (OutcomePolicy policy : table) {
                if (policy.getOutcomeType() == null) {
                    throw new InvalidConfigurationException("Outcome type missing in " + type.value() + " table");
                }
                if (policy.getProbability() < 0.0 || policy.getProbability() > 1.0) {
                    throw new InvalidConfigurationException("Probability of " + policy.getOutcomeType().value()
                            + " in " + type.value() + " table must be within [0, 1] but was " + policy.getProbability());
                }
                if (policy.getDurationFactor() < 0.0
                        || policy.getAffectedPercentage() < 0.0 || policy.getAffectedPercentage() > 100.0) {
                    throw new InvalidConfigurationException("Duration factor or affected percentage out of range for "
                            + policy.getOutcomeType().value() + " in " + type.value() + " table");
                }
                total += policy.getProbability();
            }
            if (Math.abs(total - 1.0) > PROBABILITY_TOLERANCE) {
                throw new InvalidConfigurationException("Outcome probabilities for " + type.value()
                        + " sum to " + total + " instead of 1.0");
            }
            validated.put(type, List.copyOf(table));
        }
        return validated;
    }
}
