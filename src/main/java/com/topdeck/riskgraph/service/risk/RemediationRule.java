package com.topdeck.riskgraph.service.risk;

import com.topdeck.riskgraph.config.RiskAnalysisProperties;
import com.topdeck.riskgraph.dto.graph.Resource;
import com.topdeck.riskgraph.dto.risk.BlastRadiusReport;
import com.topdeck.riskgraph.dto.risk.RiskAssessment;
import lombok.Value;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One entry of the remediation rule table. Lower priority values are reported first.
 */
@Value
public class RemediationRule {

    String name;
    int priority;
    Predicate<Context> condition;
    Function<Context, String> template;

    public boolean applies(Context context) {
        return condition.test(context);
    }

    public String render(Context context) {
        return template.apply(context);
    }

    /**
     * Everything a rule may look at for one resource.
     */
    @Value
    public static class Context {
        Resource resource;
        RiskAssessment assessment;
        BlastRadiusReport blastRadius;
        RiskAnalysisProperties properties;

        public String name() {
            return resource.getName() != null ? resource.getName() : resource.getId();
        }

        public String type() {
            return resource.getResourceType() != null ? resource.getResourceType() : "resource";
        }
    }
}
