package com.privinsight.api.compliance;

import com.privinsight.core.domain.ComplianceRule;
import com.privinsight.core.domain.FrameworkAdvisory;

import java.util.List;

/**
 * Registration request for a compliance framework.
 */
public record FrameworkDefinition(
        String frameworkId,
        String name,
        List<ComplianceRule> rules,
        List<FrameworkAdvisory> advisories
) {
    public FrameworkDefinition {
        rules = rules != null ? List.copyOf(rules) : List.of();
        advisories = advisories != null ? List.copyOf(advisories) : List.of();
    }
}
