package com.privinsight.api.compliance;

import com.privinsight.core.domain.ComplianceRule.Severity;

import java.util.List;

/**
 * Outcome of evaluating one framework against job metadata.
 */
public record ComplianceResult(
        String frameworkId,
        boolean compliant,
        int score,
        List<Violation> violations,
        List<String> recommendations
) {
    public ComplianceResult {
        violations = List.copyOf(violations);
        recommendations = List.copyOf(recommendations);
    }

    public long countBySeverity(Severity severity) {
        return violations.stream().filter(v -> v.severity() == severity).count();
    }

    public record Violation(String ruleId, String description, Severity severity, String remedyText) {}
}
