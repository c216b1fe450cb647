package com.privinsight.api.compliance;

import com.privinsight.api.compliance.ComplianceResult.Violation;
import com.privinsight.core.domain.ComplianceRule;
import com.privinsight.core.domain.ComplianceRule.Severity;
import com.privinsight.core.domain.FrameworkAdvisory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Severity-weighted compliance scoring.
 *
 * Satisfied rules earn critical=30, high=20, medium=15, low=10 points and
 * {@code score = round(100 * earned / maxPossible)}. A framework passes iff it
 * has no critical violation and at most one high violation.
 */
public final class ComplianceScorer {

    static final int MAX_HIGH_VIOLATIONS = 1;

    private ComplianceScorer() {}

    public static ComplianceResult score(String frameworkId, List<ComplianceRule> rules,
                                         List<FrameworkAdvisory> advisories, Map<String, Object> metadata) {
        Map<String, Object> safeMetadata = metadata != null ? metadata : Map.of();

        int earned = 0;
        int maxPossible = 0;
        List<Violation> violations = new ArrayList<>();
        Set<String> recommendations = new LinkedHashSet<>();

        for (ComplianceRule rule : rules) {
            int points = rule.getSeverity().points();
            maxPossible += points;
            if (rule.isSatisfiedBy(safeMetadata)) {
                earned += points;
            } else {
                violations.add(new Violation(rule.getRuleId(), rule.getDescription(),
                        rule.getSeverity(), rule.getRemedyText()));
                recommendations.add("Fix: " + rule.getDescription() + " - " + rule.getRemedyText());
            }
        }

        for (FrameworkAdvisory advisory : advisories) {
            if (!ComplianceRule.isTrue(safeMetadata.get(advisory.getField()))) {
                recommendations.add(advisory.getAdvice());
            }
        }

        long critical = violations.stream().filter(v -> v.severity() == Severity.CRITICAL).count();
        long high = violations.stream().filter(v -> v.severity() == Severity.HIGH).count();
        boolean compliant = critical == 0 && high <= MAX_HIGH_VIOLATIONS;

        return new ComplianceResult(frameworkId, compliant, percentage(earned, maxPossible),
                violations, new ArrayList<>(recommendations));
    }

    static int percentage(int earned, int maxPossible) {
        if (maxPossible == 0) {
            return 100;
        }
        return BigDecimal.valueOf(100L * earned)
                .divide(BigDecimal.valueOf(maxPossible), 0, RoundingMode.HALF_UP)
                .intValueExact();
    }
}
