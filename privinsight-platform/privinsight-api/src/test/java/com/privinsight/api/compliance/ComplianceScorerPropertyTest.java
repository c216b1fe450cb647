package com.privinsight.api.compliance;

import com.privinsight.core.domain.ComplianceRule;
import com.privinsight.core.domain.ComplianceRule.RuleCondition;
import com.privinsight.core.domain.ComplianceRule.Severity;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for severity-weighted scoring.
 */
class ComplianceScorerPropertyTest {

    private static List<ComplianceRule> rulesFor(List<Severity> severities) {
        List<ComplianceRule> rules = new ArrayList<>();
        for (int i = 0; i < severities.size(); i++) {
            rules.add(ComplianceRule.of("r" + i, "Rule " + i, severities.get(i),
                    RuleCondition.ALL_TRUE, List.of("f" + i), "Set f" + i));
        }
        return rules;
    }

    private static Map<String, Object> metadataFor(List<Boolean> satisfied) {
        Map<String, Object> metadata = new HashMap<>();
        for (int i = 0; i < satisfied.size(); i++) {
            metadata.put("f" + i, satisfied.get(i));
        }
        return metadata;
    }

    @Property(tries = 300)
    @Label("score is the rounded share of earned points and pass/fail follows violation severities")
    void scoreAndVerdictFollowTheViolations(
            @ForAll @Size(min = 1, max = 12) List<Severity> severities,
            @ForAll @Size(12) List<Boolean> satisfied) {

        List<Boolean> outcomes = satisfied.subList(0, severities.size());
        ComplianceResult result = ComplianceScorer.score("F", rulesFor(severities), List.of(), metadataFor(outcomes));

        int earned = 0;
        int max = 0;
        int critical = 0;
        int high = 0;
        for (int i = 0; i < severities.size(); i++) {
            max += severities.get(i).points();
            if (outcomes.get(i)) {
                earned += severities.get(i).points();
            } else if (severities.get(i) == Severity.CRITICAL) {
                critical++;
            } else if (severities.get(i) == Severity.HIGH) {
                high++;
            }
        }

        assertThat(result.score()).isBetween(0, 100);
        assertThat(result.score()).isEqualTo((int) Math.round(100.0 * earned / max));
        assertThat(result.compliant()).isEqualTo(critical == 0 && high <= 1);
        assertThat(result.violations()).hasSize((int) outcomes.stream().filter(ok -> !ok).count());
    }

    @Property(tries = 100)
    @Label("fully satisfied frameworks score 100 with no violations")
    void fullySatisfiedScoresHundred(@ForAll @Size(min = 1, max = 12) List<Severity> severities) {
        List<Boolean> allTrue = new ArrayList<>();
        severities.forEach(s -> allTrue.add(true));

        ComplianceResult result = ComplianceScorer.score("F", rulesFor(severities), List.of(), metadataFor(allTrue));

        assertThat(result.score()).isEqualTo(100);
        assertThat(result.compliant()).isTrue();
        assertThat(result.violations()).isEmpty();
        assertThat(result.recommendations()).isEmpty();
    }

    @Example
    void percentageRoundsHalfUp() {
        assertThat(ComplianceScorer.percentage(110, 130)).isEqualTo(85);
        assertThat(ComplianceScorer.percentage(1, 200)).isEqualTo(1);
        assertThat(ComplianceScorer.percentage(0, 0)).isEqualTo(100);
    }
}
