package com.privinsight.api.compliance;

import com.privinsight.api.compliance.ComplianceEngine.ComplianceReport;
import com.privinsight.api.compliance.ComplianceEngine.FrameworkRequirements;
import com.privinsight.api.support.PipelineIntegrationSupport;
import com.privinsight.core.domain.ComplianceRule;
import com.privinsight.core.domain.ComplianceRule.RuleCondition;
import com.privinsight.core.domain.ComplianceRule.Severity;
import com.privinsight.core.domain.FrameworkAdvisory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ComplianceEngineTest extends PipelineIntegrationSupport {

    private static Map<String, Object> hipaaWithoutAuditLogging() {
        return Map.of(
                "encryptionInTransit", true,
                "encryptionAtRest", true,
                "accessControl", true,
                "auditLogging", false,
                "minimumNecessary", true);
    }

    @Test
    void builtInFrameworksAreRegisteredAtStartup() {
        assertThat(BuiltInFrameworks.all())
                .extracting(FrameworkDefinition::frameworkId)
                .allMatch(complianceEngine::isRegistered);
    }

    @Test
    void oneHighViolationStillPasses() {
        ComplianceResult result = complianceEngine.evaluate(BuiltInFrameworks.HIPAA, hipaaWithoutAuditLogging());

        assertThat(result.compliant()).isTrue();
        assertThat(result.score()).isEqualTo(85);
        assertThat(result.violations())
                .singleElement()
                .satisfies(v -> {
                    assertThat(v.ruleId()).isEqualTo("hipaa_audit_logging");
                    assertThat(v.severity()).isEqualTo(Severity.HIGH);
                });
        assertThat(result.recommendations()).anyMatch(r -> r.startsWith("Fix: Access to PHI audit logged"));
    }

    @Test
    void criticalViolationFails() {
        Map<String, Object> metadata = Map.of(
                "encryptionInTransit", false,
                "encryptionAtRest", true,
                "accessControl", true,
                "auditLogging", true,
                "minimumNecessary", true);

        ComplianceResult result = complianceEngine.evaluate(BuiltInFrameworks.HIPAA, metadata);

        assertThat(result.compliant()).isFalse();
        assertThat(result.countBySeverity(Severity.CRITICAL)).isEqualTo(1);
        assertThat(result.score()).isEqualTo(77);
    }

    @Test
    void twoHighViolationsFail() {
        Map<String, Object> metadata = Map.of(
                "encryptionInTransit", true,
                "encryptionAtRest", true,
                "accessControl", true);

        ComplianceResult result = complianceEngine.evaluate(BuiltInFrameworks.HIPAA, metadata);

        assertThat(result.compliant()).isFalse();
        assertThat(result.countBySeverity(Severity.HIGH)).isEqualTo(2);
    }

    @Test
    void mediumViolationsNeverFail() {
        ComplianceResult result = complianceEngine.evaluate(BuiltInFrameworks.ISO27001, Map.of());

        assertThat(result.compliant()).isTrue();
        assertThat(result.score()).isZero();
        assertThat(result.violations()).hasSize(2);
    }

    @Test
    void unknownFrameworkIsAnErrorNotAFailure() {
        String missing = unique("NOPE");

        assertThatThrownBy(() -> complianceEngine.evaluate(missing, Map.of()))
                .isInstanceOf(UnknownFrameworkException.class);
        assertThatThrownBy(() -> complianceEngine.evaluateMany(List.of(BuiltInFrameworks.GDPR, missing), Map.of()))
                .isInstanceOf(UnknownFrameworkException.class)
                .satisfies(e -> assertThat(((UnknownFrameworkException) e).getFrameworkIds()).containsExactly(missing));
    }

    @Test
    void evaluateManyReportsEveryFramework() {
        List<ComplianceResult> results = complianceEngine.evaluateMany(
                List.of(BuiltInFrameworks.GDPR, BuiltInFrameworks.HIPAA, BuiltInFrameworks.GDPR),
                hipaaWithoutAuditLogging());

        assertThat(results).extracting(ComplianceResult::frameworkId)
                .containsExactly(BuiltInFrameworks.GDPR, BuiltInFrameworks.HIPAA);
        assertThat(results.get(0).compliant()).isFalse();
        assertThat(results.get(1).compliant()).isTrue();
    }

    @Test
    void reportAggregatesResults() {
        ComplianceReport report = complianceEngine.generateReport(
                List.of(BuiltInFrameworks.HIPAA, BuiltInFrameworks.ISO27001), hipaaWithoutAuditLogging());

        assertThat(report.results()).hasSize(2);
        assertThat(report.overallCompliant()).isTrue();
        assertThat(report.averageScore()).isEqualTo(43);
        assertThat(report.criticalIssues()).isZero();
        assertThat(report.recommendations()).doesNotHaveDuplicates().isNotEmpty();
    }

    @Test
    void requirementsListRulesAndAdvisories() {
        FrameworkRequirements requirements = complianceEngine.getRequirements(BuiltInFrameworks.HIPAA);

        assertThat(requirements.requirements()).hasSize(5);
        assertThat(requirements.maxPossiblePoints()).isEqualTo(130);
        assertThat(requirements.advisories()).hasSize(2);
    }

    @Test
    void customFrameworkCanBeRegisteredOnce() {
        String id = unique("CUSTOM");
        FrameworkDefinition definition = new FrameworkDefinition(id, "Internal data policy", List.of(
                ComplianceRule.of("retention", "Retention period declared", Severity.LOW,
                        RuleCondition.NOT_BLANK, List.of("retentionDays"), "Declare a retention period")
        ), List.of(FrameworkAdvisory.of("reviewed", "Have the data steward review the job")));

        complianceEngine.registerFramework(definition);

        assertThatThrownBy(() -> complianceEngine.registerFramework(definition))
                .isInstanceOf(FrameworkAlreadyRegisteredException.class);
        ComplianceResult result = complianceEngine.evaluate(id, Map.of("retentionDays", 90));
        assertThat(result.score()).isEqualTo(100);
        assertThat(result.recommendations()).containsExactly("Have the data steward review the job");
    }

    @Test
    void frameworkWithoutRulesIsRejected() {
        String id = unique("EMPTY");

        assertThatThrownBy(() -> complianceEngine.registerFramework(
                new FrameworkDefinition(id, "Empty", List.of(), List.of())))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(complianceEngine.isRegistered(id)).isFalse();
    }
}
