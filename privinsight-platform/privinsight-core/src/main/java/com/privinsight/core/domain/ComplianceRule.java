package com.privinsight.core.domain;

import jakarta.persistence.*;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Declarative compliance rule: a condition over named job-metadata fields.
 */
@Embeddable
public class ComplianceRule {

    @Column(name = "rule_id", nullable = false, length = 64)
    private String ruleId;

    @Column(name = "description", nullable = false)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 16)
    private Severity severity;

    @Enumerated(EnumType.STRING)
    @Column(name = "rule_condition", nullable = false, length = 16)
    private RuleCondition condition;

    @Convert(converter = StringListConverter.class)
    @Column(name = "fields", nullable = false, columnDefinition = "TEXT")
    private List<String> fields;

    @Column(name = "remedy_text", nullable = false, length = 1024)
    private String remedyText;

    public enum Severity {
        CRITICAL(30),
        HIGH(20),
        MEDIUM(15),
        LOW(10);

        private final int points;

        Severity(int points) {
            this.points = points;
        }

        public int points() {
            return points;
        }
    }

    public enum RuleCondition {
        /** Every listed field is {@code true}. */
        ALL_TRUE,
        /** At least one listed field is {@code true}. */
        ANY_TRUE,
        /** Every listed field is present and non-empty. */
        NOT_BLANK
    }

    protected ComplianceRule() {}

    public static ComplianceRule of(String ruleId, String description, Severity severity,
                                    RuleCondition condition, List<String> fields, String remedyText) {
        if (ruleId == null || ruleId.isBlank()) {
            throw new IllegalArgumentException("Rule ID cannot be null or blank");
        }
        if (severity == null || condition == null) {
            throw new IllegalArgumentException("Severity and condition are required");
        }
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("Rule " + ruleId + " must reference at least one field");
        }
        ComplianceRule rule = new ComplianceRule();
        rule.ruleId = ruleId;
        rule.description = description != null ? description : ruleId;
        rule.severity = severity;
        rule.condition = condition;
        rule.fields = List.copyOf(fields);
        rule.remedyText = remedyText != null ? remedyText : "";
        return rule;
    }

    /**
     * Evaluates this rule against job metadata. Missing fields never satisfy a rule.
     */
    public boolean isSatisfiedBy(Map<String, Object> metadata) {
        if (metadata == null) {
            return false;
        }
        return switch (condition) {
            case ALL_TRUE -> fields.stream().allMatch(f -> isTrue(metadata.get(f)));
            case ANY_TRUE -> fields.stream().anyMatch(f -> isTrue(metadata.get(f)));
            case NOT_BLANK -> fields.stream().allMatch(f -> isPresent(metadata.get(f)));
        };
    }

    public static boolean isTrue(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        return value instanceof String s && Boolean.parseBoolean(s.trim());
    }

    private static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof String s) {
            return !s.isBlank();
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        return true;
    }

    // Getters
    public String getRuleId() { return ruleId; }
    public String getDescription() { return description; }
    public Severity getSeverity() { return severity; }
    public RuleCondition getCondition() { return condition; }
    public List<String> getFields() { return fields; }
    public String getRemedyText() { return remedyText; }
}
