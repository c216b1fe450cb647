package com.privinsight.core.domain;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Named, immutable collection of compliance rules.
 * New versions of a framework are registered under new ids.
 */
@Entity
@Table(name = "compliance_frameworks")
public class ComplianceFramework {

    @Id
    @Column(name = "framework_id", length = 64)
    private String frameworkId;

    @Column(name = "name", nullable = false)
    private String name;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "compliance_rules", joinColumns = @JoinColumn(name = "framework_id"))
    @OrderColumn(name = "rule_index")
    private List<ComplianceRule> rules = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "framework_advisories", joinColumns = @JoinColumn(name = "framework_id"))
    @OrderColumn(name = "advisory_index")
    private List<FrameworkAdvisory> advisories = new ArrayList<>();

    @Column(name = "registered_at", nullable = false, updatable = false)
    private Instant registeredAt;

    @Version
    private Long version;

    protected ComplianceFramework() {}

    public static ComplianceFramework create(String frameworkId, String name, List<ComplianceRule> rules,
                                             List<FrameworkAdvisory> advisories, Instant now) {
        if (frameworkId == null || frameworkId.isBlank()) {
            throw new IllegalArgumentException("Framework ID cannot be null or blank");
        }
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("Framework " + frameworkId + " must contain at least one rule");
        }
        Set<String> ruleIds = new HashSet<>();
        for (ComplianceRule rule : rules) {
            if (!ruleIds.add(rule.getRuleId())) {
                throw new IllegalArgumentException("Duplicate rule id in " + frameworkId + ": " + rule.getRuleId());
            }
        }
        ComplianceFramework framework = new ComplianceFramework();
        framework.frameworkId = frameworkId;
        framework.name = name != null ? name : frameworkId;
        framework.rules = new ArrayList<>(rules);
        framework.advisories = advisories != null ? new ArrayList<>(advisories) : new ArrayList<>();
        framework.registeredAt = now;
        return framework;
    }

    public int maxPossiblePoints() {
        return rules.stream().mapToInt(r -> r.getSeverity().points()).sum();
    }

    // Getters
    public String getFrameworkId() { return frameworkId; }
    public String getName() { return name; }
    public List<ComplianceRule> getRules() { return List.copyOf(rules); }
    public List<FrameworkAdvisory> getAdvisories() { return List.copyOf(advisories); }
    public Instant getRegisteredAt() { return registeredAt; }
}
