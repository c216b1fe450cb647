package com.privinsight.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Privacy policy governing every job submitted in a data category.
 */
@Entity
@Table(name = "privacy_policies")
public class PrivacyPolicy {

    public static final int MIN_PRIVACY_LEVEL = 1;
    public static final int MAX_PRIVACY_LEVEL = 10;

    @Id
    @Column(name = "category", length = 64)
    private String category;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "encryption_method", nullable = false, length = 20)
    private EncryptionMethod encryptionMethod;

    @Column(name = "privacy_level", nullable = false)
    private int privacyLevel;

    @Column(name = "tee_required", nullable = false)
    private boolean teeRequired;

    @Convert(converter = StringListConverter.class)
    @Column(name = "compliance_frameworks", nullable = false, columnDefinition = "TEXT")
    private List<String> complianceFrameworks;

    @NotNull
    @Column(name = "epsilon_limit", nullable = false, precision = 19, scale = 6)
    private BigDecimal epsilonLimit;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    private Long version;

    public enum EncryptionMethod {
        RSA2048,
        RSA4096,
        AES256,
        CHACHA20,
        ECDH,
        HYBRID
    }

    protected PrivacyPolicy() {}

    public static PrivacyPolicy create(String category, EncryptionMethod encryptionMethod, int privacyLevel,
                                       boolean teeRequired, List<String> complianceFrameworks,
                                       BigDecimal epsilonLimit, Instant now) {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("Category cannot be null or blank");
        }
        PrivacyPolicy policy = new PrivacyPolicy();
        policy.category = category;
        policy.createdAt = now;
        policy.update(encryptionMethod, privacyLevel, teeRequired, complianceFrameworks, epsilonLimit, now);
        return policy;
    }

    public void update(EncryptionMethod encryptionMethod, int privacyLevel, boolean teeRequired,
                       List<String> complianceFrameworks, BigDecimal epsilonLimit, Instant now) {
        if (encryptionMethod == null) {
            throw new IllegalArgumentException("Encryption method cannot be null");
        }
        if (privacyLevel < MIN_PRIVACY_LEVEL || privacyLevel > MAX_PRIVACY_LEVEL) {
            throw new IllegalArgumentException("Privacy level must be between 1 and 10");
        }
        if (complianceFrameworks == null || complianceFrameworks.isEmpty()) {
            throw new IllegalArgumentException("At least one compliance framework is required");
        }
        if (epsilonLimit == null || epsilonLimit.signum() <= 0) {
            throw new IllegalArgumentException("Epsilon limit must be positive");
        }
        this.encryptionMethod = encryptionMethod;
        this.privacyLevel = privacyLevel;
        this.teeRequired = teeRequired;
        this.complianceFrameworks = List.copyOf(complianceFrameworks);
        this.epsilonLimit = epsilonLimit;
        this.updatedAt = now;
    }

    /**
     * High privacy levels are expected to run inside a trusted execution environment.
     */
    public boolean lacksRecommendedTee() {
        return privacyLevel >= 8 && !teeRequired;
    }

    // Getters
    public String getCategory() { return category; }
    public EncryptionMethod getEncryptionMethod() { return encryptionMethod; }
    public int getPrivacyLevel() { return privacyLevel; }
    public boolean isTeeRequired() { return teeRequired; }
    public List<String> getComplianceFrameworks() { return complianceFrameworks; }
    public BigDecimal getEpsilonLimit() { return epsilonLimit; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
