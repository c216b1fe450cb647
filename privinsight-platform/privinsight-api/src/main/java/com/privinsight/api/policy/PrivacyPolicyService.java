package com.privinsight.api.policy;

import com.privinsight.api.compliance.ComplianceEngine;
import com.privinsight.api.compliance.UnknownFrameworkException;
import com.privinsight.api.ledger.Epsilons;
import com.privinsight.api.ledger.PrivacyLedgerService;
import com.privinsight.api.ledger.PrivacyLedgerService.BudgetStatus;
import com.privinsight.core.domain.PrivacyPolicy;
import com.privinsight.core.repository.PrivacyPolicyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-category privacy policies and the ledger entries that enforce their budgets.
 */
@Service
public class PrivacyPolicyService {

    private static final Logger log = LoggerFactory.getLogger(PrivacyPolicyService.class);

    private final PrivacyPolicyRepository policyRepository;
    private final ComplianceEngine complianceEngine;
    private final PrivacyLedgerService ledgerService;
    private final Clock clock;

    public PrivacyPolicyService(
            PrivacyPolicyRepository policyRepository,
            ComplianceEngine complianceEngine,
            PrivacyLedgerService ledgerService,
            Clock clock) {
        this.policyRepository = policyRepository;
        this.complianceEngine = complianceEngine;
        this.ledgerService = ledgerService;
        this.clock = clock;
    }

    /**
     * Creates or replaces the policy for a category and opens or resizes its ledger.
     *
     * @throws PolicyValidationException for out-of-range values
     * @throws UnknownFrameworkException if a referenced framework is not registered
     * @throws com.privinsight.api.ledger.LedgerException LIMIT_BELOW_USAGE if the new limit is below current usage
     */
    @Transactional
    public PolicyResult setPolicy(String category, PolicyDefinition definition) {
        Objects.requireNonNull(definition, "Policy definition cannot be null");
        List<String> errors = new ArrayList<>();
        if (category == null || category.isBlank()) {
            errors.add("Category is required");
        }
        if (definition.encryptionMethod() == null) {
            errors.add("Encryption method is required");
        }
        if (definition.privacyLevel() < PrivacyPolicy.MIN_PRIVACY_LEVEL
                || definition.privacyLevel() > PrivacyPolicy.MAX_PRIVACY_LEVEL) {
            errors.add("Privacy level must be between 1 and 10");
        }
        if (definition.complianceFrameworks().isEmpty()) {
            errors.add("At least one compliance framework is required");
        }
        if (definition.epsilonLimit() == null || definition.epsilonLimit().signum() <= 0) {
            errors.add("Epsilon limit must be positive");
        }
        if (!errors.isEmpty()) {
            throw new PolicyValidationException(errors);
        }
        BigDecimal limit;
        try {
            limit = Epsilons.normalize(definition.epsilonLimit());
        } catch (IllegalArgumentException e) {
            throw new PolicyValidationException(List.of(e.getMessage()));
        }

        List<String> frameworks = List.copyOf(new LinkedHashSet<>(definition.complianceFrameworks()));
        List<String> unknown = frameworks.stream().filter(id -> !complianceEngine.isRegistered(id)).toList();
        if (!unknown.isEmpty()) {
            throw new UnknownFrameworkException(unknown);
        }

        List<String> warnings = new ArrayList<>();
        if (definition.privacyLevel() >= 8 && !definition.teeRequired()) {
            String warning = "Privacy level " + definition.privacyLevel() + " without a trusted execution environment";
            warnings.add(warning);
            log.warn("Policy for {}: {}", category, warning);
        }

        if (ledgerService.hasLedger(category)) {
            ledgerService.adjustLimit(category, limit);
        } else {
            ledgerService.openLedger(category, limit);
        }

        Instant now = clock.instant();
        PrivacyPolicy policy = policyRepository.findById(category)
                .map(existing -> {
                    existing.update(definition.encryptionMethod(), definition.privacyLevel(),
                            definition.teeRequired(), frameworks, limit, now);
                    return existing;
                })
                .orElseGet(() -> PrivacyPolicy.create(category, definition.encryptionMethod(),
                        definition.privacyLevel(), definition.teeRequired(), frameworks, limit, now));
        PrivacyPolicy saved = policyRepository.save(policy);
        log.info("Set privacy policy for {}: level {}, frameworks {}, epsilon limit {}",
                category, saved.getPrivacyLevel(), saved.getComplianceFrameworks(), saved.getEpsilonLimit());
        return new PolicyResult(saved, warnings);
    }

    public Optional<PrivacyPolicy> getPolicy(String category) {
        if (category == null) {
            return Optional.empty();
        }
        return policyRepository.findById(category);
    }

    public List<PrivacyPolicy> listPolicies() {
        return policyRepository.findAllByOrderByCategoryAsc();
    }

    /**
     * Summary of every category's policy and budget usage.
     */
    public List<PolicyOverview> overview() {
        return listPolicies().stream()
                .map(policy -> {
                    BudgetStatus status = ledgerService.getBudgetStatus(policy.getCategory());
                    return new PolicyOverview(
                            policy.getCategory(),
                            policy.getEncryptionMethod(),
                            policy.getPrivacyLevel(),
                            policy.isTeeRequired(),
                            policy.getComplianceFrameworks(),
                            status.limit(),
                            status.consumed(),
                            status.reserved(),
                            status.utilization(),
                            policy.lacksRecommendedTee()
                    );
                })
                .toList();
    }

    public record PolicyResult(PrivacyPolicy policy, List<String> warnings) {}

    public record PolicyOverview(
            String category,
            PrivacyPolicy.EncryptionMethod encryptionMethod,
            int privacyLevel,
            boolean teeRequired,
            List<String> complianceFrameworks,
            BigDecimal epsilonLimit,
            BigDecimal consumed,
            BigDecimal reserved,
            BigDecimal utilization,
            boolean teeWarning
    ) {}
}
