package com.privinsight.api.policy;

import com.privinsight.core.domain.PrivacyPolicy.EncryptionMethod;

import java.math.BigDecimal;
import java.util.List;

/**
 * Administrative request to set a category's privacy policy.
 */
public record PolicyDefinition(
        EncryptionMethod encryptionMethod,
        int privacyLevel,
        boolean teeRequired,
        List<String> complianceFrameworks,
        BigDecimal epsilonLimit
) {
    public PolicyDefinition {
        complianceFrameworks = complianceFrameworks != null ? List.copyOf(complianceFrameworks) : List.of();
    }
}
