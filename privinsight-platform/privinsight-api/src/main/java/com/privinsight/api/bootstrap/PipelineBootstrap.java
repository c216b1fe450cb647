package com.privinsight.api.bootstrap;

import com.privinsight.api.compliance.BuiltInFrameworks;
import com.privinsight.api.compliance.ComplianceEngine;
import com.privinsight.api.compliance.FrameworkDefinition;
import com.privinsight.api.policy.PolicyDefinition;
import com.privinsight.api.policy.PrivacyPolicyService;
import com.privinsight.core.domain.PrivacyPolicy.EncryptionMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Seeds the built-in compliance frameworks and the default category policies.
 * Existing frameworks and policies are left untouched.
 */
@Component
@ConditionalOnProperty(prefix = "privinsight.bootstrap", name = "seed-defaults", havingValue = "true",
        matchIfMissing = true)
public class PipelineBootstrap implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(PipelineBootstrap.class);

    private final ComplianceEngine complianceEngine;
    private final PrivacyPolicyService policyService;

    public PipelineBootstrap(ComplianceEngine complianceEngine, PrivacyPolicyService policyService) {
        this.complianceEngine = complianceEngine;
        this.policyService = policyService;
    }

    @Override
    public void run(ApplicationArguments args) {
        int frameworks = 0;
        for (FrameworkDefinition definition : BuiltInFrameworks.all()) {
            if (!complianceEngine.isRegistered(definition.frameworkId())) {
                complianceEngine.registerFramework(definition);
                frameworks++;
            }
        }

        int policies = 0;
        for (Map.Entry<String, PolicyDefinition> entry : defaultPolicies().entrySet()) {
            if (policyService.getPolicy(entry.getKey()).isEmpty()) {
                policyService.setPolicy(entry.getKey(), entry.getValue());
                policies++;
            }
        }
        log.info("Seeded {} compliance frameworks and {} category policies", frameworks, policies);
    }

    static Map<String, PolicyDefinition> defaultPolicies() {
        Map<String, PolicyDefinition> policies = new LinkedHashMap<>();
        policies.put("healthcare", new PolicyDefinition(EncryptionMethod.AES256, 9, true,
                List.of(BuiltInFrameworks.HIPAA), new BigDecimal("0.1")));
        policies.put("financial", new PolicyDefinition(EncryptionMethod.RSA4096, 10, true,
                List.of(BuiltInFrameworks.PCI_DSS, BuiltInFrameworks.SOX), new BigDecimal("0.05")));
        policies.put("personal", new PolicyDefinition(EncryptionMethod.HYBRID, 8, true,
                List.of(BuiltInFrameworks.GDPR, BuiltInFrameworks.CCPA), new BigDecimal("0.2")));
        policies.put("general", new PolicyDefinition(EncryptionMethod.AES256, 6, false,
                List.of(BuiltInFrameworks.ISO27001), new BigDecimal("0.5")));
        return policies;
    }
}
