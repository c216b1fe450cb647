package com.privinsight.api.compliance;

import com.privinsight.core.domain.ComplianceRule;
import com.privinsight.core.domain.ComplianceRule.RuleCondition;
import com.privinsight.core.domain.ComplianceRule.Severity;
import com.privinsight.core.domain.FrameworkAdvisory;

import java.util.List;

/**
 * Regulatory frameworks registered at startup.
 */
public final class BuiltInFrameworks {

    public static final String GDPR = "GDPR";
    public static final String CCPA = "CCPA";
    public static final String HIPAA = "HIPAA";
    public static final String SOX = "SOX";
    public static final String PCI_DSS = "PCI_DSS";
    public static final String ISO27001 = "ISO27001";

    private BuiltInFrameworks() {}

    public static List<FrameworkDefinition> all() {
        return List.of(gdpr(), ccpa(), hipaa(), sox(), pciDss(), iso27001());
    }

    static FrameworkDefinition gdpr() {
        return new FrameworkDefinition(GDPR, "General Data Protection Regulation", List.of(
                rule("gdpr_consent", "Data subject consent obtained", Severity.CRITICAL,
                        RuleCondition.ALL_TRUE, List.of("hasConsent"),
                        "Obtain explicit consent before processing (fines up to 4% of annual turnover)"),
                rule("gdpr_anonymization", "Data anonymized or pseudonymized", Severity.HIGH,
                        RuleCondition.ANY_TRUE, List.of("isAnonymized", "pseudonymized"),
                        "Anonymize or pseudonymize personal data before analysis"),
                rule("gdpr_purpose_limitation", "Processing purpose stated", Severity.HIGH,
                        RuleCondition.NOT_BLANK, List.of("purpose"),
                        "Declare a specific, explicit and legitimate purpose"),
                rule("gdpr_data_minimization", "Only necessary data collected", Severity.MEDIUM,
                        RuleCondition.ALL_TRUE, List.of("dataMinimized"),
                        "Limit the dataset to fields required for the stated purpose")
        ), List.of(
                FrameworkAdvisory.of("dataProtectionOfficer", "Appoint a Data Protection Officer"),
                FrameworkAdvisory.of("privacyByDesign", "Apply privacy by design in the analytics workflow")
        ));
    }

    static FrameworkDefinition ccpa() {
        return new FrameworkDefinition(CCPA, "California Consumer Privacy Act", List.of(
                rule("ccpa_notice", "Consumers notified of collection", Severity.CRITICAL,
                        RuleCondition.ALL_TRUE, List.of("hasNotice"),
                        "Provide notice at or before the point of collection"),
                rule("ccpa_opt_out", "Opt-out of sale available", Severity.HIGH,
                        RuleCondition.ALL_TRUE, List.of("optOutAvailable"),
                        "Offer a 'Do Not Sell My Personal Information' mechanism"),
                rule("ccpa_deletion", "Deletion requests supported", Severity.MEDIUM,
                        RuleCondition.ALL_TRUE, List.of("deletionMechanism"),
                        "Support verified consumer deletion requests")
        ), List.of(
                FrameworkAdvisory.of("privacyPolicy", "Publish and maintain an up-to-date privacy policy")
        ));
    }

    /**
     * One rule per safeguard, so encryption in transit and at rest are scored separately.
     */
    static FrameworkDefinition hipaa() {
        return new FrameworkDefinition(HIPAA, "Health Insurance Portability and Accountability Act", List.of(
                rule("hipaa_encryption_in_transit", "PHI encrypted in transit", Severity.CRITICAL,
                        RuleCondition.ALL_TRUE, List.of("encryptionInTransit"),
                        "Encrypt protected health information on every network hop"),
                rule("hipaa_encryption_at_rest", "PHI encrypted at rest", Severity.CRITICAL,
                        RuleCondition.ALL_TRUE, List.of("encryptionAtRest"),
                        "Encrypt stored protected health information"),
                rule("hipaa_access_control", "Access to PHI restricted", Severity.CRITICAL,
                        RuleCondition.ALL_TRUE, List.of("accessControl"),
                        "Restrict PHI access to authorized workforce members"),
                rule("hipaa_audit_logging", "Access to PHI audit logged", Severity.HIGH,
                        RuleCondition.ALL_TRUE, List.of("auditLogging"),
                        "Record and review activity on systems holding PHI"),
                rule("hipaa_minimum_necessary", "Minimum necessary PHI used", Severity.HIGH,
                        RuleCondition.ALL_TRUE, List.of("minimumNecessary"),
                        "Limit PHI use to the minimum necessary for the computation")
        ), List.of(
                FrameworkAdvisory.of("businessAssociateAgreement", "Execute Business Associate Agreements with processors"),
                FrameworkAdvisory.of("riskAssessment", "Perform a periodic security risk assessment")
        ));
    }

    static FrameworkDefinition sox() {
        return new FrameworkDefinition(SOX, "Sarbanes-Oxley Act", List.of(
                rule("sox_audit_trail", "Complete audit trail kept", Severity.CRITICAL,
                        RuleCondition.ALL_TRUE, List.of("auditTrail"),
                        "Keep a tamper-evident audit trail of financial data processing"),
                rule("sox_internal_controls", "Internal controls documented", Severity.HIGH,
                        RuleCondition.ALL_TRUE, List.of("internalControls"),
                        "Document and test internal controls over financial reporting")
        ), List.of(
                FrameworkAdvisory.of("segregationOfDuties", "Segregate duties between requesters and approvers")
        ));
    }

    static FrameworkDefinition pciDss() {
        return new FrameworkDefinition(PCI_DSS, "Payment Card Industry Data Security Standard", List.of(
                rule("pci_encryption", "Cardholder data encrypted", Severity.CRITICAL,
                        RuleCondition.ALL_TRUE, List.of("cardDataEncrypted"),
                        "Encrypt stored and transmitted cardholder data"),
                rule("pci_network_security", "Secure network maintained", Severity.HIGH,
                        RuleCondition.ALL_TRUE, List.of("secureNetwork"),
                        "Segment and firewall the cardholder data environment")
        ), List.of(
                FrameworkAdvisory.of("vulnerabilityScanning", "Run quarterly vulnerability scans"),
                FrameworkAdvisory.of("penetrationTesting", "Run annual penetration tests")
        ));
    }

    static FrameworkDefinition iso27001() {
        return new FrameworkDefinition(ISO27001, "ISO/IEC 27001", List.of(
                rule("iso_risk_assessment", "Information security risk assessed", Severity.MEDIUM,
                        RuleCondition.ALL_TRUE, List.of("riskAssessment"),
                        "Assess and treat information security risks"),
                rule("iso_security_controls", "Security controls implemented", Severity.MEDIUM,
                        RuleCondition.ALL_TRUE, List.of("securityControls"),
                        "Implement the Annex A controls selected in the statement of applicability")
        ), List.of(
                FrameworkAdvisory.of("informationSecurityPolicy", "Maintain an information security policy"),
                FrameworkAdvisory.of("incidentResponsePlan", "Maintain an incident response plan")
        ));
    }

    private static ComplianceRule rule(String id, String description, Severity severity,
                                       RuleCondition condition, List<String> fields, String remedy) {
        return ComplianceRule.of(id, description, severity, condition, fields, remedy);
    }
}
