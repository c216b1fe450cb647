package com.privinsight.api.support;

import com.privinsight.api.compliance.BuiltInFrameworks;
import com.privinsight.api.compliance.ComplianceEngine;
import com.privinsight.api.job.JobCoordinatorService;
import com.privinsight.api.job.JobRequest;
import com.privinsight.api.ledger.PrivacyLedgerService;
import com.privinsight.api.policy.PolicyDefinition;
import com.privinsight.api.policy.PrivacyPolicyService;
import com.privinsight.api.possession.PossessionStoreService;
import com.privinsight.api.proof.HmacCommitmentProofSystem;
import com.privinsight.api.proof.Proof;
import com.privinsight.api.proof.ProofVerifier;
import com.privinsight.api.proof.VerifyingKey;
import com.privinsight.core.domain.AnalyticsJob;
import com.privinsight.core.domain.AnalyticsJob.JobState;
import com.privinsight.core.domain.PrivacyPolicy.EncryptionMethod;
import com.privinsight.core.domain.StoredDataset;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Shared Spring context for pipeline integration tests.
 * Tests are not transactional: ledger reservations and journal appends commit in their own
 * transactions, so every test works in its own uniquely named categories, datasets and circuits.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(PipelineTestConfiguration.class)
public abstract class PipelineIntegrationSupport {

    protected static final Duration LONG_STORAGE = Duration.ofDays(3650);
    protected static final byte[] CIRCUIT_KEY = "circuit-key-material-for-tests".getBytes(StandardCharsets.UTF_8);

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected ScriptedComputationBackend backend;

    @Autowired
    protected JobCoordinatorService coordinator;

    @Autowired
    protected PrivacyLedgerService ledgerService;

    @Autowired
    protected PrivacyPolicyService policyService;

    @Autowired
    protected ComplianceEngine complianceEngine;

    @Autowired
    protected PossessionStoreService possessionStore;

    @Autowired
    protected ProofVerifier proofVerifier;

    protected static String unique(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * A category governed by ISO27001 only, with the given budget.
     */
    protected String newCategory(String limit) {
        String category = unique("cat");
        policyService.setPolicy(category, new PolicyDefinition(EncryptionMethod.AES256, 5, false,
                List.of(BuiltInFrameworks.ISO27001), new BigDecimal(limit)));
        return category;
    }

    protected static Map<String, Object> iso27001Metadata() {
        return Map.of("riskAssessment", true, "securityControls", true);
    }

    protected String newCircuit() {
        String circuitId = unique("circuit");
        proofVerifier.registerCircuit(circuitId, new VerifyingKey(CIRCUIT_KEY, 2));
        return circuitId;
    }

    protected String newDataset() {
        byte[] content = ("dataset " + UUID.randomUUID()).getBytes(StandardCharsets.UTF_8);
        StoredDataset dataset = possessionStore.storeContent(unique("owner"), content, null, LONG_STORAGE);
        return dataset.getContentHash();
    }

    protected JobRequest request(String category, String datasetHandle, String circuitId, String epsilon) {
        return new JobRequest(unique("requester"), datasetHandle, category, circuitId,
                new BigDecimal(epsilon), iso27001Metadata());
    }

    protected static Proof validProof(String circuitId, String resultHash, String datasetHandle) {
        List<String> inputs = JobCoordinatorService.publicInputs(resultHash, datasetHandle);
        return new Proof(circuitId, HmacCommitmentProofSystem.prove(CIRCUIT_KEY, circuitId, inputs), inputs, resultHash);
    }

    protected static Proof forgedProof(String circuitId, String resultHash, String datasetHandle) {
        List<String> inputs = JobCoordinatorService.publicInputs(resultHash, datasetHandle);
        byte[] wrongKey = "not-the-circuit-key".getBytes(StandardCharsets.UTF_8);
        return new Proof(circuitId, HmacCommitmentProofSystem.prove(wrongKey, circuitId, inputs), inputs, resultHash);
    }

    protected AnalyticsJob awaitState(Long jobId, JobState expected) {
        long deadline = System.nanoTime() + Duration.ofSeconds(15).toNanos();
        AnalyticsJob job = coordinator.getJob(jobId).orElseThrow();
        while (job.getState() != expected && System.nanoTime() < deadline) {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            job = coordinator.getJob(jobId).orElseThrow();
        }
        assertThat(job.getState()).as("state of job %s", jobId).isEqualTo(expected);
        return job;
    }
}
