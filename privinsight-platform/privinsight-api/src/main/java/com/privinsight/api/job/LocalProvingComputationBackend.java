package com.privinsight.api.job;

import com.privinsight.api.possession.PossessionStoreService;
import com.privinsight.api.proof.CircuitRegistryProofVerifier;
import com.privinsight.api.proof.HmacCommitmentProofSystem;
import com.privinsight.api.proof.Proof;
import com.privinsight.api.proof.VerifyingKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * In-process backend: digests the dataset content under the circuit id and proves the
 * result with the circuit's registered key.
 */
@Component
public class LocalProvingComputationBackend implements ComputationBackend {

    private static final Logger log = LoggerFactory.getLogger(LocalProvingComputationBackend.class);

    private final PossessionStoreService possessionStore;
    private final CircuitRegistryProofVerifier circuitRegistry;
    private final ExecutorService computationExecutor;

    public LocalProvingComputationBackend(
            PossessionStoreService possessionStore,
            CircuitRegistryProofVerifier circuitRegistry,
            @Qualifier("computationExecutor") ExecutorService computationExecutor) {
        this.possessionStore = possessionStore;
        this.circuitRegistry = circuitRegistry;
        this.computationExecutor = computationExecutor;
    }

    @Override
    public CompletableFuture<ComputationOutput> dispatch(Long jobId, String datasetHandle, String circuitId) {
        return CompletableFuture.supplyAsync(() -> compute(jobId, datasetHandle, circuitId), computationExecutor);
    }

    ComputationOutput compute(Long jobId, String datasetHandle, String circuitId) {
        VerifyingKey key = circuitRegistry.getVerifyingKey(circuitId)
                .orElseThrow(() -> new IllegalStateException("Circuit not registered: " + circuitId));
        byte[] content = possessionStore.read(datasetHandle);

        String resultHash = resultDigest(circuitId, content);
        List<String> publicInputs = JobCoordinatorService.publicInputs(resultHash, datasetHandle);
        byte[] proofBytes = HmacCommitmentProofSystem.prove(key.keyMaterial(), circuitId, publicInputs);
        log.debug("Computed result {} for job {} on circuit {}", resultHash, jobId, circuitId);
        return new ComputationOutput(resultHash, new Proof(circuitId, proofBytes, publicInputs, resultHash));
    }

    static String resultDigest(String circuitId, byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(circuitId.getBytes(StandardCharsets.UTF_8));
            digest.update(content);
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
