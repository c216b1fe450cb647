package com.privinsight.api.possession;

/**
 * Pluggable possession-proof predicate.
 *
 * Implementations must be deterministic, must return {@code false} for any
 * wrong or malformed proof, and may only depend on the proof, the disclosed
 * nonce and the dataset behind the handle.
 */
public interface PossessionProofVerifier {

    boolean verify(String proof, String nonce, String datasetHandle);
}
