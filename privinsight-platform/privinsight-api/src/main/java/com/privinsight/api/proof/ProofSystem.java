package com.privinsight.api.proof;

import java.util.List;

/**
 * Cryptographic check behind {@link ProofVerifier}. Implementations may throw on malformed input;
 * the verifier treats any exception as a rejection.
 */
public interface ProofSystem {

    boolean verify(byte[] keyMaterial, String circuitId, List<String> publicInputs, byte[] proofBytes);
}
