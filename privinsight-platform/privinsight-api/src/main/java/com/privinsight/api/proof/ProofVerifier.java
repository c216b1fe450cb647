package com.privinsight.api.proof;

import java.util.List;
import java.util.OptionalInt;

/**
 * Validates proofs against registered circuits.
 * {@link #verify} is a pure function of its arguments and the registered key; it never throws.
 */
public interface ProofVerifier {

    CircuitRegistrationOutcome registerCircuit(String circuitId, VerifyingKey verifyingKey);

    boolean verify(Proof proof, List<String> publicInputs, String circuitId);

    boolean isRegistered(String circuitId);

    /**
     * Number of public inputs the circuit expects, or empty if it is not registered.
     */
    OptionalInt publicInputArity(String circuitId);

    enum CircuitRegistrationOutcome {
        REGISTERED,
        ALREADY_REGISTERED
    }
}
