package com.privinsight.api.proof;

/**
 * Verifying key for a circuit together with the number of public inputs the circuit expects.
 */
public record VerifyingKey(byte[] keyMaterial, int publicInputArity) {

    public VerifyingKey {
        if (keyMaterial == null || keyMaterial.length == 0) {
            throw new IllegalArgumentException("Key material cannot be empty");
        }
        if (publicInputArity < 0) {
            throw new IllegalArgumentException("Public input arity cannot be negative");
        }
        keyMaterial = keyMaterial.clone();
    }

    @Override
    public byte[] keyMaterial() {
        return keyMaterial.clone();
    }
}
