package com.privinsight.api.proof;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Proof over a computation result, bound to one circuit and an ordered list of public inputs.
 */
public record Proof(String circuitId, byte[] proofBytes, List<String> publicInputs, String resultHash) {

    public Proof {
        proofBytes = proofBytes != null ? proofBytes.clone() : null;
        publicInputs = publicInputs != null ? List.copyOf(publicInputs) : null;
    }

    @Override
    public byte[] proofBytes() {
        return proofBytes != null ? proofBytes.clone() : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Proof other)) return false;
        return Objects.equals(circuitId, other.circuitId)
                && Arrays.equals(proofBytes, other.proofBytes)
                && Objects.equals(publicInputs, other.publicInputs)
                && Objects.equals(resultHash, other.resultHash);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(circuitId, publicInputs, resultHash);
        return 31 * result + Arrays.hashCode(proofBytes);
    }

    @Override
    public String toString() {
        return "Proof[circuitId=" + circuitId + ", proofBytes=" + (proofBytes != null ? proofBytes.length : 0)
                + " bytes, publicInputs=" + publicInputs + ", resultHash=" + resultHash + "]";
    }
}
