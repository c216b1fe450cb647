package com.privinsight.api.proof;

import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.List;

/**
 * Default proof system: the proof is an HMAC-SHA256 commitment over the circuit id and the
 * length-prefixed public inputs, keyed by the circuit's key material.
 * A SNARK backend plugs in behind {@link ProofSystem} without changes to the verifier.
 */
@Component
public class HmacCommitmentProofSystem implements ProofSystem {

    private static final String ALGORITHM = "HmacSHA256";

    @Override
    public boolean verify(byte[] keyMaterial, String circuitId, List<String> publicInputs, byte[] proofBytes) {
        byte[] expected = prove(keyMaterial, circuitId, publicInputs);
        return MessageDigest.isEqual(expected, proofBytes);
    }

    /**
     * Produces the commitment a prover holding the key material would attach to a result.
     */
    public static byte[] prove(byte[] keyMaterial, String circuitId, List<String> publicInputs) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(keyMaterial, ALGORITHM));
            update(mac, circuitId);
            for (String input : publicInputs) {
                update(mac, input);
            }
            return mac.doFinal();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 not available", e);
        }
    }

    private static void update(Mac mac, String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        mac.update(ByteBuffer.allocate(Integer.BYTES).putInt(bytes.length).array());
        mac.update(bytes);
    }
}
