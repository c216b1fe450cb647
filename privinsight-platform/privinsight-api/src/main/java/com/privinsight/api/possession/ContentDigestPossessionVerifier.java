package com.privinsight.api.possession;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;

/**
 * Verifies that a proof equals SHA-256(nonce || content), hex encoded.
 *
 * A fresh nonce forces the prover to hash the full content again, so an
 * answer to an earlier nonce is useless for a new challenge.
 */
@Component
public class ContentDigestPossessionVerifier implements PossessionProofVerifier {

    private final ContentStore contentStore;

    public ContentDigestPossessionVerifier(ContentStore contentStore) {
        this.contentStore = contentStore;
    }

    @Override
    public boolean verify(String proof, String nonce, String datasetHandle) {
        if (proof == null || proof.isBlank() || nonce == null || datasetHandle == null) {
            return false;
        }
        Optional<byte[]> content = contentStore.get(datasetHandle);
        if (content.isEmpty()) {
            return false;
        }
        String expected = digest(nonce, content.get());
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.US_ASCII),
                proof.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII));
    }

    public static String digest(String nonce, byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(nonce.getBytes(StandardCharsets.UTF_8));
            digest.update(content);
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 not available", e);
        }
    }
}
