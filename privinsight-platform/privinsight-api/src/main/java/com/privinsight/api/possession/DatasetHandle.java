package com.privinsight.api.possession;

import java.util.Objects;

/**
 * Immutable reference to a content-addressed encrypted dataset.
 * Jobs hold the content hash, never the bytes.
 */
public record DatasetHandle(String contentHash, String owner, String encryptionMetadataHash) {

    public DatasetHandle {
        Objects.requireNonNull(contentHash, "Content hash cannot be null");
        Objects.requireNonNull(owner, "Owner cannot be null");
        if (contentHash.isBlank()) {
            throw new IllegalArgumentException("Content hash cannot be blank");
        }
    }
}
