package com.privinsight.api.possession;

import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Answers challenges from the local content store.
 */
@Component
public class ContentStorePossessionProver implements PossessionProver {

    private final ContentStore contentStore;

    public ContentStorePossessionProver(ContentStore contentStore) {
        this.contentStore = contentStore;
    }

    @Override
    public Optional<String> prove(String datasetHandle, String nonce) {
        return contentStore.get(datasetHandle)
                .map(content -> ContentDigestPossessionVerifier.digest(nonce, content));
    }
}
