package com.privinsight.api.possession;

import java.util.Optional;

/**
 * Produces a possession proof for a challenge nonce from locally held data.
 */
public interface PossessionProver {

    /**
     * @return the proof, or empty when the data is not held
     */
    Optional<String> prove(String datasetHandle, String nonce);
}
