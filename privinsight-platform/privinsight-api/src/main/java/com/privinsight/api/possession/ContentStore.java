package com.privinsight.api.possession;

import java.util.Optional;

/**
 * Content-addressed blob storage backing the possession store's data path.
 */
public interface ContentStore {

    /**
     * Stores the bytes and returns their content handle.
     */
    String put(byte[] bytes);

    Optional<byte[]> get(String handle);

    void pin(String handle);
}
