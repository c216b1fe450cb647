package com.privinsight.api.possession;

import org.springframework.stereotype.Component;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local content store keyed by the SHA-256 of the stored bytes.
 */
@Component
public class InMemoryContentStore implements ContentStore {

    private final Map<String, byte[]> blobs = new ConcurrentHashMap<>();
    private final Set<String> pinned = ConcurrentHashMap.newKeySet();

    @Override
    public String put(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("Content cannot be null");
        }
        String handle = sha256Hex(bytes);
        blobs.putIfAbsent(handle, bytes.clone());
        return handle;
    }

    @Override
    public Optional<byte[]> get(String handle) {
        byte[] bytes = blobs.get(handle);
        return bytes != null ? Optional.of(bytes.clone()) : Optional.empty();
    }

    @Override
    public void pin(String handle) {
        if (!blobs.containsKey(handle)) {
            throw new IllegalArgumentException("Unknown content handle: " + handle);
        }
        pinned.add(handle);
    }

    public boolean isPinned(String handle) {
        return pinned.contains(handle);
    }

    /**
     * Drops a blob, pinned or not. Used to simulate loss of the underlying data.
     */
    public void remove(String handle) {
        blobs.remove(handle);
        pinned.remove(handle);
    }

    static String sha256Hex(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 not available", e);
        }
    }
}
