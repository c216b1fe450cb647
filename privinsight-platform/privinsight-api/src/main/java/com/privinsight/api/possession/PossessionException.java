package com.privinsight.api.possession;

/**
 * Failure raised by the possession store, carrying its specific reason.
 */
public class PossessionException extends RuntimeException {

    private final PossessionFailure failure;

    public PossessionException(PossessionFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public PossessionFailure getFailure() {
        return failure;
    }

    public enum PossessionFailure {
        DATASET_NOT_FOUND,
        ALREADY_EXISTS,
        SIZE_EXCEEDS_LIMIT,
        STORAGE_EXPIRED,
        CHALLENGE_NOT_FOUND,
        CHALLENGE_ALREADY_ANSWERED,
        CHALLENGE_INVALIDATED,
        CHALLENGE_EXPIRED
    }
}
