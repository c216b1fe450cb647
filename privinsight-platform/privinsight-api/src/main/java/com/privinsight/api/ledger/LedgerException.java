package com.privinsight.api.ledger;

/**
 * Failure raised by the privacy ledger, carrying its specific reason.
 */
public class LedgerException extends RuntimeException {

    private final LedgerFailure failure;

    public LedgerException(LedgerFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public LedgerFailure getFailure() {
        return failure;
    }

    public enum LedgerFailure {
        UNKNOWN_CATEGORY,
        RESET_NOT_DUE,
        RESERVATION_NOT_FOUND,
        RESERVATION_NOT_HELD,
        LIMIT_BELOW_USAGE
    }
}
