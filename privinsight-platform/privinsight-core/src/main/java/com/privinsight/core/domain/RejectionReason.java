package com.privinsight.core.domain;

/**
 * Specific reason a job was not admitted or did not reach a successful terminal state.
 */
public enum RejectionReason {

    MALFORMED_REQUEST(ErrorClass.ADMISSION),
    UNKNOWN_CATEGORY(ErrorClass.ADMISSION),
    UNKNOWN_FRAMEWORK(ErrorClass.ADMISSION),
    UNKNOWN_CIRCUIT(ErrorClass.ADMISSION),
    CIRCUIT_ARITY_MISMATCH(ErrorClass.ADMISSION),
    COMPLIANCE_VIOLATION(ErrorClass.ADMISSION),
    INSUFFICIENT_BUDGET(ErrorClass.ADMISSION),
    SUBMISSION_FAILED(ErrorClass.ADMISSION),

    DATASET_NOT_FOUND(ErrorClass.POSSESSION),
    STORAGE_EXPIRED(ErrorClass.POSSESSION),
    POSSESSION_CHALLENGE_FAILED(ErrorClass.POSSESSION),

    COMPUTATION_FAILED(ErrorClass.COMPUTATION),
    COMPUTATION_TIMEOUT(ErrorClass.COMPUTATION),

    PROOF_REJECTED(ErrorClass.PROOF),
    PROOF_MISMATCH(ErrorClass.PROOF),

    CANCELLED(ErrorClass.CANCELLATION),

    JOB_NOT_FOUND(ErrorClass.TRANSITION),
    INVALID_TRANSITION(ErrorClass.TRANSITION),
    LEDGER_UNAVAILABLE(ErrorClass.TRANSITION);

    public enum ErrorClass {
        /** Recoverable by the caller: fix metadata, request less epsilon, wait for a reset. */
        ADMISSION,
        /** Recoverable by re-storing or renewing the dataset. */
        POSSESSION,
        /** Backend failure or timeout; the job may be resubmitted. */
        COMPUTATION,
        /** The computation or its proof is untrustworthy. */
        PROOF,
        CANCELLATION,
        TRANSITION
    }

    private final ErrorClass errorClass;

    RejectionReason(ErrorClass errorClass) {
        this.errorClass = errorClass;
    }

    public ErrorClass errorClass() {
        return errorClass;
    }
}
