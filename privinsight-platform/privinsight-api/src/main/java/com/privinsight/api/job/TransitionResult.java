package com.privinsight.api.job;

import com.privinsight.core.domain.AnalyticsJob.JobState;
import com.privinsight.core.domain.RejectionReason;
import com.privinsight.core.domain.RejectionReason.ErrorClass;

/**
 * Outcome of a requested job transition.
 * {@code state} is the job's state afterwards, or null when the job does not exist.
 * A failed transition always names a reason.
 */
public record TransitionResult(boolean success, Long jobId, JobState state, RejectionReason reason, String message) {

    public static TransitionResult success(Long jobId, JobState state, String message) {
        return new TransitionResult(true, jobId, state, null, message);
    }

    public static TransitionResult failure(Long jobId, JobState state, RejectionReason reason, String message) {
        return new TransitionResult(false, jobId, state, reason, message);
    }

    public ErrorClass errorClass() {
        return reason != null ? reason.errorClass() : null;
    }
}
