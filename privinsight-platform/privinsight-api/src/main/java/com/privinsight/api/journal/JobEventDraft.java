package com.privinsight.api.journal;

import com.privinsight.core.domain.AnalyticsJob.JobState;
import com.privinsight.core.domain.JobEvent.EventType;

/**
 * An event about to be appended to the journal; the journal assigns time and chain hashes.
 */
public record JobEventDraft(Long jobId, EventType eventType, JobState fromState, JobState toState, String detail) {

    public static JobEventDraft transition(Long jobId, EventType eventType, JobState from, JobState to, String detail) {
        return new JobEventDraft(jobId, eventType, from, to, detail);
    }

    public static JobEventDraft note(Long jobId, EventType eventType, String detail) {
        return new JobEventDraft(jobId, eventType, null, null, detail);
    }
}
