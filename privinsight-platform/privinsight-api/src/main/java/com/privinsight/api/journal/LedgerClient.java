package com.privinsight.api.journal;

import com.privinsight.core.domain.JobEvent;

import java.util.List;

/**
 * Durable, append-only record of job events.
 */
public interface LedgerClient {

    JobEvent persist(JobEventDraft draft);

    List<JobEvent> read(Long jobId);
}
