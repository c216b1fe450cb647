package com.privinsight.api.job;

import com.privinsight.core.domain.AnalyticsJob.JobState;

import java.math.BigDecimal;
import java.util.Map;

public record PipelineMetrics(
        Map<JobState, Long> jobsByState,
        long totalJobs,
        int computationsInFlight,
        BigDecimal budgetConsumed,
        BigDecimal budgetReserved
) {
    public PipelineMetrics {
        jobsByState = Map.copyOf(jobsByState);
    }

    public long count(JobState state) {
        return jobsByState.getOrDefault(state, 0L);
    }
}
