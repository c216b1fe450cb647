package com.privinsight.api.job;

import com.privinsight.api.compliance.ComplianceResult;
import com.privinsight.core.domain.RejectionReason;
import com.privinsight.core.domain.RejectionReason.ErrorClass;

import java.math.BigDecimal;
import java.util.List;

/**
 * Admission outcome. A rejected submission carries the specific reason and never a job id.
 */
public record SubmissionResult(
        boolean accepted,
        Long jobId,
        RejectionReason reason,
        String message,
        List<ComplianceResult> complianceResults,
        BigDecimal remainingBudget
) {
    public SubmissionResult {
        complianceResults = complianceResults != null ? List.copyOf(complianceResults) : List.of();
    }

    public static SubmissionResult accepted(Long jobId, List<ComplianceResult> complianceResults,
                                            BigDecimal remainingBudget) {
        return new SubmissionResult(true, jobId, null, "Accepted", complianceResults, remainingBudget);
    }

    public static SubmissionResult rejected(RejectionReason reason, String message) {
        return new SubmissionResult(false, null, reason, message, List.of(), null);
    }

    public ErrorClass errorClass() {
        return reason != null ? reason.errorClass() : null;
    }

    /**
     * Every violation across the evaluated frameworks.
     */
    public List<ComplianceResult.Violation> violations() {
        return complianceResults.stream().flatMap(r -> r.violations().stream()).toList();
    }
}
