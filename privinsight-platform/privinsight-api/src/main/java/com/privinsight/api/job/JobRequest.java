package com.privinsight.api.job;

import java.math.BigDecimal;
import java.util.Map;

/**
 * A requester's ask to run one circuit over one stored dataset.
 * {@code metadata} is what the category's compliance frameworks are evaluated against.
 */
public record JobRequest(
        String requester,
        String datasetHandle,
        String category,
        String circuitId,
        BigDecimal epsilon,
        Map<String, Object> metadata
) {}
