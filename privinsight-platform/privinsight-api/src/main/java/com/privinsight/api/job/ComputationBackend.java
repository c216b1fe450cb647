package com.privinsight.api.job;

import java.util.concurrent.CompletableFuture;

/**
 * Runs a circuit over a dataset. The coordinator only consumes the returned future;
 * implementations must not block the calling thread.
 */
public interface ComputationBackend {

    CompletableFuture<ComputationOutput> dispatch(Long jobId, String datasetHandle, String circuitId);
}
