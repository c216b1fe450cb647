package com.privinsight.api.support;

import com.privinsight.api.job.ComputationBackend;
import com.privinsight.api.job.ComputationOutput;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Backend whose results are supplied by the test, per job.
 */
public class ScriptedComputationBackend implements ComputationBackend {

    private final Map<Long, CompletableFuture<ComputationOutput>> dispatched = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<ComputationOutput> dispatch(Long jobId, String datasetHandle, String circuitId) {
        return dispatched.computeIfAbsent(jobId, id -> new CompletableFuture<>());
    }

    public boolean wasDispatched(Long jobId) {
        return dispatched.containsKey(jobId);
    }

    public Optional<CompletableFuture<ComputationOutput>> future(Long jobId) {
        return Optional.ofNullable(dispatched.get(jobId));
    }

    public void complete(Long jobId, ComputationOutput output) {
        requireDispatched(jobId).complete(output);
    }

    public void fail(Long jobId, Throwable error) {
        requireDispatched(jobId).completeExceptionally(error);
    }

    private CompletableFuture<ComputationOutput> requireDispatched(Long jobId) {
        CompletableFuture<ComputationOutput> future = dispatched.get(jobId);
        if (future == null) {
            throw new IllegalStateException("Job " + jobId + " was never dispatched");
        }
        return future;
    }
}
