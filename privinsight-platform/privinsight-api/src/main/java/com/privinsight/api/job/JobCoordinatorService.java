package com.privinsight.api.job;

import com.privinsight.api.compliance.ComplianceEngine;
import com.privinsight.api.compliance.ComplianceResult;
import com.privinsight.api.compliance.UnknownFrameworkException;
import com.privinsight.api.journal.JobEventDraft;
import com.privinsight.api.journal.LedgerClient;
import com.privinsight.api.journal.MerkleTree;
import com.privinsight.api.ledger.Epsilons;
import com.privinsight.api.ledger.PrivacyLedgerService;
import com.privinsight.api.ledger.PrivacyLedgerService.ReservationResult;
import com.privinsight.api.policy.PrivacyPolicyService;
import com.privinsight.api.possession.PossessionException;
import com.privinsight.api.possession.PossessionProver;
import com.privinsight.api.possession.PossessionStoreService;
import com.privinsight.api.proof.Proof;
import com.privinsight.api.proof.ProofVerifier;
import com.privinsight.core.domain.AnalyticsJob;
import com.privinsight.core.domain.AnalyticsJob.JobState;
import com.privinsight.core.domain.BudgetReservation;
import com.privinsight.core.domain.JobEvent;
import com.privinsight.core.domain.JobEvent.EventType;
import com.privinsight.core.domain.PossessionChallenge;
import com.privinsight.core.domain.PrivacyPolicy;
import com.privinsight.core.domain.RejectionReason;
import com.privinsight.core.repository.AnalyticsJobRepository;
import com.privinsight.core.repository.BudgetReservationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Job Coordinator: drives analytics jobs through
 * PENDING, PROCESSING, COMPLETED or FAILED, then VERIFIED.
 *
 * Budget is reserved at admission and committed only when a job is finalized,
 * so every path into FAILED hands the reservation back. Computation runs
 * asynchronously; its future drives {@link #submitResult} on the callback executor.
 */
@Service
public class JobCoordinatorService {

    private static final Logger log = LoggerFactory.getLogger(JobCoordinatorService.class);

    static final int PUBLIC_INPUT_COUNT = 2;

    private final AnalyticsJobRepository jobRepository;
    private final BudgetReservationRepository reservationRepository;
    private final PrivacyPolicyService policyService;
    private final ComplianceEngine complianceEngine;
    private final PrivacyLedgerService ledgerService;
    private final PossessionStoreService possessionStore;
    private final PossessionProver possessionProver;
    private final ProofVerifier proofVerifier;
    private final ComputationBackend computationBackend;
    private final LedgerClient ledgerClient;
    private final JobCoordinatorConfig config;
    private final Clock clock;
    private final ExecutorService callbackExecutor;
    private final TransactionTemplate transactions;
    private final Map<Long, CompletableFuture<ComputationOutput>> inFlight = new ConcurrentHashMap<>();

    public JobCoordinatorService(
            AnalyticsJobRepository jobRepository,
            BudgetReservationRepository reservationRepository,
            PrivacyPolicyService policyService,
            ComplianceEngine complianceEngine,
            PrivacyLedgerService ledgerService,
            PossessionStoreService possessionStore,
            PossessionProver possessionProver,
            ProofVerifier proofVerifier,
            ComputationBackend computationBackend,
            LedgerClient ledgerClient,
            JobCoordinatorConfig config,
            Clock clock,
            @Qualifier("jobCallbackExecutor") ExecutorService callbackExecutor,
            PlatformTransactionManager transactionManager) {
        this.jobRepository = jobRepository;
        this.reservationRepository = reservationRepository;
        this.policyService = policyService;
        this.complianceEngine = complianceEngine;
        this.ledgerService = ledgerService;
        this.possessionStore = possessionStore;
        this.possessionProver = possessionProver;
        this.proofVerifier = proofVerifier;
        this.computationBackend = computationBackend;
        this.ledgerClient = ledgerClient;
        this.config = config;
        this.clock = clock;
        this.callbackExecutor = callbackExecutor;
        this.transactions = new TransactionTemplate(transactionManager);
    }

    /**
     * Public inputs a result proof must commit to, in order.
     */
    public static List<String> publicInputs(String resultHash, String datasetHandle) {
        return List.of(resultHash, datasetHandle);
    }

    // ==================== Admission ====================

    /**
     * Admits a job: the category must have a policy, the circuit must be registered,
     * the metadata must satisfy every framework of the policy, and the budget must cover epsilon.
     * A rejected submission creates no job and leaves no reservation behind.
     */
    public SubmissionResult submit(JobRequest request) {
        BigDecimal epsilon;
        String metadataHash;
        try {
            validate(request);
            epsilon = Epsilons.normalize(request.epsilon());
            metadataHash = metadataHash(request.metadata());
        } catch (IllegalArgumentException | NullPointerException e) {
            return reject(RejectionReason.MALFORMED_REQUEST, e.getMessage());
        }

        Optional<PrivacyPolicy> policy = policyService.getPolicy(request.category());
        if (policy.isEmpty()) {
            return reject(RejectionReason.UNKNOWN_CATEGORY, "No privacy policy for category " + request.category());
        }
        OptionalInt arity = proofVerifier.publicInputArity(request.circuitId());
        if (arity.isEmpty()) {
            return reject(RejectionReason.UNKNOWN_CIRCUIT, "Circuit not registered: " + request.circuitId());
        }
        if (arity.getAsInt() != PUBLIC_INPUT_COUNT) {
            return reject(RejectionReason.CIRCUIT_ARITY_MISMATCH, "Circuit " + request.circuitId() + " takes "
                    + arity.getAsInt() + " public inputs, results are proven over " + PUBLIC_INPUT_COUNT);
        }

        List<ComplianceResult> complianceResults;
        try {
            complianceResults = complianceEngine.evaluateMany(
                    policy.get().getComplianceFrameworks(), request.metadata());
        } catch (UnknownFrameworkException e) {
            return reject(RejectionReason.UNKNOWN_FRAMEWORK, e.getMessage());
        }
        List<ComplianceResult> failing = complianceResults.stream().filter(r -> !r.compliant()).toList();
        if (!failing.isEmpty()) {
            String frameworks = String.join(", ", failing.stream().map(ComplianceResult::frameworkId).toList());
            log.warn("Rejected job from {} in {}: not compliant with {}",
                    request.requester(), request.category(), frameworks);
            return new SubmissionResult(false, null, RejectionReason.COMPLIANCE_VIOLATION,
                    "Not compliant with " + frameworks, complianceResults, null);
        }

        ReservationResult reservation = ledgerService.checkAndReserve(request.category(), epsilon);
        switch (reservation.outcome()) {
            case UNKNOWN_CATEGORY:
                return reject(RejectionReason.UNKNOWN_CATEGORY, reservation.message());
            case INSUFFICIENT_BUDGET:
                log.warn("Rejected job from {} in {}: {}", request.requester(), request.category(),
                        reservation.message());
                return new SubmissionResult(false, null, RejectionReason.INSUFFICIENT_BUDGET,
                        reservation.message(), complianceResults, reservation.remaining());
            default:
                break;
        }

        UUID reservationId = reservation.reservationId();
        BigDecimal amount = epsilon;
        String requestHash = metadataHash;
        AnalyticsJob job;
        try {
            job = transactions.execute(status -> {
                AnalyticsJob created = jobRepository.save(AnalyticsJob.submit(
                        request.requester(), request.datasetHandle(), request.category(),
                        request.circuitId(), amount, requestHash, reservationId, clock.instant()));
                ledgerService.attachJob(reservationId, created.getId());
                return created;
            });
        } catch (RuntimeException e) {
            log.error("Failed to record job for {} in {}; releasing reservation {}",
                    request.requester(), request.category(), reservationId, e);
            releaseQuietly(reservationId);
            return reject(RejectionReason.SUBMISSION_FAILED, "Job could not be recorded: " + e.getMessage());
        }

        journal(JobEventDraft.transition(job.getId(), EventType.JOB_SUBMITTED, null, JobState.PENDING,
                "epsilon=" + epsilon.toPlainString() + " reservation=" + reservationId));
        log.info("Admitted job {} from {} in {} with epsilon {}",
                job.getId(), request.requester(), request.category(), epsilon);
        return SubmissionResult.accepted(job.getId(), complianceResults, reservation.remaining());
    }

    private SubmissionResult reject(RejectionReason reason, String message) {
        log.warn("Rejected job submission: {} ({})", reason, message);
        return SubmissionResult.rejected(reason, message);
    }

    private static void validate(JobRequest request) {
        Objects.requireNonNull(request, "Job request cannot be null");
        requireText(request.requester(), "Requester");
        requireText(request.datasetHandle(), "Dataset handle");
        requireText(request.category(), "Category");
        requireText(request.circuitId(), "Circuit ID");
        if (request.metadata() == null) {
            throw new IllegalArgumentException("Metadata is required");
        }
        if (request.metadata().keySet().stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Metadata keys cannot be null");
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }

    private static String metadataHash(Map<String, Object> metadata) {
        return MerkleTree.sha256(new TreeMap<>(metadata).toString());
    }

    // ==================== Processing ====================

    /**
     * Moves a PENDING job to PROCESSING, proves possession of its dataset and dispatches
     * the computation. Returns once the computation is dispatched; the result arrives later.
     */
    public TransitionResult beginProcessing(Long jobId) {
        if (jobId == null) {
            return TransitionResult.failure(null, null, RejectionReason.JOB_NOT_FOUND, "Job ID is required");
        }
        Instant now = clock.instant();
        TransitionResult started = transactions.execute(status -> {
            Optional<AnalyticsJob> found = jobRepository.findByIdForUpdate(jobId);
            if (found.isEmpty()) {
                return notFound(jobId);
            }
            AnalyticsJob job = found.get();
            if (job.getState() != JobState.PENDING) {
                return invalidTransition(job, "begin processing");
            }
            job.startProcessing(now.plus(config.getProcessingTimeout()), now);
            jobRepository.save(job);
            return TransitionResult.success(jobId, JobState.PROCESSING, "Processing");
        });
        if (!started.success()) {
            return started;
        }
        journal(JobEventDraft.transition(jobId, EventType.PROCESSING_STARTED, JobState.PENDING, JobState.PROCESSING, null));
        log.info("Job {} moved to PROCESSING", jobId);

        AnalyticsJob job = jobRepository.findById(jobId).orElseThrow();
        TransitionResult possession = provePossession(job);
        if (possession != null) {
            return possession;
        }
        return dispatch(job);
    }

    private TransitionResult provePossession(AnalyticsJob job) {
        Long jobId = job.getId();
        String handle = job.getDatasetHandle();
        PossessionChallenge challenge;
        try {
            challenge = possessionStore.issueChallenge(handle);
        } catch (PossessionException e) {
            RejectionReason reason = switch (e.getFailure()) {
                case STORAGE_EXPIRED -> RejectionReason.STORAGE_EXPIRED;
                case DATASET_NOT_FOUND -> RejectionReason.DATASET_NOT_FOUND;
                default -> RejectionReason.POSSESSION_CHALLENGE_FAILED;
            };
            log.warn("Job {} cannot access dataset {}: {}", jobId, handle, e.getMessage());
            return failed(jobId, failJob(jobId, reason, e.getMessage(), EventType.POSSESSION_FAILED));
        }

        String nonce = challenge.getNonce();
        boolean attached = Boolean.TRUE.equals(transactions.execute(status -> {
            AnalyticsJob locked = jobRepository.findByIdForUpdate(jobId).orElseThrow();
            if (locked.getState() != JobState.PROCESSING) {
                return false;
            }
            locked.attachChallenge(nonce, clock.instant());
            jobRepository.save(locked);
            return true;
        }));
        if (!attached) {
            possessionStore.invalidateChallenge(nonce);
            return currentState(jobId, "Job left PROCESSING before its possession check");
        }

        boolean verified;
        String detail;
        try {
            Optional<String> proof = possessionProver.prove(handle, nonce);
            if (proof.isPresent()) {
                verified = possessionStore.answerChallenge(handle, nonce, proof.get());
                detail = verified ? null : "Possession proof did not verify";
            } else {
                possessionStore.invalidateChallenge(nonce);
                verified = false;
                detail = "No possession proof could be produced";
            }
        } catch (PossessionException e) {
            verified = false;
            detail = e.getMessage();
        }

        if (!verified) {
            log.warn("Possession check failed for job {} on dataset {}: {}", jobId, handle, detail);
            return failed(jobId, failJob(jobId, RejectionReason.POSSESSION_CHALLENGE_FAILED, detail,
                    EventType.POSSESSION_FAILED));
        }
        journal(JobEventDraft.note(jobId, EventType.POSSESSION_VERIFIED, "dataset=" + handle));
        return null;
    }

    private TransitionResult dispatch(AnalyticsJob job) {
        Long jobId = job.getId();
        CompletableFuture<ComputationOutput> future;
        try {
            future = computationBackend.dispatch(jobId, job.getDatasetHandle(), job.getCircuitId());
            if (future == null) {
                throw new IllegalStateException("Computation backend returned no future");
            }
        } catch (RuntimeException e) {
            log.error("Dispatch failed for job {}", jobId, e);
            return failed(jobId, failJob(jobId, RejectionReason.COMPUTATION_FAILED, e.getMessage(),
                    EventType.COMPUTATION_FAILED));
        }

        future.orTimeout(config.getProcessingTimeout().toMillis(), TimeUnit.MILLISECONDS);
        inFlight.put(jobId, future);
        future.whenCompleteAsync((output, error) -> onComputationFinished(jobId, output, error), callbackExecutor);
        journal(JobEventDraft.note(jobId, EventType.COMPUTATION_DISPATCHED, "circuit=" + job.getCircuitId()));
        log.info("Dispatched job {} on circuit {}", jobId, job.getCircuitId());

        // Cancelled while dispatching.
        if (jobRepository.findById(jobId).map(j -> j.getState() != JobState.PROCESSING).orElse(true)) {
            cancelComputation(jobId);
            return currentState(jobId, "Job left PROCESSING during dispatch");
        }
        return TransitionResult.success(jobId, JobState.PROCESSING, "Computation dispatched");
    }

    private void onComputationFinished(Long jobId, ComputationOutput output, Throwable error) {
        inFlight.remove(jobId);
        try {
            if (error == null) {
                if (output == null) {
                    failJob(jobId, RejectionReason.COMPUTATION_FAILED, "Computation produced no output",
                            EventType.COMPUTATION_FAILED);
                    return;
                }
                submitResult(jobId, output.resultHash(), output.proof());
                return;
            }
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
            if (cause instanceof CancellationException) {
                log.debug("Computation for job {} was cancelled", jobId);
            } else if (cause instanceof TimeoutException) {
                log.warn("Computation for job {} timed out after {}", jobId, config.getProcessingTimeout());
                failJob(jobId, RejectionReason.COMPUTATION_TIMEOUT,
                        "No result within " + config.getProcessingTimeout(), EventType.PROCESSING_TIMED_OUT);
            } else {
                log.error("Computation backend failed for job {}", jobId, cause);
                failJob(jobId, RejectionReason.COMPUTATION_FAILED, String.valueOf(cause.getMessage()),
                        EventType.COMPUTATION_FAILED);
            }
        } catch (RuntimeException e) {
            log.error("Could not apply computation outcome for job {}", jobId, e);
        }
    }

    // ==================== Results ====================

    /**
     * Accepts a result for a PROCESSING job if its proof verifies against the job's circuit.
     * A proof that does not verify fails the job and releases its reservation.
     */
    public TransitionResult submitResult(Long jobId, String resultHash, Proof proof) {
        Optional<AnalyticsJob> found = jobId != null ? jobRepository.findById(jobId) : Optional.empty();
        if (found.isEmpty()) {
            return notFound(jobId);
        }
        AnalyticsJob job = found.get();
        if (job.getState() != JobState.PROCESSING) {
            return invalidTransition(job, "submit a result for");
        }
        cancelComputation(jobId);

        if (resultHash == null || proof == null
                || !job.getCircuitId().equals(proof.circuitId())
                || !resultHash.equals(proof.resultHash())) {
            log.warn("Proof for job {} does not match the job's circuit or result", jobId);
            return failed(jobId, failJob(jobId, RejectionReason.PROOF_MISMATCH,
                    "Proof does not match circuit " + job.getCircuitId() + " and the submitted result",
                    EventType.PROOF_REJECTED));
        }

        List<String> expectedInputs = publicInputs(resultHash, job.getDatasetHandle());
        if (!proofVerifier.verify(proof, expectedInputs, job.getCircuitId())) {
            log.warn("Proof REJECTED for job {} on circuit {}", jobId, job.getCircuitId());
            return failed(jobId, failJob(jobId, RejectionReason.PROOF_REJECTED,
                    "Proof rejected by circuit " + job.getCircuitId(), EventType.PROOF_REJECTED));
        }

        TransitionResult completed = transactions.execute(status -> {
            AnalyticsJob locked = jobRepository.findByIdForUpdate(jobId).orElseThrow();
            if (locked.getState() != JobState.PROCESSING) {
                return invalidTransition(locked, "complete");
            }
            locked.complete(resultHash, proof.circuitId(), proof.proofBytes(), proof.publicInputs(), clock.instant());
            jobRepository.save(locked);
            return TransitionResult.success(jobId, JobState.COMPLETED, "Proof accepted");
        });
        if (!completed.success()) {
            return completed;
        }
        journal(JobEventDraft.transition(jobId, EventType.RESULT_ACCEPTED, JobState.PROCESSING,
                JobState.COMPLETED, "result=" + resultHash));
        log.info("Job {} COMPLETED with result {}", jobId, resultHash);

        if (config.isAutoFinalize()) {
            return finalizeJob(jobId);
        }
        return completed;
    }

    /**
     * Commits the job's reservation and moves it from COMPLETED to VERIFIED.
     * This is the only transition that consumes budget. Finalizing a VERIFIED job is a no-op.
     */
    public TransitionResult finalizeJob(Long jobId) {
        if (jobId == null) {
            return notFound(null);
        }
        boolean[] verified = new boolean[1];
        TransitionResult result;
        try {
            result = transactions.execute(status -> {
                Optional<AnalyticsJob> found = jobRepository.findByIdForUpdate(jobId);
                if (found.isEmpty()) {
                    return notFound(jobId);
                }
                AnalyticsJob job = found.get();
                if (job.getState() == JobState.VERIFIED) {
                    return TransitionResult.success(jobId, JobState.VERIFIED, "Already verified");
                }
                if (job.getState() != JobState.COMPLETED) {
                    return invalidTransition(job, "finalize");
                }
                ledgerService.commit(job.getReservationId());
                job.markVerified(clock.instant());
                jobRepository.save(job);
                verified[0] = true;
                return TransitionResult.success(jobId, JobState.VERIFIED, "Verified");
            });
        } catch (RuntimeException e) {
            log.error("Could not commit budget for job {}; it stays COMPLETED", jobId, e);
            return TransitionResult.failure(jobId, JobState.COMPLETED, RejectionReason.LEDGER_UNAVAILABLE,
                    "Budget commit failed: " + e.getMessage());
        }
        if (verified[0]) {
            journal(JobEventDraft.note(jobId, EventType.BUDGET_COMMITTED, null));
            journal(JobEventDraft.transition(jobId, EventType.JOB_VERIFIED, JobState.COMPLETED, JobState.VERIFIED, null));
            log.info("Job {} VERIFIED", jobId);
        }
        return result;
    }

    // ==================== Cancellation ====================

    /**
     * Cancels a PENDING or PROCESSING job, releasing its reservation and any open challenge.
     * Jobs that already reached COMPLETED must be finalized instead.
     */
    public TransitionResult cancel(Long jobId) {
        Optional<AnalyticsJob> failed = failJob(jobId, RejectionReason.CANCELLED, "Cancelled on request",
                EventType.JOB_CANCELLED);
        if (failed.isEmpty()) {
            return jobId != null
                    ? jobRepository.findById(jobId).map(job -> invalidTransition(job, "cancel")).orElseGet(() -> notFound(jobId))
                    : notFound(null);
        }
        cancelComputation(jobId);
        log.info("Job {} cancelled", jobId);
        return TransitionResult.success(jobId, JobState.FAILED, "Cancelled");
    }

    private void cancelComputation(Long jobId) {
        CompletableFuture<ComputationOutput> future = inFlight.remove(jobId);
        if (future != null) {
            future.cancel(true);
        }
    }

    // ==================== Failure ====================

    /**
     * Moves a PENDING or PROCESSING job to FAILED, then releases its reservation and closes
     * its open challenge. A release that fails here is retried by the maintenance sweep.
     *
     * @return the failed job, or empty if the job is missing or not in a failable state
     */
    Optional<AnalyticsJob> failJob(Long jobId, RejectionReason reason, String detail, EventType eventType) {
        if (jobId == null) {
            return Optional.empty();
        }
        JobState[] previous = new JobState[1];
        Optional<AnalyticsJob> failed = transactions.execute(status -> {
            Optional<AnalyticsJob> found = jobRepository.findByIdForUpdate(jobId);
            if (found.isEmpty() || found.get().getState().isTerminal()
                    || found.get().getState() == JobState.COMPLETED) {
                return Optional.<AnalyticsJob>empty();
            }
            AnalyticsJob job = found.get();
            previous[0] = job.getState();
            job.fail(reason, detail, clock.instant());
            return Optional.of(jobRepository.save(job));
        });
        if (failed.isEmpty()) {
            return failed;
        }
        AnalyticsJob job = failed.get();
        journal(JobEventDraft.transition(jobId, eventType, previous[0], JobState.FAILED, reason + ": " + detail));
        log.info("Job {} FAILED: {} ({})", jobId, reason, detail);

        if (job.getChallengeNonce() != null) {
            possessionStore.invalidateChallenge(job.getChallengeNonce());
        }
        if (releaseQuietly(job.getReservationId())) {
            journal(JobEventDraft.note(jobId, EventType.BUDGET_RELEASED, "reservation=" + job.getReservationId()));
        }
        return failed;
    }

    private boolean releaseQuietly(UUID reservationId) {
        try {
            return ledgerService.release(reservationId);
        } catch (RuntimeException e) {
            log.error("Could not release reservation {}; the maintenance sweep will retry", reservationId, e);
            return false;
        }
    }

    /**
     * Reports a failure this call caused or, if another caller moved the job first, its current state.
     */
    private TransitionResult failed(Long jobId, Optional<AnalyticsJob> failed) {
        return failed
                .map(job -> TransitionResult.failure(job.getId(), JobState.FAILED, job.getFailureReason(),
                        job.getFailureDetail()))
                .orElseGet(() -> currentState(jobId, "Job was no longer active"));
    }

    private TransitionResult currentState(Long jobId, String message) {
        return jobRepository.findById(jobId)
                .map(job -> TransitionResult.failure(jobId, job.getState(),
                        job.getFailureReason() != null ? job.getFailureReason() : RejectionReason.INVALID_TRANSITION,
                        message))
                .orElseGet(() -> notFound(jobId));
    }

    private static TransitionResult notFound(Long jobId) {
        return TransitionResult.failure(jobId, null, RejectionReason.JOB_NOT_FOUND, "Job not found: " + jobId);
    }

    private static TransitionResult invalidTransition(AnalyticsJob job, String action) {
        return TransitionResult.failure(job.getId(), job.getState(), RejectionReason.INVALID_TRANSITION,
                "Cannot " + action + " job " + job.getId() + " in state " + job.getState());
    }

    // ==================== Maintenance ====================

    /**
     * Fails PROCESSING jobs whose deadline has passed.
     */
    public int timeOutOverdueJobs() {
        int timedOut = 0;
        for (AnalyticsJob job : jobRepository.findOverdueProcessing(clock.instant())) {
            cancelComputation(job.getId());
            if (failJob(job.getId(), RejectionReason.COMPUTATION_TIMEOUT,
                    "Processing deadline " + job.getProcessingDeadline() + " passed",
                    EventType.PROCESSING_TIMED_OUT).isPresent()) {
                log.warn("Job {} timed out past its processing deadline", job.getId());
                timedOut++;
            }
        }
        return timedOut;
    }

    /**
     * Finalizes COMPLETED jobs left behind, e.g. after a failed budget commit.
     */
    public int finalizeCompletedJobs() {
        int finalized = 0;
        for (AnalyticsJob job : jobRepository.findByState(JobState.COMPLETED)) {
            if (finalizeJob(job.getId()).success()) {
                finalized++;
            }
        }
        return finalized;
    }

    /**
     * Releases reservations still held by FAILED jobs and reservations that never got a job.
     */
    public int releaseStrandedReservations() {
        int released = 0;
        for (BudgetReservation reservation : reservationRepository.findHeldForFailedJobs()) {
            if (releaseQuietly(reservation.getId())) {
                journal(JobEventDraft.note(reservation.getJobId(), EventType.BUDGET_RELEASED,
                        "reservation=" + reservation.getId()));
                released++;
            }
        }
        Instant cutoff = clock.instant().minus(config.getProcessingTimeout());
        for (BudgetReservation reservation : reservationRepository.findOrphanedHeldBefore(cutoff)) {
            if (releaseQuietly(reservation.getId())) {
                log.warn("Released orphaned reservation {} in {}", reservation.getId(), reservation.getCategory());
                released++;
            }
        }
        return released;
    }

    // ==================== Queries ====================

    public Optional<AnalyticsJob> getJob(Long jobId) {
        return jobId != null ? jobRepository.findById(jobId) : Optional.empty();
    }

    public List<AnalyticsJob> jobsFor(String requester) {
        return jobRepository.findByRequesterOrderByIdDesc(requester);
    }

    public List<JobEvent> history(Long jobId) {
        return ledgerClient.read(jobId);
    }

    public PipelineMetrics metrics() {
        Map<JobState, Long> byState = new EnumMap<>(JobState.class);
        long total = 0;
        for (JobState state : JobState.values()) {
            long count = jobRepository.countByState(state);
            byState.put(state, count);
            total += count;
        }
        return new PipelineMetrics(byState, total, inFlight.size(),
                ledgerService.totalConsumed(), ledgerService.totalReserved());
    }

    private void journal(JobEventDraft draft) {
        try {
            ledgerClient.persist(draft);
        } catch (RuntimeException e) {
            log.error("Failed to journal {} for job {}", draft.eventType(), draft.jobId(), e);
        }
    }
}
