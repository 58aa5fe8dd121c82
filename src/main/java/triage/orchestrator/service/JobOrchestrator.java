package triage.orchestrator.service;

import triage.orchestrator.backend.InferenceBackend;
import triage.orchestrator.config.OrchestratorConfig;
import triage.orchestrator.core.CancellationDirectory;
import triage.orchestrator.core.CancellationToken;
import triage.orchestrator.exception.InvalidJobStateException;
import triage.orchestrator.exception.InvalidRequestException;
import triage.orchestrator.exception.JobNotFoundException;
import triage.orchestrator.exception.PoolExhaustedException;
import triage.orchestrator.exception.ServiceShuttingDownException;
import triage.orchestrator.executor.ClassificationJob;
import triage.orchestrator.executor.ExecutionPool;
import triage.orchestrator.model.CompletionApplyResult;
import triage.orchestrator.model.JobOutcome;
import triage.orchestrator.model.JobRecord;
import triage.orchestrator.model.JobSnapshot;
import triage.orchestrator.model.JobState;
import triage.orchestrator.repository.JobRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Façade over the job registry, cancellation directory and execution pool.
 * Accepts submissions, applies worker outcomes and exposes cancel/query.
 *
 * <p>
 * State machine: QUEUED → PROCESSING → {COMPLETED, FAILED, ABORTED}, with
 * ABORTED also reachable from QUEUED. A terminal record is never overwritten;
 * in particular a late worker result never replaces ABORTED.
 */
public class JobOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JobOrchestrator.class);

    private final JobRegistry registry;
    private final CancellationDirectory cancellations;
    private final ExecutionPool pool;
    private final InferenceBackend backend;
    private final OrchestratorConfig config;
    private final Clock clock;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public JobOrchestrator(JobRegistry registry,
            CancellationDirectory cancellations,
            InferenceBackend backend,
            OrchestratorConfig config,
            Clock clock) {
        this.registry = registry;
        this.cancellations = cancellations;
        this.backend = backend;
        this.config = config;
        this.clock = clock;
        this.pool = new ExecutionPool(config.maxWorkers(), config.queueCapacity(), this::applyOutcome);
    }

    /**
     * Create a job and dispatch it. Returns as soon as the body is queued.
     *
     * @param items      texts to classify, 1..maxBatchSize
     * @param categories candidate labels, at least one
     * @return the record as it stood right after dispatch (PROCESSING)
     * @throws InvalidRequestException       if the batch is empty, oversized or has blank entries
     * @throws PoolExhaustedException        if the pool has no room
     * @throws ServiceShuttingDownException if shutdown has begun
     */
    public JobRecord submit(List<String> items, List<String> categories) {
        if (shuttingDown.get()) {
            throw new ServiceShuttingDownException();
        }
        validate(items, categories);

        Instant now = clock.instant();
        JobRecord created = registry.create(items, categories, now);
        String jobId = created.id();
        CancellationToken token = cancellations.create(jobId);

        // shutdown may have aborted the record between create and here
        JobRecord dispatched = registry.update(jobId, r -> r.isTerminal() ? r : r.markProcessing(now))
                .orElse(null);
        if (dispatched == null || dispatched.status() != JobState.PROCESSING) {
            registry.delete(jobId);
            cancellations.remove(jobId);
            log.warn("Rejected job {}: shutdown began during submit", jobId);
            throw new ServiceShuttingDownException();
        }

        ClassificationJob body = new ClassificationJob(
                jobId, items, categories, backend, token, this::applyProgress, clock);
        try {
            pool.submit(jobId, body);
        } catch (PoolExhaustedException | ServiceShuttingDownException e) {
            registry.delete(jobId);
            cancellations.remove(jobId);
            log.warn("Rejected job {}: {}", jobId, e.getMessage());
            throw e;
        }

        log.info("Submitted job {} with {} items and {} categories", jobId, items.size(), categories.size());
        return dispatched;
    }

    private void validate(List<String> items, List<String> categories) {
        if (items == null || items.isEmpty() || categories == null || categories.isEmpty()) {
            throw new InvalidRequestException("Items and categories required");
        }
        if (items.size() > config.maxBatchSize()) {
            throw new InvalidRequestException("Maximum " + config.maxBatchSize() + " items allowed");
        }
        if (items.stream().anyMatch(s -> s == null || s.isBlank())) {
            throw new InvalidRequestException("Items must not be blank");
        }
        if (categories.stream().anyMatch(s -> s == null || s.isBlank())) {
            throw new InvalidRequestException("Categories must not be blank");
        }
    }

    /**
     * Progress report from a running body. Only moves forward, only while PROCESSING.
     */
    void applyProgress(String jobId, double fraction) {
        registry.update(jobId, r -> r.withProgress(fraction));
    }

    /**
     * Completion callback: write a finished body's outcome into its record.
     * Safe to call more than once and in any order relative to cancel or shutdown.
     */
    public CompletionApplyResult applyOutcome(String jobId, JobOutcome outcome, Throwable failure) {
        Instant now = clock.instant();
        AtomicReference<CompletionApplyResult> result = new AtomicReference<>(CompletionApplyResult.NOT_FOUND);
        String outcomeLog = outcome != null ? outcome.log() : null;

        try {
            registry.update(jobId, current -> {
                if (current.status() == JobState.ABORTED) {
                    if (current.log() == null && outcomeLog != null) {
                        result.set(CompletionApplyResult.LOG_ATTACHED);
                        return current.withLog(outcomeLog);
                    }
                    result.set(CompletionApplyResult.ALREADY_TERMINAL);
                    return current;
                }
                if (current.isTerminal()) {
                    result.set(CompletionApplyResult.ALREADY_TERMINAL);
                    return current;
                }
                result.set(CompletionApplyResult.APPLIED);
                return transition(current, outcome, failure, now);
            });
        } catch (RuntimeException e) {
            // outcome did not fit the record; fail the job rather than leave it running
            log.error("Could not apply outcome for job {}", jobId, e);
            registry.update(jobId, current -> current.isTerminal()
                    ? current
                    : current.fail("internal error: " + e.getMessage(), outcomeLog, now));
            result.set(CompletionApplyResult.APPLIED);
        }

        if (result.get() != CompletionApplyResult.NOT_FOUND) {
            cancellations.remove(jobId);
        }

        switch (result.get()) {
            case APPLIED -> registry.get(jobId).ifPresent(r -> log.info("Job {} finished: {}", jobId, r.status()));
            case LOG_ATTACHED -> log.debug("Job {} already aborted, attached worker log", jobId);
            case ALREADY_TERMINAL -> log.debug("Ignoring late outcome for job {}", jobId);
            case NOT_FOUND -> log.debug("Outcome for job {} arrived after it was reaped", jobId);
        }
        return result.get();
    }

    private static JobRecord transition(JobRecord current, JobOutcome outcome, Throwable failure, Instant now) {
        if (outcome == null) {
            if (failure instanceof CancellationException) {
                return current.abort(null, now);
            }
            String msg = failure != null ? String.valueOf(failure.getMessage()) : "no outcome";
            return current.fail("worker error: " + msg, null, now);
        }
        return switch (outcome.status()) {
            case COMPLETED -> current.complete(outcome.results(), outcome.log(), now);
            case FAILED -> current.fail(outcome.error(), outcome.log(), now);
            case ABORTED -> current.abort(outcome.log(), now);
            default -> throw new IllegalStateException("non-terminal outcome " + outcome.status());
        };
    }

    /**
     * Request cancellation. The record turns ABORTED immediately; the worker stops
     * at its next item boundary.
     *
     * @throws JobNotFoundException     if the id is unknown
     * @throws InvalidJobStateException if the job is already terminal
     */
    public JobRecord cancel(String jobId) {
        JobRecord current = registry.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (current.isTerminal()) {
            throw alreadyFinished(current);
        }

        cancellations.signal(jobId);
        Instant now = clock.instant();
        JobRecord updated = registry.update(jobId, r -> r.isTerminal() ? r : r.abort(null, now))
                .orElseThrow(() -> new JobNotFoundException(jobId));

        if (updated.status() != JobState.ABORTED) {
            // completion landed between our read and write
            throw alreadyFinished(updated);
        }

        pool.cancel(jobId);
        cancellations.remove(jobId);
        log.info("Cancelled job {}", jobId);
        return updated;
    }

    private static InvalidJobStateException alreadyFinished(JobRecord job) {
        return new InvalidJobStateException(job.id(), job.status(),
                "Job already finished (status: " + job.status().value() + ")");
    }

    /**
     * @throws JobNotFoundException if the id is unknown
     */
    public JobSnapshot query(String jobId) {
        JobRecord job = registry.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        return new JobSnapshot(job, job.duration(clock.instant()));
    }

    /**
     * @return the COMPLETED record, whose results are in input order
     * @throws JobNotFoundException     if the id is unknown
     * @throws InvalidJobStateException if the job is not COMPLETED
     */
    public JobRecord results(String jobId) {
        JobRecord job = registry.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (job.status() != JobState.COMPLETED) {
            throw new InvalidJobStateException(jobId, job.status(),
                    "Job not completed yet (status: " + job.status().value() + ")");
        }
        return job;
    }

    /**
     * @return the captured log, empty if none yet
     * @throws JobNotFoundException if the id is unknown
     */
    public String log(String jobId) {
        JobRecord job = registry.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        return job.log() != null ? job.log() : "";
    }

    public Optional<JobRecord> find(String jobId) {
        return registry.get(jobId);
    }

    public int activeJobCount() {
        return registry.countActive();
    }

    public int totalJobCount() {
        return registry.count();
    }

    // ---- shutdown support ----

    /**
     * Flip the shutdown flag; new submissions are rejected from now on.
     *
     * @return true if this call started the shutdown
     */
    public boolean beginShutdown() {
        return shuttingDown.compareAndSet(false, true);
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    /**
     * Signal and force every non-terminal job to ABORTED.
     *
     * @return number of jobs aborted
     */
    public int abortAllActive() {
        Instant now = clock.instant();
        int aborted = 0;
        for (String jobId : registry.listActive()) {
            cancellations.signal(jobId);
            Optional<JobRecord> updated = registry.update(jobId, r -> r.isTerminal() ? r : r.abort(null, now));
            if (updated.isPresent() && updated.get().status() == JobState.ABORTED) {
                aborted++;
            }
            cancellations.remove(jobId);
        }
        return aborted;
    }

    public JobRegistry registry() {
        return registry;
    }

    public CancellationDirectory cancellations() {
        return cancellations;
    }

    public ExecutionPool pool() {
        return pool;
    }

    public Clock clock() {
        return clock;
    }

    @Override
    public void close() {
        beginShutdown();
        pool.close();
    }
}
