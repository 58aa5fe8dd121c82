package triage.orchestrator.executor;

import triage.orchestrator.exception.PoolExhaustedException;
import triage.orchestrator.exception.ServiceShuttingDownException;
import triage.orchestrator.model.JobOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded set of worker threads running job bodies.
 *
 * <p>
 * Each accepted job is wrapped in a {@link JobFuture} whose done() hook fires
 * the completion callback exactly once: after the body returns, after it
 * throws, or when the future is cancelled before it started. Workers are
 * daemon threads so a stuck inference call can never hold the JVM open.
 */
public class ExecutionPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutionPool.class);

    private final ThreadPoolExecutor executor;
    private final ConcurrentHashMap<String, JobFuture> inFlight = new ConcurrentHashMap<>();
    private final CompletionCallback callback;

    public ExecutionPool(int workers, int queueCapacity, CompletionCallback callback) {
        AtomicInteger seq = new AtomicInteger(1);
        this.executor = new ThreadPoolExecutor(
                workers, workers,
                0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                r -> {
                    Thread t = new Thread(r, "triage-worker-" + seq.getAndIncrement());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
        this.callback = callback;
        log.info("Execution pool created: workers={}, queueCapacity={}", workers, queueCapacity);
    }

    /**
     * Hand a job body to the pool. Returns immediately.
     *
     * @throws PoolExhaustedException        if the queue is full
     * @throws ServiceShuttingDownException if the pool no longer accepts work
     */
    public void submit(String jobId, Callable<JobOutcome> body) {
        if (executor.isShutdown()) {
            throw new ServiceShuttingDownException();
        }
        JobFuture future = new JobFuture(jobId, body);
        inFlight.put(jobId, future);
        try {
            executor.execute(future);
        } catch (RejectedExecutionException e) {
            inFlight.remove(jobId, future);
            if (executor.isShutdown()) {
                throw new ServiceShuttingDownException();
            }
            throw new PoolExhaustedException("Execution pool is full (" + executor.getQueue().size()
                    + " jobs waiting)", e);
        }
    }

    /**
     * Cancel a job that has not started yet. Running bodies are left alone;
     * they observe their cancellation token instead.
     *
     * @return true if the pending future was cancelled
     */
    public boolean cancel(String jobId) {
        JobFuture future = inFlight.get(jobId);
        if (future == null || future.started.get()) {
            return false;
        }
        // a worker may take the future between the check and the removal
        return executor.remove(future) && future.cancel(false);
    }

    /**
     * Refuse new work and cancel every job still waiting in the queue.
     *
     * @return number of pending jobs cancelled
     */
    public int shutdown() {
        executor.shutdown();
        List<Runnable> pending = new ArrayList<>();
        executor.getQueue().drainTo(pending);
        int cancelled = cancelAll(pending);
        log.info("Execution pool shut down, {} pending jobs cancelled, {} running", cancelled, activeWorkers());
        return cancelled;
    }

    /**
     * Interrupt running workers. Bodies treat an interrupt as a cancellation
     * request; a backend blocked in uninterruptible code will not notice.
     */
    public void interruptWorkers() {
        List<Runnable> pending = executor.shutdownNow();
        cancelAll(pending);
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isTerminated() {
        return executor.isTerminated();
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    /** Workers currently executing a body. */
    public int activeWorkers() {
        return executor.getActiveCount();
    }

    /** Jobs accepted but whose callback has not fired yet. */
    public int inFlight() {
        return inFlight.size();
    }

    public int queued() {
        return executor.getQueue().size();
    }

    @Override
    public void close() {
        interruptWorkers();
    }

    private int cancelAll(List<Runnable> runnables) {
        int cancelled = 0;
        for (Runnable r : runnables) {
            if (r instanceof JobFuture f && f.cancel(false)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    /**
     * FutureTask that reports its own completion.
     */
    private final class JobFuture extends FutureTask<JobOutcome> {
        private final String jobId;
        private final AtomicBoolean started = new AtomicBoolean(false);

        JobFuture(String jobId, Callable<JobOutcome> body) {
            super(body);
            this.jobId = jobId;
        }

        @Override
        public void run() {
            started.set(true);
            super.run();
        }

        @Override
        protected void done() {
            inFlight.remove(jobId, this);
            JobOutcome outcome = null;
            Throwable failure = null;
            try {
                outcome = get();
            } catch (ExecutionException e) {
                failure = e.getCause() != null ? e.getCause() : e;
            } catch (InterruptedException e) {
                // done() runs after completion, get() cannot block here
                Thread.currentThread().interrupt();
                failure = e;
            } catch (RuntimeException e) {
                // CancellationException
                failure = e;
            }
            try {
                callback.onCompletion(jobId, outcome, failure);
            } catch (RuntimeException e) {
                log.error("Completion callback for job {} failed", jobId, e);
            }
        }
    }
}
