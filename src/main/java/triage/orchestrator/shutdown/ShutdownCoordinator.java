package triage.orchestrator.shutdown;

import triage.orchestrator.config.OrchestratorConfig;
import triage.orchestrator.executor.ExecutionPool;
import triage.orchestrator.scheduler.Scheduler;
import triage.orchestrator.service.JobOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntConsumer;

/**
 * Drains the orchestrator on a termination signal or fatal error.
 *
 * Sequence (every step logged, none blocks longer than its grace period):
 * 1. Flip the shutdown flag and stop the reaper
 * 2. Force every non-terminal job to ABORTED
 * 3. Stop the pool from accepting work and cancel pending jobs
 * 4. Wait the shutdown grace period for running workers
 * 5. Interrupt survivors, wait the kill grace period, abandon what is left
 * 6. Close registered resources and exit
 *
 * Runs at most once; later triggers return immediately.
 */
public class ShutdownCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ShutdownCoordinator.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FATAL = 1;

    private final JobOrchestrator orchestrator;
    private final Scheduler scheduler;
    private final OrchestratorConfig config;
    private final IntConsumer exitHandler;
    private final IntConsumer haltHandler;
    private final List<NamedResource> resources = new ArrayList<>();
    private final AtomicBoolean started = new AtomicBoolean(false);

    private volatile ShutdownPhase phase = ShutdownPhase.RUNNING;
    private volatile ShutdownPhase escalatedTo = ShutdownPhase.RUNNING;

    private record NamedResource(String name, AutoCloseable resource) {
    }

    /**
     * @param exitHandler receives the exit code at the end of the sequence;
     *                    System::exit in production
     * @param haltHandler receives the exit code when the sequence ran inside the
     *                    JVM shutdown hook; Runtime::halt in production
     */
    public ShutdownCoordinator(JobOrchestrator orchestrator,
            Scheduler scheduler,
            OrchestratorConfig config,
            IntConsumer exitHandler,
            IntConsumer haltHandler) {
        this.orchestrator = orchestrator;
        this.scheduler = scheduler;
        this.config = config;
        this.exitHandler = exitHandler;
        this.haltHandler = haltHandler;
    }

    /**
     * Register something to close in the final step (HTTP server, etc.).
     * Closed in registration order.
     */
    public synchronized ShutdownCoordinator register(String name, AutoCloseable resource) {
        resources.add(new NamedResource(name, resource));
        return this;
    }

    /**
     * JVM shutdown hook. Must not call System.exit, the JVM is already exiting;
     * once drained it halts with a success code so a signal is not reported
     * as a failure.
     */
    public Thread shutdownHook() {
        Thread hook = new Thread(() -> shutdown("termination signal", haltHandler, EXIT_OK), "triage-shutdown");
        hook.setDaemon(false);
        return hook;
    }

    /** Termination requested by the application; exits with success once drained. */
    public ShutdownPhase shutdown(String reason) {
        return shutdown(reason, exitHandler, EXIT_OK);
    }

    /** Fatal error; drains and exits with a failure code. */
    public ShutdownPhase onFatalError(Throwable error) {
        log.error("Fatal error, shutting down", error);
        return shutdown("fatal error: " + error.getMessage(), exitHandler, EXIT_FATAL);
    }

    private ShutdownPhase shutdown(String reason, IntConsumer finisher, int exitCode) {
        if (!started.compareAndSet(false, true)) {
            log.debug("Shutdown already in progress ({})", phase);
            return phase;
        }
        long startMs = System.currentTimeMillis();
        log.info("Shutdown started: {}", reason);

        // 1. refuse new work, stop the reaper
        enter(ShutdownPhase.DRAINING);
        orchestrator.beginShutdown();
        step("stop scheduler", scheduler::stop);

        // 2. make the registry consistent before workers finish unwinding
        step("abort active jobs", () -> {
            int aborted = orchestrator.abortAllActive();
            log.info("Aborted {} active jobs", aborted);
        });

        // 3. no new work, pending futures cancelled
        ExecutionPool pool = orchestrator.pool();
        step("shut down pool", pool::shutdown);

        // 4. cooperative grace period
        boolean drained = await(pool, config.shutdownGrace());

        // 5. escalate
        if (!drained) {
            enter(ShutdownPhase.TERMINATING);
            log.warn("{} workers still running after {}ms, interrupting",
                    pool.activeWorkers(), config.shutdownGrace().toMillis());
            step("interrupt workers", pool::interruptWorkers);
            drained = await(pool, config.killGrace());

            if (!drained) {
                enter(ShutdownPhase.KILLING);
                log.error("{} workers ignored interrupt after {}ms, abandoning them",
                        pool.activeWorkers(), config.killGrace().toMillis());
            }
        }

        // 6. release resources and leave
        closeResources();
        phase = ShutdownPhase.TERMINATED;
        log.info("Shutdown finished in {}ms (workers drained: {})", System.currentTimeMillis() - startMs, drained);

        finisher.accept(exitCode);
        return phase;
    }

    private void enter(ShutdownPhase next) {
        phase = next;
        escalatedTo = next;
    }

    private boolean await(ExecutionPool pool, Duration grace) {
        try {
            return pool.awaitTermination(grace);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for workers");
            return pool.isTerminated();
        }
    }

    private synchronized void closeResources() {
        for (NamedResource r : resources) {
            step("close " + r.name(), () -> {
                try {
                    r.resource().close();
                } catch (Exception e) {
                    throw new IllegalStateException(e.getMessage(), e);
                }
            });
        }
    }

    private void step(String name, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.error("Shutdown step '{}' failed, continuing", name, e);
        }
    }

    public ShutdownPhase phase() {
        return phase;
    }

    /** Furthest escalation step the sequence needed: DRAINING, TERMINATING or KILLING. */
    public ShutdownPhase escalatedTo() {
        return escalatedTo;
    }

    public boolean isStarted() {
        return started.get();
    }
}
