package triage.orchestrator.scheduler;

import triage.orchestrator.config.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the job reaper on a fixed interval.
 *
 * Uses a single daemon thread; stopping interrupts the wait between cycles, so
 * the reaper never delays process exit.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final JobReaper jobReaper;
    private final OrchestratorConfig config;

    private volatile boolean running = false;

    public Scheduler(JobReaper jobReaper, OrchestratorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "triage-reaper");
            t.setDaemon(true);
            return t;
        });
        this.jobReaper = jobReaper;
        this.config = config;
    }

    /**
     * Start the scheduler.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long intervalMs = config.cleanupInterval().toMillis();
        executor.scheduleAtFixedRate(
                jobReaper,
                intervalMs, // initial delay
                intervalMs, // interval
                TimeUnit.MILLISECONDS);
        log.info("Job reaper scheduled every {}ms (ttl {}s)", intervalMs, config.resultTtl().toSeconds());
    }

    /**
     * Stop the scheduler gracefully.
     */
    public synchronized void stop() {
        if (!running) {
            executor.shutdownNow();
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Get the job reaper for direct access (e.g., manual trigger).
     */
    public JobReaper jobReaper() {
        return jobReaper;
    }
}
