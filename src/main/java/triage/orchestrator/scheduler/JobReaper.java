package triage.orchestrator.scheduler;

import triage.orchestrator.config.OrchestratorConfig;
import triage.orchestrator.model.JobRecord;
import triage.orchestrator.service.JobOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * Background task that evicts finished jobs once their retention window expires.
 *
 * Each cycle:
 * 1. Finds terminal records whose completedAt is older than the result TTL
 * 2. Deletes the record and its cancellation token
 *
 * Active jobs are never touched, whatever their age.
 */
public class JobReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(JobReaper.class);

    private final JobOrchestrator orchestrator;
    private final OrchestratorConfig config;

    public JobReaper(JobOrchestrator orchestrator, OrchestratorConfig config) {
        this.orchestrator = orchestrator;
        this.config = config;
    }

    @Override
    public void run() {
        if (orchestrator.isShuttingDown()) {
            return;
        }
        try {
            reapExpiredJobs();
        } catch (Exception e) {
            log.error("Job reaper error", e);
        }
    }

    /**
     * Delete expired terminal jobs.
     *
     * @return number of jobs removed
     */
    public int reapExpiredJobs() {
        Instant cutoff = orchestrator.clock().instant().minus(config.resultTtl());

        List<JobRecord> expired = orchestrator.registry().findTerminalCompletedBefore(cutoff);

        if (expired.isEmpty()) {
            log.debug("No expired jobs found");
            return 0;
        }

        int removed = 0;
        for (JobRecord job : expired) {
            try {
                if (orchestrator.registry().delete(job.id())) {
                    removed++;
                }
                orchestrator.cancellations().remove(job.id());
                log.debug("Reaped job {} ({}, completed at {})", job.id(), job.status(), job.completedAt());
            } catch (Exception e) {
                log.error("Failed to reap job {}", job.id(), e);
            }
        }

        log.info("Job reaper: {} expired jobs removed, {} remaining", removed, orchestrator.totalJobCount());
        return removed;
    }
}
