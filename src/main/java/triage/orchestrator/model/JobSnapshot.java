package triage.orchestrator.model;

import java.time.Duration;

/**
 * A job record as read at one instant, with its derived duration
 * (null if the job never started).
 */
public record JobSnapshot(JobRecord job, Duration duration) {
}
