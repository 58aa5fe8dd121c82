package triage.orchestrator.exception;

import triage.orchestrator.model.JobState;

/**
 * Operation is not valid for the job's current state, e.g. fetching results
 * before completion or cancelling a finished job.
 */
public class InvalidJobStateException extends IllegalStateException {

    private final String jobId;
    private final JobState state;

    public InvalidJobStateException(String jobId, JobState state, String message) {
        super(message);
        this.jobId = jobId;
        this.state = state;
    }

    public String jobId() {
        return jobId;
    }

    public JobState state() {
        return state;
    }
}
