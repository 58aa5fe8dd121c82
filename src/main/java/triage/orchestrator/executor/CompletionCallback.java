package triage.orchestrator.executor;

import triage.orchestrator.model.JobOutcome;

/**
 * Invoked exactly once per dispatched job, when its future is done.
 */
@FunctionalInterface
public interface CompletionCallback {

    /**
     * @param jobId   the job
     * @param outcome what the body returned, or null if it did not return
     * @param failure why the body did not return (thrown exception, or a
     *                CancellationException if the pool cancelled it before it
     *                ran); null when outcome is set
     */
    void onCompletion(String jobId, JobOutcome outcome, Throwable failure);
}
