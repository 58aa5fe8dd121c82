package triage.orchestrator.executor;

/**
 * Receives the fraction of items processed after each item.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (jobId, fraction) -> { };

    void onProgress(String jobId, double fraction);
}
