package triage.orchestrator.model;

import java.util.List;
import java.util.Objects;

/**
 * What a job body hands back to the pool when it finishes.
 * The body never writes the registry itself; the orchestrator applies this value.
 */
public record JobOutcome(
        JobState status,
        List<ClassificationResult> results,
        String error,
        String log,
        int processed) {

    public JobOutcome {
        Objects.requireNonNull(status, "status is required");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("outcome must be terminal: " + status);
        }
        results = results == null ? null : List.copyOf(results);
    }

    public static JobOutcome completed(List<ClassificationResult> results, String log) {
        return new JobOutcome(JobState.COMPLETED, results, null, log, results.size());
    }

    public static JobOutcome failed(String error, String log, int processed) {
        return new JobOutcome(JobState.FAILED, null, error, log, processed);
    }

    public static JobOutcome aborted(String log, int processed) {
        return new JobOutcome(JobState.ABORTED, null, null, log, processed);
    }
}
