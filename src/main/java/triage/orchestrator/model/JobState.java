package triage.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle state of a classification job.
 */
public enum JobState {
    /** Record created, not yet handed to the pool */
    QUEUED("queued"),
    /** Dispatched to the pool, body running or about to run */
    PROCESSING("processing"),
    /** Every item classified, results available */
    COMPLETED("completed"),
    /** Backend raised on some item */
    FAILED("failed"),
    /** Cancelled by a client or forced by shutdown */
    ABORTED("aborted");

    private final String value;

    JobState(String value) {
        this.value = value;
    }

    /** Wire name, lowercase. */
    @JsonValue
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == ABORTED;
    }

    public boolean isActive() {
        return this == QUEUED || this == PROCESSING;
    }
}
