package triage.orchestrator.model;

/**
 * Result of applying a finished job body's outcome to the registry.
 */
public enum CompletionApplyResult {
    /** Outcome written, record moved to its terminal state */
    APPLIED,

    /**
     * Record was already ABORTED (cancel or shutdown won the race); only the
     * body's log was attached
     */
    LOG_ATTACHED,

    /** Record was already terminal and nothing changed - idempotent no-op */
    ALREADY_TERMINAL,

    /** Record no longer exists (reaped mid-flight) */
    NOT_FOUND
}
