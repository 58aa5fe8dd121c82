package triage.orchestrator.shutdown;

/**
 * Progress of the shutdown sequence. Phases only move forward.
 */
public enum ShutdownPhase {
    /** Normal operation */
    RUNNING,
    /** Submissions refused, active jobs aborted, waiting for workers to finish cooperatively */
    DRAINING,
    /** Grace period expired; workers interrupted */
    TERMINATING,
    /**
     * Workers survived the interrupt. JVM threads cannot be killed, so they are
     * abandoned; as daemon threads they cannot keep the process alive
     */
    KILLING,
    /** Sequence finished */
    TERMINATED
}
