package triage.orchestrator.exception;

/**
 * The execution pool has no room for another job.
 */
public class PoolExhaustedException extends RuntimeException {

    public PoolExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
