package triage.orchestrator.exception;

/**
 * Raised by an inference backend when it cannot classify an item.
 * Recorded on the job as FAILED rather than surfaced to the caller.
 */
public class InferenceException extends Exception {

    public InferenceException(String message) {
        super(message);
    }

    public InferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
