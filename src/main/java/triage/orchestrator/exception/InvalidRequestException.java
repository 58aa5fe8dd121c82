package triage.orchestrator.exception;

/**
 * Submission rejected before any job was created (empty or oversized batch).
 */
public class InvalidRequestException extends IllegalArgumentException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
