package triage.orchestrator.exception;

public class ServiceShuttingDownException extends RuntimeException {

    public ServiceShuttingDownException() {
        super("Service is shutting down");
    }
}
