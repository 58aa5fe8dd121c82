package triage.orchestrator.core;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-job cancellation tokens, keyed by job id.
 */
public final class CancellationDirectory {

    private final ConcurrentHashMap<String, CancellationToken> tokens = new ConcurrentHashMap<>();

    /** Create (or return the existing) token for a job. */
    public CancellationToken create(String jobId) {
        return tokens.computeIfAbsent(jobId, k -> new CancellationToken());
    }

    public Optional<CancellationToken> get(String jobId) {
        return Optional.ofNullable(tokens.get(jobId));
    }

    /**
     * Set the job's token if one is registered.
     *
     * @return true if a token existed
     */
    public boolean signal(String jobId) {
        CancellationToken token = tokens.get(jobId);
        if (token == null) {
            return false;
        }
        token.requestCancel();
        return true;
    }

    public void remove(String jobId) {
        tokens.remove(jobId);
    }

    public int size() {
        return tokens.size();
    }
}
