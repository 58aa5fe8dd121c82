package triage.orchestrator.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared cooperative-cancellation flag for one job.
 * The orchestrator sets it; the running job body polls it between items.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * Request cancellation.
     *
     * @return true if this call flipped the flag, false if it was already set
     */
    public boolean requestCancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public String toString() {
        return "CancellationToken{cancelled=" + cancelled.get() + "}";
    }
}
