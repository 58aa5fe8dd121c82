package triage.orchestrator.backend;

import triage.orchestrator.exception.InferenceException;
import triage.orchestrator.model.LabelScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Builds the real backend on first use and caches it for the life of the process.
 * Construction happens at most once even under concurrent first calls; a failed
 * construction is reported to the caller and attempted again on the next call.
 */
public final class LazyInferenceBackend implements InferenceBackend {

    private static final Logger log = LoggerFactory.getLogger(LazyInferenceBackend.class);

    private final Callable<? extends InferenceBackend> factory;
    private final Object lock = new Object();
    private volatile InferenceBackend delegate;

    public LazyInferenceBackend(Callable<? extends InferenceBackend> factory) {
        this.factory = factory;
    }

    @Override
    public List<LabelScore> classify(String text, List<String> labels) throws InferenceException {
        return delegate().classify(text, labels);
    }

    @Override
    public String name() {
        InferenceBackend d = delegate;
        return d != null ? d.name() : "lazy(uninitialized)";
    }

    public boolean isInitialized() {
        return delegate != null;
    }

    InferenceBackend delegate() throws InferenceException {
        InferenceBackend d = delegate;
        if (d != null) {
            return d;
        }
        synchronized (lock) {
            if (delegate == null) {
                long start = System.currentTimeMillis();
                try {
                    InferenceBackend created = factory.call();
                    if (created == null) {
                        throw new InferenceException("backend factory returned null");
                    }
                    delegate = created;
                } catch (InferenceException e) {
                    throw e;
                } catch (Exception e) {
                    throw new InferenceException("backend initialization failed: " + e.getMessage(), e);
                }
                log.info("Inference backend {} initialized in {}ms",
                        delegate.name(), System.currentTimeMillis() - start);
            }
            return delegate;
        }
    }
}
