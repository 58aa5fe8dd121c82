package triage.orchestrator.backend;

import triage.orchestrator.exception.InferenceException;
import triage.orchestrator.model.LabelScore;

import java.util.List;

/**
 * Classifies one piece of text against a label set.
 * Implementations may be slow and may fail; they are called from pool workers,
 * never while the registry is being mutated.
 */
public interface InferenceBackend {

    /**
     * @param text   item to classify
     * @param labels candidate labels
     * @return every label with its score, highest first
     * @throws InferenceException if the item could not be classified
     */
    List<LabelScore> classify(String text, List<String> labels) throws InferenceException;

    /** Short name for logs. */
    default String name() {
        return getClass().getSimpleName();
    }
}
