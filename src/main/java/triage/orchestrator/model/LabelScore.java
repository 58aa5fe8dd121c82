package triage.orchestrator.model;

import java.util.Comparator;
import java.util.List;

/**
 * One label with its confidence score as returned by an inference backend.
 */
public record LabelScore(String label, double score) {

    public static final Comparator<LabelScore> BY_SCORE_DESC =
            Comparator.comparingDouble(LabelScore::score).reversed();

    /** Sorted copy, highest score first. */
    public static List<LabelScore> ranked(List<LabelScore> scores) {
        return scores.stream().sorted(BY_SCORE_DESC).toList();
    }
}
