package triage.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of classifying one item: the top label and every label's score,
 * highest first.
 */
public record ClassificationResult(
        @JsonProperty("item") String item,
        @JsonProperty("predicted") String predicted,
        @JsonProperty("scores") Map<String, Double> scores) {

    public ClassificationResult {
        Objects.requireNonNull(item, "item is required");
        Objects.requireNonNull(predicted, "predicted is required");
        scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
    }

    /**
     * Build a result from a ranked backend answer. The first entry is the prediction.
     */
    public static ClassificationResult fromRanked(String item, List<LabelScore> ranked) {
        if (ranked == null || ranked.isEmpty()) {
            throw new IllegalArgumentException("backend returned no labels for item: " + item);
        }
        Map<String, Double> scores = new LinkedHashMap<>();
        for (LabelScore ls : ranked) {
            scores.put(ls.label(), ls.score());
        }
        return new ClassificationResult(item, ranked.get(0).label(), scores);
    }
}
