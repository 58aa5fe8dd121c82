package triage.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request DTO for submitting a batch.
 * POST /api/v1/classify/batch
 *
 * {@code titles} is accepted as an alias of {@code items}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClassifyBatchRequest(
        @JsonProperty("items") @JsonAlias("titles") List<String> items,
        @JsonProperty("categories") List<String> categories) {

    /** Items or an empty list, never null. */
    public List<String> itemsOrEmpty() {
        return items != null ? items : List.of();
    }

    /** Categories or an empty list, never null. */
    public List<String> categoriesOrEmpty() {
        return categories != null ? categories : List.of();
    }
}
