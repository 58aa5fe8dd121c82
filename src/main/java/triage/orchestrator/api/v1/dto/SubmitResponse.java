package triage.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import triage.orchestrator.model.JobRecord;

/**
 * 202 body for an accepted batch.
 */
public record SubmitResponse(
        @JsonProperty("id") String id,
        @JsonProperty("status") String status,
        @JsonProperty("total") int total) {

    public static SubmitResponse from(JobRecord job) {
        return new SubmitResponse(job.id(), job.status().value(), job.total());
    }
}
