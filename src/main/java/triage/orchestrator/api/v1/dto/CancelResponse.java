package triage.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import triage.orchestrator.model.JobRecord;

/**
 * Body returned after a successful cancel.
 */
public record CancelResponse(
        @JsonProperty("id") String id,
        @JsonProperty("status") String status,
        @JsonProperty("message") String message) {

    public static CancelResponse from(JobRecord job) {
        return new CancelResponse(job.id(), job.status().value(),
                "Cancellation requested; the worker stops before its next item");
    }
}
