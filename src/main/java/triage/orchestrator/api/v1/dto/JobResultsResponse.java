package triage.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import triage.orchestrator.model.ClassificationResult;
import triage.orchestrator.model.JobRecord;

import java.util.List;

/**
 * GET /api/v1/jobs/{jobId}/results, COMPLETED jobs only.
 */
public record JobResultsResponse(
        @JsonProperty("id") String id,
        @JsonProperty("results") List<ClassificationResult> results,
        @JsonProperty("total") int total,
        @JsonProperty("categories") List<String> categories) {

    public static JobResultsResponse from(JobRecord job) {
        return new JobResultsResponse(job.id(), job.results(), job.total(), job.categories());
    }
}
