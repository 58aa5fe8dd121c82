package triage.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import triage.orchestrator.model.JobRecord;
import triage.orchestrator.model.JobSnapshot;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for job details.
 * GET /api/v1/jobs/{jobId}
 *
 * duration is in seconds.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
        @JsonProperty("id") String id,
        @JsonProperty("status") String status,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt,
        @JsonProperty("progress") double progress,
        @JsonProperty("total") int total,
        @JsonProperty("categories") List<String> categories,
        @JsonProperty("duration") Double duration,
        @JsonProperty("error") String error) {

    /** Create response from a snapshot */
    public static JobStatusResponse from(JobSnapshot snapshot) {
        JobRecord job = snapshot.job();
        Double seconds = snapshot.duration() != null ? snapshot.duration().toMillis() / 1000.0 : null;
        return new JobStatusResponse(
                job.id(),
                job.status().value(),
                job.createdAt(),
                job.startedAt(),
                job.completedAt(),
                job.progress(),
                job.total(),
                job.categories(),
                seconds,
                job.error());
    }
}
