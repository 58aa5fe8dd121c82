package triage.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("activeJobCount") int activeJobCount,
        @JsonProperty("totalJobCount") int totalJobCount,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version) {

    public static HealthResponse healthy(int active, int total, String uptime, String version) {
        return new HealthResponse("healthy", active, total, uptime, version);
    }

    public static HealthResponse shuttingDown(int active, int total, String uptime, String version) {
        return new HealthResponse("shutting_down", active, total, uptime, version);
    }
}
