package triage.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record JobLogResponse(
        @JsonProperty("id") String id,
        @JsonProperty("log") String log) {
}
