package triage.orchestrator.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import triage.orchestrator.exception.InferenceException;
import triage.orchestrator.model.LabelScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Calls a zero-shot classification endpoint over HTTP.
 *
 * <p>
 * Request: {@code {"inputs": text, "parameters": {"candidate_labels": [...]}}}.
 * Response: {@code {"labels": [...], "scores": [...]}}, or a one-element array
 * holding that object.
 */
public final class RemoteInferenceBackend implements InferenceBackend {

    private static final Logger log = LoggerFactory.getLogger(RemoteInferenceBackend.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final URI endpoint;
    private final Duration timeout;
    private final HttpClient httpClient;

    public RemoteInferenceBackend(String endpoint, Duration timeout) {
        this.endpoint = URI.create(endpoint);
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        log.info("Remote inference backend targeting {}", endpoint);
    }

    @Override
    public List<LabelScore> classify(String text, List<String> labels) throws InferenceException {
        String body;
        try {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("inputs", text);
            payload.put("parameters", Map.of("candidate_labels", labels));
            body = MAPPER.writeValueAsString(payload);
        } catch (IOException e) {
            throw new InferenceException("failed to encode request: " + e.getMessage(), e);
        }

        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new InferenceException("inference request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InferenceException("inference request interrupted", e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new InferenceException("inference endpoint returned HTTP " + response.statusCode()
                    + ": " + abbreviate(response.body()));
        }
        return parse(response.body());
    }

    static List<LabelScore> parse(String json) throws InferenceException {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (IOException e) {
            throw new InferenceException("malformed inference response: " + e.getMessage(), e);
        }
        if (root != null && root.isArray() && root.size() == 1) {
            root = root.get(0);
        }
        if (root == null || !root.path("labels").isArray() || !root.path("scores").isArray()) {
            throw new InferenceException("inference response lacks labels/scores: " + abbreviate(json));
        }

        JsonNode labels = root.get("labels");
        JsonNode scores = root.get("scores");
        if (labels.size() != scores.size() || labels.isEmpty()) {
            throw new InferenceException("inference response has " + labels.size()
                    + " labels and " + scores.size() + " scores");
        }

        List<LabelScore> out = new ArrayList<>(labels.size());
        for (int i = 0; i < labels.size(); i++) {
            out.add(new LabelScore(labels.get(i).asText(), scores.get(i).asDouble()));
        }
        return LabelScore.ranked(out);
    }

    private static String abbreviate(String s) {
        if (s == null) {
            return "";
        }
        return s.length() > 200 ? s.substring(0, 200) + "..." : s;
    }

    @Override
    public String name() {
        return "remote(" + endpoint + ")";
    }
}
