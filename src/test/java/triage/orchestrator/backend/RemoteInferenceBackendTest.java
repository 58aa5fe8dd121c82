package triage.orchestrator.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import triage.orchestrator.exception.InferenceException;
import triage.orchestrator.model.LabelScore;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class RemoteInferenceBackendTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer server;
    private final AtomicReference<String> lastRequest = new AtomicReference<>();
    private final AtomicReference<String> responseBody = new AtomicReference<>();
    private final AtomicInteger responseStatus = new AtomicInteger(200);

    @BeforeEach
    void startFakeEndpoint() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/classify", exchange -> {
            lastRequest.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] out = responseBody.get().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(responseStatus.get(), out.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(out);
            }
        });
        server.start();
    }

    @AfterEach
    void stopFakeEndpoint() {
        server.stop(0);
    }

    private RemoteInferenceBackend backend() {
        return new RemoteInferenceBackend(
                "http://127.0.0.1:" + server.getAddress().getPort() + "/classify", Duration.ofSeconds(5));
    }

    @Test
    void sendsZeroShotPayloadAndRanksAnswer() throws Exception {
        responseBody.set("{\"sequence\":\"x\",\"labels\":[\"other\",\"billing\"],\"scores\":[0.3,0.7]}");

        List<LabelScore> scores = backend().classify("card charged twice", List.of("billing", "other"));

        assertEquals("billing", scores.get(0).label());
        assertEquals(0.7, scores.get(0).score());

        JsonNode sent = MAPPER.readTree(lastRequest.get());
        assertEquals("card charged twice", sent.get("inputs").asText());
        assertEquals("billing", sent.get("parameters").get("candidate_labels").get(0).asText());
    }

    @Test
    void acceptsSingleElementArray() throws Exception {
        responseBody.set("[{\"labels\":[\"a\"],\"scores\":[1.0]}]");
        assertEquals("a", backend().classify("x", List.of("a")).get(0).label());
    }

    @Test
    void nonSuccessStatusRaises() {
        responseStatus.set(503);
        responseBody.set("{\"error\":\"model loading\"}");

        InferenceException e = assertThrows(InferenceException.class, () -> backend().classify("x", List.of("a")));
        assertTrue(e.getMessage().contains("503"));
        assertTrue(e.getMessage().contains("model loading"));
    }

    @Test
    void unreachableEndpointRaises() {
        RemoteInferenceBackend dead = new RemoteInferenceBackend("http://127.0.0.1:1/classify",
                Duration.ofSeconds(1));
        assertThrows(InferenceException.class, () -> dead.classify("x", List.of("a")));
    }

    @Test
    void parseRejectsMalformedAnswers() {
        assertThrows(InferenceException.class, () -> RemoteInferenceBackend.parse("not json"));
        assertThrows(InferenceException.class, () -> RemoteInferenceBackend.parse("{\"labels\":[\"a\"]}"));
        assertThrows(InferenceException.class,
                () -> RemoteInferenceBackend.parse("{\"labels\":[\"a\",\"b\"],\"scores\":[0.5]}"));
        assertThrows(InferenceException.class,
                () -> RemoteInferenceBackend.parse("{\"labels\":[],\"scores\":[]}"));
    }
}
