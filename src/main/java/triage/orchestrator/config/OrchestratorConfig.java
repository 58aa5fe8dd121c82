package triage.orchestrator.config;

import java.time.Duration;
import java.util.Map;

/**
 * Configuration holder for orchestrator settings.
 * All settings have sensible defaults; {@link #fromEnv()} overrides them from
 * TRIAGE_* environment variables.
 */
public final class OrchestratorConfig {

    // Server settings
    private int serverPort = 8000;

    // Pool settings
    private int maxWorkers = 1;
    private int queueCapacity = 100;
    private int maxBatchSize = 100;

    // Retention settings
    private Duration cleanupInterval = Duration.ofSeconds(300);
    private Duration resultTtl = Duration.ofSeconds(3600);

    // Shutdown escalation
    private Duration shutdownGrace = Duration.ofSeconds(5);
    private Duration killGrace = Duration.ofSeconds(2);

    // Backend (optional)
    private String backendUrl = null; // If set, classify through the remote endpoint
    private Duration backendTimeout = Duration.ofSeconds(30);

    private OrchestratorConfig() {
    }

    public static OrchestratorConfig defaults() {
        return new OrchestratorConfig();
    }

    public static OrchestratorConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    static OrchestratorConfig fromEnv(Map<String, String> env) {
        OrchestratorConfig config = new OrchestratorConfig();

        Integer port = intVar(env, "TRIAGE_PORT");
        if (port != null) {
            config.serverPort = port;
        }

        Integer workers = intVar(env, "TRIAGE_MAX_WORKERS");
        if (workers != null) {
            config.maxWorkers = positive("TRIAGE_MAX_WORKERS", workers);
        }

        Integer queue = intVar(env, "TRIAGE_QUEUE_CAPACITY");
        if (queue != null) {
            config.queueCapacity = positive("TRIAGE_QUEUE_CAPACITY", queue);
        }

        Integer batch = intVar(env, "TRIAGE_MAX_BATCH_SIZE");
        if (batch != null) {
            config.maxBatchSize = positive("TRIAGE_MAX_BATCH_SIZE", batch);
        }

        Integer interval = intVar(env, "TRIAGE_CLEANUP_INTERVAL");
        if (interval != null) {
            config.cleanupInterval = Duration.ofSeconds(positive("TRIAGE_CLEANUP_INTERVAL", interval));
        }

        Integer ttl = intVar(env, "TRIAGE_RESULT_TTL");
        if (ttl != null) {
            config.resultTtl = Duration.ofSeconds(positive("TRIAGE_RESULT_TTL", ttl));
        }

        Integer grace = intVar(env, "TRIAGE_SHUTDOWN_GRACE_MS");
        if (grace != null) {
            config.shutdownGrace = Duration.ofMillis(grace);
        }

        Integer killGrace = intVar(env, "TRIAGE_KILL_GRACE_MS");
        if (killGrace != null) {
            config.killGrace = Duration.ofMillis(killGrace);
        }

        String backendUrl = env.get("TRIAGE_BACKEND_URL");
        if (backendUrl != null && !backendUrl.isBlank()) {
            config.backendUrl = backendUrl;
        }

        Integer backendTimeout = intVar(env, "TRIAGE_BACKEND_TIMEOUT_MS");
        if (backendTimeout != null) {
            config.backendTimeout = Duration.ofMillis(positive("TRIAGE_BACKEND_TIMEOUT_MS", backendTimeout));
        }

        return config;
    }

    private static Integer intVar(Map<String, String> env, String name) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got '" + raw + "'", e);
        }
    }

    private static int positive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
        return value;
    }

    // Getters
    public int serverPort() {
        return serverPort;
    }

    public int maxWorkers() {
        return maxWorkers;
    }

    public int queueCapacity() {
        return queueCapacity;
    }

    public int maxBatchSize() {
        return maxBatchSize;
    }

    public Duration cleanupInterval() {
        return cleanupInterval;
    }

    public Duration resultTtl() {
        return resultTtl;
    }

    public Duration shutdownGrace() {
        return shutdownGrace;
    }

    public Duration killGrace() {
        return killGrace;
    }

    public String backendUrl() {
        return backendUrl;
    }

    public boolean hasBackendUrl() {
        return backendUrl != null && !backendUrl.isBlank();
    }

    public Duration backendTimeout() {
        return backendTimeout;
    }

    // Fluent setters for testing/customization
    public OrchestratorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public OrchestratorConfig withMaxWorkers(int workers) {
        this.maxWorkers = workers;
        return this;
    }

    public OrchestratorConfig withQueueCapacity(int capacity) {
        this.queueCapacity = capacity;
        return this;
    }

    public OrchestratorConfig withMaxBatchSize(int size) {
        this.maxBatchSize = size;
        return this;
    }

    public OrchestratorConfig withCleanupInterval(Duration interval) {
        this.cleanupInterval = interval;
        return this;
    }

    public OrchestratorConfig withResultTtl(Duration ttl) {
        this.resultTtl = ttl;
        return this;
    }

    public OrchestratorConfig withShutdownGrace(Duration grace) {
        this.shutdownGrace = grace;
        return this;
    }

    public OrchestratorConfig withKillGrace(Duration grace) {
        this.killGrace = grace;
        return this;
    }

    public OrchestratorConfig withBackendUrl(String url) {
        this.backendUrl = url;
        return this;
    }

    public OrchestratorConfig withBackendTimeout(Duration timeout) {
        this.backendTimeout = timeout;
        return this;
    }

    @Override
    public String toString() {
        return "OrchestratorConfig{" +
                "serverPort=" + serverPort +
                ", maxWorkers=" + maxWorkers +
                ", queueCapacity=" + queueCapacity +
                ", maxBatchSize=" + maxBatchSize +
                ", cleanupInterval=" + cleanupInterval +
                ", resultTtl=" + resultTtl +
                ", backendUrlSet=" + hasBackendUrl() +
                '}';
    }
}
