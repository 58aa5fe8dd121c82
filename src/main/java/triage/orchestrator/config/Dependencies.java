package triage.orchestrator.config;

import triage.orchestrator.api.v1.HealthController;
import triage.orchestrator.api.v1.JobController;
import triage.orchestrator.backend.InferenceBackend;
import triage.orchestrator.backend.KeywordOverlapBackend;
import triage.orchestrator.backend.LazyInferenceBackend;
import triage.orchestrator.backend.RemoteInferenceBackend;
import triage.orchestrator.core.CancellationDirectory;
import triage.orchestrator.repository.JobRegistry;
import triage.orchestrator.scheduler.JobReaper;
import triage.orchestrator.scheduler.Scheduler;
import triage.orchestrator.server.ClassifierHttpServer;
import triage.orchestrator.server.RouterHandler;
import triage.orchestrator.service.JobOrchestrator;
import triage.orchestrator.shutdown.ShutdownCoordinator;
import triage.orchestrator.store.InMemoryJobRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.function.IntConsumer;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(OrchestratorConfig.fromEnv());
 * deps.httpServer().start();
 * deps.startScheduler(); // start background reaping
 * Runtime.getRuntime().addShutdownHook(deps.shutdownCoordinator().shutdownHook());
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final OrchestratorConfig config;
    private final Clock clock;
    private final JobRegistry jobRegistry;
    private final CancellationDirectory cancellations;
    private final InferenceBackend backend;
    private final JobOrchestrator orchestrator;
    private final JobReaper jobReaper;
    private final Scheduler scheduler;
    private final ShutdownCoordinator shutdownCoordinator;

    // Controllers
    private final HealthController healthController;
    private final JobController jobController;

    // Router and server (lazy-initialized)
    private RouterHandler routerHandler;
    private ClassifierHttpServer httpServer;

    private Dependencies(OrchestratorConfig config, InferenceBackend backend, Clock clock, IntConsumer exitHandler,
            IntConsumer haltHandler) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Registry and cancellation
        this.jobRegistry = new InMemoryJobRegistry();
        this.cancellations = new CancellationDirectory();

        // Services
        this.backend = backend;
        this.orchestrator = new JobOrchestrator(jobRegistry, cancellations, backend, config, clock);
        this.jobReaper = new JobReaper(orchestrator, config);
        this.scheduler = new Scheduler(jobReaper, config);
        this.shutdownCoordinator = new ShutdownCoordinator(orchestrator, scheduler, config, exitHandler, haltHandler);

        // Controllers (public API)
        this.healthController = new HealthController(orchestrator);
        this.jobController = new JobController(orchestrator);

        log.info("Dependencies initialized successfully (backend: {})", backend.name());
    }

    /**
     * Create dependencies with the given config. The process exits through System.exit,
     * or Runtime.halt when shutdown runs inside the JVM shutdown hook.
     */
    public static Dependencies create(OrchestratorConfig config) {
        return new Dependencies(config, defaultBackend(config), Clock.systemUTC(), System::exit,
                code -> Runtime.getRuntime().halt(code));
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(OrchestratorConfig.fromEnv());
    }

    /**
     * Create dependencies with an explicit backend, clock and exit handler.
     * The handler also receives the code the shutdown hook would halt with.
     */
    public static Dependencies create(OrchestratorConfig config, InferenceBackend backend, Clock clock,
            IntConsumer exitHandler) {
        return new Dependencies(config, backend, clock, exitHandler, exitHandler);
    }

    /**
     * Remote backend when TRIAGE_BACKEND_URL is set, local keyword scorer otherwise.
     * Both are built on first use so startup stays cheap.
     */
    static InferenceBackend defaultBackend(OrchestratorConfig config) {
        if (config.hasBackendUrl()) {
            return new LazyInferenceBackend(
                    () -> new RemoteInferenceBackend(config.backendUrl(), config.backendTimeout()));
        }
        return new LazyInferenceBackend(KeywordOverlapBackend::new);
    }

    // Getters
    public OrchestratorConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public JobRegistry jobRegistry() {
        return jobRegistry;
    }

    public CancellationDirectory cancellations() {
        return cancellations;
    }

    public InferenceBackend backend() {
        return backend;
    }

    public JobOrchestrator orchestrator() {
        return orchestrator;
    }

    public JobReaper jobReaper() {
        return jobReaper;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    public ShutdownCoordinator shutdownCoordinator() {
        return shutdownCoordinator;
    }

    // Controller getters
    public HealthController healthController() {
        return healthController;
    }

    public JobController jobController() {
        return jobController;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(jobController);
            log.info("RouterHandler created with {} controllers", 2);
        }
        return routerHandler;
    }

    /**
     * Get the HTTP server (creates it if not yet created). The server is
     * closed as the last step of shutdown.
     */
    public synchronized ClassifierHttpServer httpServer() {
        if (httpServer == null) {
            httpServer = new ClassifierHttpServer(config.serverPort(), routerHandler());
            shutdownCoordinator.register("http server", httpServer);
        }
        return httpServer;
    }

    /**
     * Start the background reaper. Should be called after server startup.
     */
    public void startScheduler() {
        scheduler.start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        try {
            scheduler.stop();
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        try {
            orchestrator.close();
        } catch (Exception e) {
            log.warn("Error closing orchestrator: {}", e.getMessage());
        }

        ClassifierHttpServer server;
        synchronized (this) {
            server = httpServer;
        }
        if (server != null) {
            try {
                server.stop();
            } catch (Exception e) {
                log.warn("Error stopping HTTP server: {}", e.getMessage());
            }
        }

        log.info("Dependencies closed");
    }
}
