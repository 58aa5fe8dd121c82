package triage;

import triage.orchestrator.config.Dependencies;
import triage.orchestrator.config.OrchestratorConfig;
import triage.orchestrator.shutdown.ShutdownCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process entry point.
 *
 * Starts the HTTP server and the reaper, then blocks until the JVM is asked to
 * stop. SIGTERM and SIGINT reach the shutdown coordinator through the shutdown
 * hook; a startup failure drains and exits with a non-zero code.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        OrchestratorConfig config;
        try {
            config = OrchestratorConfig.fromEnv();
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(ShutdownCoordinator.EXIT_FATAL);
            return;
        }

        Dependencies deps = Dependencies.create(config);
        ShutdownCoordinator coordinator = deps.shutdownCoordinator();
        Runtime.getRuntime().addShutdownHook(coordinator.shutdownHook());

        try {
            log.info("Starting classification service on port {}...", config.serverPort());
            deps.httpServer().start();
            deps.startScheduler();
            log.info("Classification service started");
        } catch (RuntimeException e) {
            coordinator.onFatalError(e);
        }
    }
}
