package triage.orchestrator.integration;

import org.junit.jupiter.api.*;
import triage.orchestrator.config.Dependencies;
import triage.orchestrator.config.OrchestratorConfig;
import triage.orchestrator.model.ClassificationResult;
import triage.orchestrator.model.JobRecord;
import triage.orchestrator.model.JobState;
import triage.orchestrator.shutdown.ShutdownCoordinator;
import triage.orchestrator.shutdown.ShutdownPhase;
import triage.orchestrator.support.MutableClock;
import triage.orchestrator.support.TestBackends;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static triage.orchestrator.support.TestBackends.awaitCondition;

/**
 * Integration test for the full job lifecycle through the wired container:
 * 1. Submit batches and let them complete or fail
 * 2. Cancel a running batch
 * 3. Reap expired jobs once their retention window passes
 * 4. Shut down with jobs in flight
 */
class FullFlowIntegrationTest {

        private final MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        private final List<Integer> exitCodes = new CopyOnWriteArrayList<>();
        private Dependencies deps;

        @BeforeEach
        void setUp() {
                OrchestratorConfig config = OrchestratorConfig.defaults()
                                .withServerPort(0)
                                .withMaxWorkers(2)
                                .withResultTtl(Duration.ofMinutes(10))
                                .withShutdownGrace(Duration.ofSeconds(2))
                                .withKillGrace(Duration.ofSeconds(1));
                deps = Dependencies.create(config, TestBackends.containsLabel(), clock, exitCodes::add);
        }

        @AfterEach
        void tearDown() {
                if (deps != null) {
                        deps.close();
                }
        }

        private JobRecord awaitTerminal(String jobId) throws InterruptedException {
                assertTrue(awaitCondition(
                                () -> deps.orchestrator().find(jobId).map(JobRecord::isTerminal).orElse(false),
                                Duration.ofSeconds(10)));
                return deps.orchestrator().find(jobId).orElseThrow();
        }

        @Test
        @DisplayName("Full workflow: submit, complete, expire, reap")
        void testFullJobWorkflow() throws Exception {
                List<String> categories = List.of("billing", "hardware", "other");

                JobRecord submitted = deps.orchestrator().submit(
                                List.of("hardware issue", "billing issue", "other issue"), categories);
                assertEquals(JobState.PROCESSING, submitted.status());

                JobRecord done = awaitTerminal(submitted.id());
                assertEquals(JobState.COMPLETED, done.status());
                assertEquals(List.of("hardware", "billing", "other"),
                                done.results().stream().map(ClassificationResult::predicted).toList());

                // Still retained inside the window
                clock.advance(Duration.ofMinutes(5));
                assertEquals(0, deps.jobReaper().reapExpiredJobs());
                assertTrue(deps.orchestrator().find(submitted.id()).isPresent());

                // Gone after it
                clock.advance(Duration.ofMinutes(6));
                assertEquals(1, deps.jobReaper().reapExpiredJobs());
                assertTrue(deps.orchestrator().find(submitted.id()).isEmpty());
                assertEquals(0, deps.orchestrator().totalJobCount());
        }

        @Test
        @DisplayName("Shutdown aborts in-flight jobs, stops the server and exits cleanly")
        void shutdownWithJobsInFlight() throws Exception {
                deps.httpServer().start();
                assertTrue(deps.httpServer().isRunning());
                deps.startScheduler();

                JobRecord job = deps.orchestrator().submit(List.of("a", "b", "c", "d", "e"), List.of("billing", "other"));

                ShutdownPhase phase = deps.shutdownCoordinator().shutdown("test");

                assertEquals(ShutdownPhase.TERMINATED, phase);
                assertEquals(List.of(ShutdownCoordinator.EXIT_OK), exitCodes);
                assertFalse(deps.httpServer().isRunning());
                assertFalse(deps.scheduler().isRunning());
                assertTrue(deps.orchestrator().isShuttingDown());
                assertTrue(deps.orchestrator().find(job.id()).orElseThrow().isTerminal());
                assertEquals(0, deps.orchestrator().activeJobCount());
        }
}
