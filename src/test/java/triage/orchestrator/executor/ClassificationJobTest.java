package triage.orchestrator.executor;

import org.junit.jupiter.api.Test;
import triage.orchestrator.core.CancellationToken;
import triage.orchestrator.model.JobOutcome;
import triage.orchestrator.model.JobState;
import triage.orchestrator.support.MutableClock;
import triage.orchestrator.support.TestBackends;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClassificationJobTest {

    private final MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
    private final List<String> categories = List.of("billing", "hardware", "other");

    @Test
    void classifiesEveryItemInOrder() {
        List<Double> progress = new ArrayList<>();
        ClassificationJob job = new ClassificationJob("job-1",
                List.of("hardware fault", "billing question", "something"),
                categories, TestBackends.containsLabel(), new CancellationToken(),
                (id, f) -> progress.add(f), clock);

        JobOutcome outcome = job.call();

        assertEquals(JobState.COMPLETED, outcome.status());
        assertEquals(3, outcome.processed());
        assertEquals(List.of("hardware", "billing", "billing"),
                outcome.results().stream().map(r -> r.predicted()).toList());
        assertEquals(List.of("hardware fault", "billing question", "something"),
                outcome.results().stream().map(r -> r.item()).toList());
        assertEquals(List.of(1.0 / 3, 2.0 / 3, 1.0), progress);
        assertTrue(outcome.log().contains("Starting classification job job-1 with 3 items"));
        assertTrue(outcome.log().contains("Job job-1 completed successfully"));
    }

    @Test
    void backendFailureStopsJobAndKeepsPartialLog() {
        ClassificationJob job = new ClassificationJob("job-2",
                List.of("first", "second", "third"),
                categories, TestBackends.failingOn("second", "model exploded"), new CancellationToken(),
                ProgressListener.NONE, clock);

        JobOutcome outcome = job.call();

        assertEquals(JobState.FAILED, outcome.status());
        assertEquals("model exploded", outcome.error());
        assertEquals(1, outcome.processed());
        assertNull(outcome.results());
        assertTrue(outcome.log().contains("Item 1/3 classified as 'billing': first"));
        assertTrue(outcome.log().contains("failed on item 2/3"));
        assertTrue(outcome.log().contains("InferenceException"), "stack trace should be captured");
        assertFalse(outcome.log().contains("Item 3/3"));
    }

    @Test
    void cancelledTokenStopsBeforeNextItem() {
        CancellationToken token = new CancellationToken();
        ClassificationJob job = new ClassificationJob("job-3",
                List.of("a", "b", "c"),
                categories, TestBackends.firstLabel(), token,
                (id, f) -> token.requestCancel(), clock);

        JobOutcome outcome = job.call();

        assertEquals(JobState.ABORTED, outcome.status());
        assertEquals(1, outcome.processed());
        assertTrue(outcome.log().contains("cancelled after 1 of 3 items"));
    }

    @Test
    void alreadyCancelledTokenProcessesNothing() {
        CancellationToken token = new CancellationToken();
        token.requestCancel();
        ClassificationJob job = new ClassificationJob("job-4", List.of("a"), categories,
                (text, labels) -> fail("backend must not be called"), token, ProgressListener.NONE, clock);

        JobOutcome outcome = job.call();

        assertEquals(JobState.ABORTED, outcome.status());
        assertEquals(0, outcome.processed());
    }

    @Test
    void failingProgressListenerDoesNotFailJob() {
        ClassificationJob job = new ClassificationJob("job-5", List.of("a", "b"), categories,
                TestBackends.firstLabel(), new CancellationToken(),
                (id, f) -> {
                    throw new IllegalStateException("registry gone");
                }, clock);

        JobOutcome outcome = job.call();

        assertEquals(JobState.COMPLETED, outcome.status());
        assertTrue(outcome.log().contains("registry gone"));
    }
}
