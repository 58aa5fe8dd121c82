package triage.orchestrator.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JobRecordTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static JobRecord queued() {
        return JobRecord.builder()
                .id("job-1")
                .createdAt(T0)
                .items(List.of("a", "b"))
                .categories(List.of("x", "y"))
                .build();
    }

    private static List<ClassificationResult> twoResults() {
        return List.of(
                new ClassificationResult("a", "x", Map.of("x", 0.9, "y", 0.1)),
                new ClassificationResult("b", "y", Map.of("y", 0.8, "x", 0.2)));
    }

    @Test
    void newRecordIsQueuedWithZeroProgress() {
        JobRecord job = queued();

        assertEquals(JobState.QUEUED, job.status());
        assertEquals(2, job.total());
        assertEquals(0.0, job.progress());
        assertNull(job.startedAt());
        assertNull(job.completedAt());
        assertNull(job.results());
        assertNull(job.duration(T0.plusSeconds(10)));
    }

    @Test
    void markProcessingSetsStartTime() {
        JobRecord job = queued().markProcessing(T0.plusSeconds(1));

        assertEquals(JobState.PROCESSING, job.status());
        assertEquals(T0.plusSeconds(1), job.startedAt());
        assertEquals(Duration.ofSeconds(4), job.duration(T0.plusSeconds(5)));
    }

    @Test
    void markProcessingRequiresQueued() {
        JobRecord running = queued().markProcessing(T0);
        assertThrows(IllegalStateException.class, () -> running.markProcessing(T0));
    }

    @Test
    void progressOnlyMovesForward() {
        JobRecord job = queued().markProcessing(T0).withProgress(0.5);
        assertEquals(0.5, job.progress());

        assertSame(job, job.withProgress(0.25));
        assertEquals(0.5, job.withProgress(0.25).progress());
    }

    @Test
    void progressIgnoredUnlessProcessing() {
        JobRecord job = queued();
        assertEquals(0.0, job.withProgress(0.5).progress());

        JobRecord aborted = queued().markProcessing(T0).abort(null, T0.plusSeconds(1));
        assertEquals(0.0, aborted.withProgress(1.0).progress());
    }

    @Test
    void completeStoresResultsAndFullProgress() {
        JobRecord done = queued().markProcessing(T0).complete(twoResults(), "log", T0.plusSeconds(3));

        assertEquals(JobState.COMPLETED, done.status());
        assertEquals(1.0, done.progress());
        assertEquals(2, done.results().size());
        assertEquals("log", done.log());
        assertEquals(Duration.ofSeconds(3), done.duration(T0.plusSeconds(100)));
    }

    @Test
    void completeRejectsWrongResultCount() {
        JobRecord running = queued().markProcessing(T0);
        List<ClassificationResult> one = twoResults().subList(0, 1);
        assertThrows(IllegalArgumentException.class, () -> running.complete(one, null, T0));
    }

    @Test
    void failKeepsErrorAndNoResults() {
        JobRecord failed = queued().markProcessing(T0).fail("boom", "log", T0.plusSeconds(1));

        assertEquals(JobState.FAILED, failed.status());
        assertEquals("boom", failed.error());
        assertNull(failed.results());
        assertNotNull(failed.completedAt());
    }

    @Test
    void abortKeepsExistingLogWhenNoneGiven() {
        JobRecord running = queued().markProcessing(T0).withLog("partial");
        JobRecord aborted = running.abort(null, T0.plusSeconds(1));

        assertEquals(JobState.ABORTED, aborted.status());
        assertEquals("partial", aborted.log());
    }

    @Test
    void terminalRecordsRejectFurtherTransitions() {
        JobRecord aborted = queued().abort(null, T0);

        assertThrows(IllegalStateException.class, () -> aborted.complete(twoResults(), null, T0));
        assertThrows(IllegalStateException.class, () -> aborted.fail("late", null, T0));
        assertThrows(IllegalStateException.class, () -> aborted.abort(null, T0));
    }

    @Test
    void builderRejectsInconsistentRecords() {
        assertThrows(IllegalArgumentException.class, () -> queued().toBuilder().progress(1.5).build());
        assertThrows(IllegalArgumentException.class, () -> queued().toBuilder().error("x").build());
        assertThrows(IllegalArgumentException.class,
                () -> queued().toBuilder().status(JobState.FAILED).error("x").build());
        assertThrows(IllegalArgumentException.class,
                () -> queued().toBuilder().completedAt(T0).build());
    }

    @Test
    void inputsAreCopied() {
        List<String> items = new java.util.ArrayList<>(List.of("a"));
        JobRecord job = JobRecord.builder().id("j").createdAt(T0).items(items).categories(List.of("x")).build();
        items.add("b");

        assertEquals(1, job.total());
        assertThrows(UnsupportedOperationException.class, () -> job.items().add("c"));
    }

    @Test
    void equalityById() {
        JobRecord a = queued();
        JobRecord b = a.markProcessing(T0);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }
}
