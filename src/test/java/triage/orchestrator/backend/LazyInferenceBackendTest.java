package triage.orchestrator.backend;

import org.junit.jupiter.api.Test;
import triage.orchestrator.exception.InferenceException;
import triage.orchestrator.support.TestBackends;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class LazyInferenceBackendTest {

    @Test
    void factoryNotCalledUntilFirstUse() throws Exception {
        AtomicInteger builds = new AtomicInteger();
        LazyInferenceBackend lazy = new LazyInferenceBackend(() -> {
            builds.incrementAndGet();
            return TestBackends.firstLabel();
        });

        assertFalse(lazy.isInitialized());
        assertEquals(0, builds.get());

        lazy.classify("x", List.of("a", "b"));
        lazy.classify("y", List.of("a", "b"));

        assertTrue(lazy.isInitialized());
        assertEquals(1, builds.get());
    }

    @Test
    void concurrentFirstCallsBuildOnce() throws Exception {
        AtomicInteger builds = new AtomicInteger();
        LazyInferenceBackend lazy = new LazyInferenceBackend(() -> {
            builds.incrementAndGet();
            Thread.sleep(50);
            return TestBackends.firstLabel();
        });

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        for (int i = 0; i < 8; i++) {
            pool.submit(() -> {
                start.await();
                return lazy.classify("x", List.of("a"));
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(1, builds.get());
    }

    @Test
    void failedBuildIsReportedAndRetried() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        LazyInferenceBackend lazy = new LazyInferenceBackend(() -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("model download failed");
            }
            return TestBackends.firstLabel();
        });

        InferenceException e = assertThrows(InferenceException.class, () -> lazy.classify("x", List.of("a")));
        assertTrue(e.getMessage().contains("model download failed"));
        assertFalse(lazy.isInitialized());

        assertEquals("a", lazy.classify("x", List.of("a")).get(0).label());
        assertEquals(2, attempts.get());
    }

    @Test
    void nameReflectsDelegate() throws Exception {
        LazyInferenceBackend lazy = new LazyInferenceBackend(KeywordOverlapBackend::new);
        assertEquals("lazy(uninitialized)", lazy.name());
        lazy.classify("x", List.of("a"));
        assertEquals("keyword-overlap", lazy.name());
    }
}
