package triage.orchestrator.store;

import triage.orchestrator.model.JobRecord;
import triage.orchestrator.model.JobState;
import triage.orchestrator.repository.JobRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Process-memory registry backed by a ConcurrentHashMap.
 * Per-key compute() makes every update an atomic read-modify-write without a
 * global lock; nothing slow ever runs inside the mutation.
 */
public class InMemoryJobRegistry implements JobRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryJobRegistry.class);

    private final ConcurrentHashMap<String, JobRecord> jobs = new ConcurrentHashMap<>();
    private final Supplier<String> idGenerator;

    public InMemoryJobRegistry() {
        this(() -> "job-" + UUID.randomUUID());
    }

    /** Custom id source, used by tests to force collisions. */
    public InMemoryJobRegistry(Supplier<String> idGenerator) {
        this.idGenerator = idGenerator;
    }

    @Override
    public JobRecord create(List<String> items, List<String> categories, Instant now) {
        while (true) {
            String id = idGenerator.get();
            JobRecord record = JobRecord.builder()
                    .id(id)
                    .status(JobState.QUEUED)
                    .createdAt(now)
                    .items(items)
                    .categories(categories)
                    .build();
            if (jobs.putIfAbsent(id, record) == null) {
                return record;
            }
            log.warn("Job id collision on {}, regenerating", id);
        }
    }

    @Override
    public Optional<JobRecord> get(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public Optional<JobRecord> update(String jobId, UnaryOperator<JobRecord> mutation) {
        if (jobId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(jobs.computeIfPresent(jobId, (id, current) -> mutation.apply(current)));
    }

    @Override
    public boolean delete(String jobId) {
        return jobId != null && jobs.remove(jobId) != null;
    }

    @Override
    public List<String> listActive() {
        return jobs.values().stream()
                .filter(j -> j.status().isActive())
                .map(JobRecord::id)
                .toList();
    }

    @Override
    public List<JobRecord> findAll() {
        return jobs.values().stream()
                .sorted(Comparator.comparing(JobRecord::createdAt).reversed())
                .toList();
    }

    @Override
    public List<JobRecord> findTerminalCompletedBefore(Instant cutoff) {
        return jobs.values().stream()
                .filter(JobRecord::isTerminal)
                .filter(j -> j.completedAt().isBefore(cutoff))
                .toList();
    }

    @Override
    public int countActive() {
        return (int) jobs.values().stream().filter(j -> j.status().isActive()).count();
    }

    @Override
    public int count() {
        return jobs.size();
    }
}
