package triage.orchestrator.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of one submitted batch.
 * The registry replaces the whole value on every change, so readers always see
 * a consistent record.
 *
 * <p>
 * Construction enforces the record invariants: results are present exactly when
 * COMPLETED (one per item), an error exactly when FAILED, and completedAt
 * exactly when the state is terminal.
 */
public final class JobRecord {
    private final String id;
    private final JobState status;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final int total;
    private final double progress;
    private final List<String> items;
    private final List<String> categories;
    private final List<ClassificationResult> results;
    private final String error;
    private final String log;

    private JobRecord(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt is required");
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.items = List.copyOf(Objects.requireNonNull(builder.items, "items is required"));
        this.categories = List.copyOf(Objects.requireNonNull(builder.categories, "categories is required"));
        this.total = items.size();
        this.progress = builder.progress;
        this.results = builder.results == null ? null : List.copyOf(builder.results);
        this.error = builder.error;
        this.log = builder.log;
        checkInvariants();
    }

    private void checkInvariants() {
        if (progress < 0.0 || progress > 1.0) {
            throw new IllegalArgumentException("progress out of range: " + progress);
        }
        if ((status == JobState.COMPLETED) != (results != null)) {
            throw new IllegalArgumentException("results must be present iff COMPLETED (status=" + status + ")");
        }
        if (results != null && results.size() != total) {
            throw new IllegalArgumentException(
                    "expected " + total + " results, got " + results.size());
        }
        if ((status == JobState.FAILED) != (error != null)) {
            throw new IllegalArgumentException("error must be present iff FAILED (status=" + status + ")");
        }
        if (status.isTerminal() != (completedAt != null)) {
            throw new IllegalArgumentException("completedAt must be present iff terminal (status=" + status + ")");
        }
    }

    // Getters
    public String id() {
        return id;
    }

    public JobState status() {
        return status;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public int total() {
        return total;
    }

    public double progress() {
        return progress;
    }

    public List<String> items() {
        return items;
    }

    public List<String> categories() {
        return categories;
    }

    public List<ClassificationResult> results() {
        return results;
    }

    public String error() {
        return error;
    }

    public String log() {
        return log;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Wall time spent in the job so far: now − startedAt while running,
     * completedAt − startedAt once terminal, null if never started.
     */
    public Duration duration(Instant now) {
        if (startedAt == null) {
            return null;
        }
        Instant end = completedAt != null ? completedAt : now;
        return Duration.between(startedAt, end);
    }

    // ---- transitions ----

    public JobRecord markProcessing(Instant now) {
        requireStatus(JobState.QUEUED);
        return toBuilder().status(JobState.PROCESSING).startedAt(now).build();
    }

    /** Advance progress. Ignored unless PROCESSING; never moves backwards. */
    public JobRecord withProgress(double fraction) {
        if (status != JobState.PROCESSING || fraction <= progress) {
            return this;
        }
        return toBuilder().progress(Math.min(1.0, fraction)).build();
    }

    public JobRecord complete(List<ClassificationResult> results, String log, Instant now) {
        requireActive();
        return toBuilder()
                .status(JobState.COMPLETED)
                .progress(1.0)
                .results(results)
                .log(log)
                .completedAt(now)
                .build();
    }

    public JobRecord fail(String error, String log, Instant now) {
        requireActive();
        return toBuilder()
                .status(JobState.FAILED)
                .error(error != null ? error : "unknown error")
                .log(log)
                .completedAt(now)
                .build();
    }

    public JobRecord abort(String log, Instant now) {
        requireActive();
        return toBuilder()
                .status(JobState.ABORTED)
                .log(log != null ? log : this.log)
                .completedAt(now)
                .build();
    }

    /** Attach a diagnostic log without touching state or timestamps. */
    public JobRecord withLog(String log) {
        return toBuilder().log(log).build();
    }

    private void requireStatus(JobState expected) {
        if (status != expected) {
            throw new IllegalStateException("job " + id + " is " + status + ", expected " + expected);
        }
    }

    private void requireActive() {
        if (!status.isActive()) {
            throw new IllegalStateException("job " + id + " is already terminal: " + status);
        }
    }

    /** Create a builder from this record (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .status(status)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .progress(progress)
                .items(items)
                .categories(categories)
                .results(results)
                .error(error)
                .log(log);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private JobState status = JobState.QUEUED;
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;
        private double progress;
        private List<String> items;
        private List<String> categories;
        private List<ClassificationResult> results;
        private String error;
        private String log;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder status(JobState status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder progress(double progress) {
            this.progress = progress;
            return this;
        }

        public Builder items(List<String> items) {
            this.items = items;
            return this;
        }

        public Builder categories(List<String> categories) {
            this.categories = categories;
            return this;
        }

        public Builder results(List<ClassificationResult> results) {
            this.results = results;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder log(String log) {
            this.log = log;
            return this;
        }

        public JobRecord build() {
            return new JobRecord(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JobRecord other))
            return false;
        return Objects.equals(id, other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "JobRecord{id='" + id + "', status=" + status + ", total=" + total
                + ", progress=" + progress + "}";
    }
}
