package triage.orchestrator.repository;

import triage.orchestrator.model.JobRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Single source of truth for job state.
 * Every operation must be safe under concurrent access from request handlers,
 * pool callbacks, the reaper and the shutdown coordinator.
 */
public interface JobRegistry {

    /**
     * Allocate a fresh unique id and insert a QUEUED record.
     *
     * @param items      batch items, in order
     * @param categories label set for the batch
     * @param now        creation time
     * @return the inserted record
     */
    JobRecord create(List<String> items, List<String> categories, Instant now);

    /**
     * Find a job by ID.
     *
     * @param jobId the job ID
     * @return the record if present
     */
    Optional<JobRecord> get(String jobId);

    /**
     * Atomic read-modify-write of one record.
     * A missing id is a no-op; the job may already have been reaped.
     *
     * @param jobId    the job ID
     * @param mutation function from current to new value; returning the same
     *                 instance leaves the record untouched
     * @return the record after the mutation, empty if the id is unknown
     */
    Optional<JobRecord> update(String jobId, UnaryOperator<JobRecord> mutation);

    /**
     * Remove a record.
     *
     * @param jobId the job ID
     * @return true if a record was removed
     */
    boolean delete(String jobId);

    /**
     * Ids of QUEUED or PROCESSING jobs.
     */
    List<String> listActive();

    /**
     * All records, newest first.
     */
    List<JobRecord> findAll();

    /**
     * Terminal records whose completedAt is strictly before the cutoff.
     *
     * @param cutoff retention boundary
     * @return expired records
     */
    List<JobRecord> findTerminalCompletedBefore(Instant cutoff);

    int countActive();

    int count();
}
