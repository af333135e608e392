package phip.coordinator.repository;

import phip.coordinator.model.JobMutation;
import phip.coordinator.model.JobNotFoundException;
import phip.coordinator.model.JobRecord;
import phip.coordinator.model.JobStatus;
import phip.coordinator.model.UpdateResult;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable table of simulation job rows with a per-row version counter.
 * Implementations must make {@link #conditionalUpdate} a single atomic
 * compare-and-swap and be safe for unlimited concurrent callers.
 */
public interface JobRecordStore {

    /**
     * Insert a new PENDING row at version 1.
     * Only the submission path creates rows.
     *
     * @param record the row to insert
     * @throws IllegalArgumentException if the record is not PENDING at version 1
     */
    void insert(JobRecord record);

    /**
     * Point read without locking.
     *
     * @param jobId the job ID
     * @return the current row
     * @throws JobNotFoundException if no row has this id
     */
    default JobRecord load(String jobId) {
        return find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * Point read without locking.
     *
     * @param jobId the job ID
     * @return the current row if present
     */
    Optional<JobRecord> find(String jobId);

    /**
     * Apply {@code mutation} iff the persisted version equals
     * {@code expectedVersion}, setting {@code version = expectedVersion + 1} and
     * touching {@code updatedAt} in the same atomic operation.
     *
     * @param jobId           the job ID
     * @param expectedVersion version the caller last observed
     * @param mutation        field values to write
     * @return applied with the new version, or not applied on a version mismatch
     *         (including a missing row); never throws for a lost race
     */
    UpdateResult conditionalUpdate(String jobId, long expectedVersion, JobMutation mutation);

    /**
     * RUNNING rows whose {@code startedAt} is before the given instant, oldest first.
     *
     * @param startedBefore cutoff
     * @return stuck rows
     */
    List<JobRecord> findStuckRunning(Instant startedBefore);

    /**
     * Rows in the given status, oldest first.
     */
    List<JobRecord> findByStatus(JobStatus status, int limit);

    /**
     * Most recently touched rows, for monitoring.
     */
    List<JobRecord> findRecent(int limit);

    int countByStatus(JobStatus status);
}
