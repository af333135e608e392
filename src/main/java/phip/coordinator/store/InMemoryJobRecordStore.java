package phip.coordinator.store;

import phip.coordinator.model.JobMutation;
import phip.coordinator.model.JobRecord;
import phip.coordinator.model.JobStatus;
import phip.coordinator.model.UpdateResult;
import phip.coordinator.repository.JobRecordStore;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory JobRecordStore for single-process deployments.
 * Rows are immutable snapshots; the compare-and-swap runs inside
 * {@link ConcurrentMap#computeIfPresent}, which is atomic per key.
 */
public final class InMemoryJobRecordStore implements JobRecordStore {

    private final ConcurrentMap<String, JobRecord> rows = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryJobRecordStore() {
        this(Clock.systemUTC());
    }

    public InMemoryJobRecordStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void insert(JobRecord record) {
        if (record.status() != JobStatus.PENDING || record.version() != JobRecord.INITIAL_VERSION) {
            throw new IllegalArgumentException("New jobs must be PENDING at version 1: " + record);
        }
        Instant createdAt = record.createdAt() != null ? record.createdAt() : clock.instant();
        JobRecord stored = record.toBuilder().createdAt(createdAt).updatedAt(createdAt).build();
        if (rows.putIfAbsent(record.id(), stored) != null) {
            throw new IllegalArgumentException("Job already exists: " + record.id());
        }
    }

    @Override
    public Optional<JobRecord> find(String jobId) {
        return Optional.ofNullable(rows.get(jobId));
    }

    @Override
    public UpdateResult conditionalUpdate(String jobId, long expectedVersion, JobMutation mutation) {
        long[] written = { -1L };
        rows.computeIfPresent(jobId, (id, current) -> {
            if (current.version() != expectedVersion) {
                return current;
            }
            long next = expectedVersion + 1;
            written[0] = next;
            return mutation.applyTo(current, next, clock.instant());
        });
        return written[0] > 0 ? UpdateResult.applied(written[0]) : UpdateResult.notApplied();
    }

    @Override
    public List<JobRecord> findStuckRunning(Instant startedBefore) {
        return rows.values().stream()
                .filter(r -> r.status() == JobStatus.RUNNING)
                .filter(r -> r.startedAt() != null && r.startedAt().isBefore(startedBefore))
                .sorted(Comparator.comparing(JobRecord::startedAt))
                .toList();
    }

    @Override
    public List<JobRecord> findByStatus(JobStatus status, int limit) {
        return rows.values().stream()
                .filter(r -> r.status() == status)
                .sorted(Comparator.comparing(JobRecord::createdAt))
                .limit(limit)
                .toList();
    }

    @Override
    public List<JobRecord> findRecent(int limit) {
        return rows.values().stream()
                .sorted(Comparator.comparing(JobRecord::updatedAt).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public int countByStatus(JobStatus status) {
        return (int) rows.values().stream().filter(r -> r.status() == status).count();
    }
}
