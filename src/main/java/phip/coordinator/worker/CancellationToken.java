package phip.coordinator.worker;

import phip.coordinator.model.JobRecord;
import phip.coordinator.model.JobStatus;
import phip.coordinator.repository.JobRecordStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Cooperative cancellation signal for one claimed job. Polls the store at most
 * once per poll interval; once cancellation is seen it stays set.
 */
public final class CancellationToken {

    private final JobRecordStore store;
    private final String jobId;
    private final Duration pollInterval;
    private final Clock clock;

    private volatile boolean cancelled;
    private volatile Instant lastPoll;

    public CancellationToken(JobRecordStore store, String jobId, Duration pollInterval, Clock clock) {
        this.store = store;
        this.jobId = jobId;
        this.pollInterval = pollInterval;
        this.clock = clock;
        this.lastPoll = clock.instant();
    }

    public String jobId() {
        return jobId;
    }

    /**
     * @return true once the job row has been seen in CANCELLED status
     */
    public boolean isCancelled() {
        if (cancelled) {
            return true;
        }
        Instant now = clock.instant();
        if (Duration.between(lastPoll, now).compareTo(pollInterval) >= 0) {
            lastPoll = now;
            poll();
        }
        return cancelled;
    }

    /**
     * Check the store right now, ignoring the poll interval.
     */
    public boolean checkNow() {
        if (!cancelled) {
            lastPoll = clock.instant();
            poll();
        }
        return cancelled;
    }

    /**
     * @throws JobCancelledException if the job has been cancelled
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new JobCancelledException(jobId);
        }
    }

    private void poll() {
        JobStatus status = store.find(jobId).map(JobRecord::status).orElse(null);
        if (status == JobStatus.CANCELLED) {
            cancelled = true;
        }
    }
}
