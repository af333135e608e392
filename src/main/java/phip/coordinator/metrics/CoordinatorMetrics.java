package phip.coordinator.metrics;

import phip.coordinator.model.JobStatus;

/**
 * Hook fired by the coordinator for contention and anomaly signals.
 * Implementations must be thread-safe and must not throw.
 */
public interface CoordinatorMetrics {

    /** No-op implementation */
    CoordinatorMetrics NOOP = new CoordinatorMetrics() {
    };

    /** A worker lost the race to claim a job */
    default void claimLost(String jobId) {
    }

    /**
     * A finalizing write found a stale version: two actors believed they owned
     * the same job.
     *
     * @param operation complete, fail or cancel
     */
    default void concurrencyConflict(String jobId, String operation) {
    }

    /**
     * A finalizing write found the job already CANCELLED. Expected after a
     * cancel request, so not reported as a conflict.
     */
    default void finalizedAfterCancel(String jobId, String operation) {
    }

    /** A conditional update succeeded */
    default void transitionApplied(String jobId, JobStatus to) {
    }

    /** The reaper failed a stuck job */
    default void jobReaped(String jobId) {
    }
}
