package phip.coordinator.model;

/**
 * Simulation job lifecycle status.
 */
public enum JobStatus {
    /** Job submitted, waiting to be claimed by a worker */
    PENDING,
    /** Job claimed by a worker and being executed */
    RUNNING,
    /** Job finished successfully */
    COMPLETED,
    /** Job failed (worker error or reaper timeout) */
    FAILED,
    /** Job cancelled before or during execution */
    CANCELLED;

    /** Check if no further transition is possible from this status */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
