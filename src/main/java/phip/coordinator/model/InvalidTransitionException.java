package phip.coordinator.model;

/**
 * Raised when a caller requests a status change that is not in the transition
 * table. Indicates a programming error or stale client state; never retried.
 */
public class InvalidTransitionException extends RuntimeException {

    private final JobStatus from;
    private final JobStatus to;

    public InvalidTransitionException(JobStatus from, JobStatus to) {
        super("Invalid job transition: " + from + " -> " + to);
        this.from = from;
        this.to = to;
    }

    public JobStatus from() {
        return from;
    }

    public JobStatus to() {
        return to;
    }
}
