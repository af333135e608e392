package phip.coordinator.model;

/**
 * Result of finalizing a job (complete, fail or cancel).
 *
 * A {@link Kind#CONFLICT} means the caller's expected version was stale: someone
 * else (the reaper, a cancel request, another worker) changed the job first.
 * The caller must stop processing the job and must not retry blindly.
 */
public record TransitionResult(Kind kind, String jobId, long version, JobStatus status) {

    public enum Kind {
        /** The conditional write succeeded */
        APPLIED,
        /** The expected version did not match; nothing was written */
        CONFLICT
    }

    /**
     * @param newVersion version written by the successful update
     * @param newStatus  status written by the successful update
     */
    public static TransitionResult applied(String jobId, long newVersion, JobStatus newStatus) {
        return new TransitionResult(Kind.APPLIED, jobId, newVersion, newStatus);
    }

    /**
     * @param observedVersion version seen when the conflict was detected, or -1 if unknown
     * @param observedStatus  status seen when the conflict was detected, or null if unknown
     */
    public static TransitionResult conflict(String jobId, long observedVersion, JobStatus observedStatus) {
        return new TransitionResult(Kind.CONFLICT, jobId, observedVersion, observedStatus);
    }

    public boolean isApplied() {
        return kind == Kind.APPLIED;
    }

    public boolean isConflict() {
        return kind == Kind.CONFLICT;
    }
}
