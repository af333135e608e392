package phip.coordinator.worker;

/**
 * How one {@link JobRunner#run} call ended.
 */
public enum RunOutcome {
    /** Another worker owns the job, or it is no longer pending */
    NOT_CLAIMED,
    /** Work finished and the job was marked COMPLETED */
    COMPLETED,
    /** Work threw and the job was marked FAILED */
    FAILED,
    /** The job was cancelled while this worker owned it */
    CANCELLED,
    /** Ownership was lost (e.g. reaped) before the result could be recorded */
    CONFLICT
}
