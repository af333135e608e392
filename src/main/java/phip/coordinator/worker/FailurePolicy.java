package phip.coordinator.worker;

/**
 * What the runner does with a unit-of-work exception after recording the
 * failure on the job.
 */
public enum FailurePolicy {
    /** Return {@link RunOutcome#FAILED}; the job row is the durable record */
    SWALLOW,
    /** Rethrow to the caller (checked exceptions wrapped in JobExecutionException) */
    RETHROW
}
