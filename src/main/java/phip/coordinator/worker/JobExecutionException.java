package phip.coordinator.worker;

/**
 * Wraps a checked unit-of-work failure rethrown under {@link FailurePolicy#RETHROW}.
 */
public class JobExecutionException extends RuntimeException {

    private final String jobId;

    public JobExecutionException(String jobId, Throwable cause) {
        super("Job " + jobId + " failed: " + cause.getMessage(), cause);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
