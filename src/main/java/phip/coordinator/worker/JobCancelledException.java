package phip.coordinator.worker;

/**
 * Thrown by a unit of work when it observes that its job was cancelled.
 */
public class JobCancelledException extends RuntimeException {

    private final String jobId;

    public JobCancelledException(String jobId) {
        super("Job cancelled: " + jobId);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
