package phip.coordinator.model;

/**
 * Result of a claim attempt. Losing the race is the normal outcome for every
 * worker but one; it is not an error.
 */
public record ClaimResult(boolean claimed, String jobId, long version, String workerRef) {

    public static ClaimResult claimed(String jobId, long version, String workerRef) {
        return new ClaimResult(true, jobId, version, workerRef);
    }

    public static ClaimResult lost(String jobId) {
        return new ClaimResult(false, jobId, -1L, null);
    }
}
