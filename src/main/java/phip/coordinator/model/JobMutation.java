package phip.coordinator.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Field values written by one conditional update. Only the fields set here
 * change; {@code version} and {@code updatedAt} are always maintained by the
 * store itself.
 */
public final class JobMutation {

    /** Stored as the result of a job whose work returned nothing */
    public static final String EMPTY_RESULT = "null";

    private final JobStatus status;
    private final String workerRef;
    private final Instant startedAt;
    private final Instant completedAt;
    private final String result;
    private final String errorInfo;
    private final String cancelReason;

    private JobMutation(JobStatus status, String workerRef, Instant startedAt, Instant completedAt,
            String result, String errorInfo, String cancelReason) {
        this.status = Objects.requireNonNull(status, "status is required");
        this.workerRef = workerRef;
        this.startedAt = startedAt;
        this.completedAt = completedAt;
        this.result = result;
        this.errorInfo = errorInfo;
        this.cancelReason = cancelReason;
    }

    public static JobMutation claim(String workerRef, Instant startedAt) {
        Objects.requireNonNull(workerRef, "workerRef is required");
        Objects.requireNonNull(startedAt, "startedAt is required");
        return new JobMutation(JobStatus.RUNNING, workerRef, startedAt, null, null, null, null);
    }

    /**
     * @param result JSON result; null is stored as the JSON literal {@code null}
     *               so a COMPLETED row always carries a result
     */
    public static JobMutation complete(String result, Instant completedAt) {
        Objects.requireNonNull(completedAt, "completedAt is required");
        return new JobMutation(JobStatus.COMPLETED, null, null, completedAt,
                result != null ? result : EMPTY_RESULT, null, null);
    }

    public static JobMutation fail(String errorInfo, Instant completedAt) {
        Objects.requireNonNull(errorInfo, "errorInfo is required");
        Objects.requireNonNull(completedAt, "completedAt is required");
        return new JobMutation(JobStatus.FAILED, null, null, completedAt, null, errorInfo, null);
    }

    public static JobMutation cancel(String reason, Instant completedAt) {
        Objects.requireNonNull(reason, "reason is required");
        Objects.requireNonNull(completedAt, "completedAt is required");
        return new JobMutation(JobStatus.CANCELLED, null, null, completedAt, null, null, reason);
    }

    public JobStatus status() {
        return status;
    }

    /**
     * Produce the row as it looks after this mutation. Pure: the input is left
     * untouched.
     */
    public JobRecord applyTo(JobRecord current, long newVersion, Instant updatedAt) {
        JobRecord.Builder b = current.toBuilder()
                .status(status)
                .version(newVersion)
                .updatedAt(updatedAt);
        if (workerRef != null)
            b.workerRef(workerRef);
        if (startedAt != null)
            b.startedAt(startedAt);
        if (completedAt != null)
            b.completedAt(completedAt);
        if (result != null)
            b.result(result);
        if (errorInfo != null)
            b.errorInfo(errorInfo);
        if (cancelReason != null)
            b.cancelReason(cancelReason);
        return b.build();
    }

    /**
     * Column name to value for every field this mutation writes, in a stable
     * order. Used to build the SET clause of the conditional UPDATE.
     */
    public Map<String, Object> columns() {
        Map<String, Object> cols = new LinkedHashMap<>();
        cols.put("status", status.name());
        if (workerRef != null)
            cols.put("worker_ref", workerRef);
        if (startedAt != null)
            cols.put("started_at", startedAt);
        if (completedAt != null)
            cols.put("completed_at", completedAt);
        if (result != null)
            cols.put("result", result);
        if (errorInfo != null)
            cols.put("error_info", errorInfo);
        if (cancelReason != null)
            cols.put("cancel_reason", cancelReason);
        return cols;
    }

    @Override
    public String toString() {
        return "JobMutation{status=" + status + ", columns=" + columns().keySet() + "}";
    }
}
