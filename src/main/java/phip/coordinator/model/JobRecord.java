package phip.coordinator.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of one simulation job row.
 * Every change goes through a versioned conditional update; see
 * {@link JobMutation}.
 */
public final class JobRecord {

    public static final long INITIAL_VERSION = 1L;

    private final String id;
    private final String name;
    private final String modelType; // seir, agent_based, network, ml_forecast
    private final String parameters; // JSON handed to the unit of work
    private final JobStatus status;
    private final long version;
    private final String workerRef; // claim token or null
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Instant updatedAt;
    private final String result; // JSON, set only when COMPLETED
    private final String errorInfo; // JSON, set only when FAILED
    private final String cancelReason; // set only when CANCELLED

    private JobRecord(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = builder.name;
        this.modelType = builder.modelType;
        this.parameters = builder.parameters;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        if (builder.version < 0) {
            throw new IllegalArgumentException("version must be non-negative: " + builder.version);
        }
        this.version = builder.version;
        this.workerRef = builder.workerRef;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.updatedAt = builder.updatedAt;
        this.result = builder.result;
        this.errorInfo = builder.errorInfo;
        this.cancelReason = builder.cancelReason;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String modelType() {
        return modelType;
    }

    public String parameters() {
        return parameters;
    }

    public JobStatus status() {
        return status;
    }

    public long version() {
        return version;
    }

    public String workerRef() {
        return workerRef;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public String result() {
        return result;
    }

    public String errorInfo() {
        return errorInfo;
    }

    public String cancelReason() {
        return cancelReason;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Wall time between claim and finalization, or null while not finished */
    public Duration executionTime() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return Duration.between(startedAt, completedAt);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .modelType(modelType)
                .parameters(parameters)
                .status(status)
                .version(version)
                .workerRef(workerRef)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .updatedAt(updatedAt)
                .result(result)
                .errorInfo(errorInfo)
                .cancelReason(cancelReason);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String modelType;
        private String parameters;
        private JobStatus status = JobStatus.PENDING;
        private long version = INITIAL_VERSION;
        private String workerRef;
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;
        private Instant updatedAt;
        private String result;
        private String errorInfo;
        private String cancelReason;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder modelType(String modelType) {
            this.modelType = modelType;
            return this;
        }

        public Builder parameters(String parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder workerRef(String workerRef) {
            this.workerRef = workerRef;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder errorInfo(String errorInfo) {
            this.errorInfo = errorInfo;
            return this;
        }

        public Builder cancelReason(String cancelReason) {
            this.cancelReason = cancelReason;
            return this;
        }

        public JobRecord build() {
            return new JobRecord(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JobRecord other))
            return false;
        return Objects.equals(id, other.id) && version == other.version;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version);
    }

    @Override
    public String toString() {
        return "JobRecord{id='" + id + "', status=" + status + ", version=" + version
                + ", workerRef='" + workerRef + "'}";
    }
}
