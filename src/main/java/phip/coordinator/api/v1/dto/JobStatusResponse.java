package phip.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import phip.coordinator.model.JobRecord;

import java.time.Duration;
import java.time.Instant;

/**
 * Response DTO for job status polling.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("name") String name,
        @JsonProperty("modelType") String modelType,
        @JsonProperty("status") String status,
        @JsonProperty("version") long version,
        @JsonProperty("workerRef") String workerRef,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt,
        @JsonProperty("executionTimeMs") Long executionTimeMs,
        @JsonProperty("result") String result,
        @JsonProperty("errorInfo") String errorInfo,
        @JsonProperty("cancelReason") String cancelReason) {

    /** Create response from domain model */
    public static JobStatusResponse from(JobRecord job) {
        Duration executionTime = job.executionTime();
        return new JobStatusResponse(
                job.id(),
                job.name(),
                job.modelType(),
                job.status().name(),
                job.version(),
                job.workerRef(),
                job.createdAt(),
                job.startedAt(),
                job.completedAt(),
                executionTime != null ? executionTime.toMillis() : null,
                job.result(),
                job.errorInfo(),
                job.cancelReason());
    }
}
