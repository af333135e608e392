package phip.coordinator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import phip.coordinator.api.v1.dto.JobStatusResponse;
import phip.coordinator.model.JobNotFoundException;
import phip.coordinator.model.JobRecord;
import phip.coordinator.model.JobStatus;
import phip.coordinator.model.TransitionResult;
import phip.coordinator.repository.JobRecordStore;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Submission, cancellation and status polling for simulation jobs.
 */
public class SimulationJobService {

    private static final Logger log = LoggerFactory.getLogger(SimulationJobService.class);

    private final JobRecordStore store;
    private final JobCoordinator coordinator;
    private final Clock clock;

    public SimulationJobService(JobRecordStore store, JobCoordinator coordinator, Clock clock) {
        this.store = store;
        this.coordinator = coordinator;
        this.clock = clock;
    }

    /**
     * Create a new PENDING job at version 1.
     *
     * @param name       display name, may be null
     * @param modelType  simulation model (seir, ml_forecast, ...)
     * @param parameters model parameters as JSON, may be null
     * @return the new job id
     */
    public String submit(String name, String modelType, String parameters) {
        if (modelType == null || modelType.isBlank()) {
            throw new IllegalArgumentException("modelType is required");
        }
        String jobId = UUID.randomUUID().toString();

        JobRecord job = JobRecord.builder()
                .id(jobId)
                .name(name)
                .modelType(modelType)
                .parameters(parameters)
                .status(JobStatus.PENDING)
                .createdAt(clock.instant())
                .build();

        store.insert(job);
        log.info("Submitted job {} ({})", jobId, modelType);
        return jobId;
    }

    /**
     * Cancel a PENDING or RUNNING job at its current version. Makes exactly one
     * attempt; a conflict means someone else moved the job first.
     *
     * @throws JobNotFoundException if the job does not exist
     * @throws phip.coordinator.model.InvalidTransitionException if the job is already terminal
     */
    public TransitionResult requestCancel(String jobId, String reason) {
        JobRecord current = store.load(jobId);
        TransitionResult res = coordinator.cancel(jobId, current.version(), reason);
        if (res.isConflict()) {
            log.warn("Cancel of job {} raced with another update (now {})", jobId, res.status());
        }
        return res;
    }

    /**
     * @throws JobNotFoundException if the job does not exist
     */
    public JobStatusResponse getStatus(String jobId) {
        return JobStatusResponse.from(store.load(jobId));
    }

    public Optional<JobRecord> find(String jobId) {
        return store.find(jobId);
    }

    public List<JobRecord> findRecent(int limit) {
        return store.findRecent(limit);
    }

    public int countByStatus(JobStatus status) {
        return store.countByStatus(status);
    }

    /**
     * Ids of PENDING jobs, oldest first, for feeding a worker pool.
     */
    public List<String> pendingJobIds(int limit) {
        return store.findByStatus(JobStatus.PENDING, limit).stream()
                .map(JobRecord::id)
                .toList();
    }
}
