package phip.coordinator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import phip.coordinator.metrics.CoordinatorMetrics;
import phip.coordinator.model.ErrorInfo;
import phip.coordinator.model.JobRecord;
import phip.coordinator.model.TransitionResult;
import phip.coordinator.repository.JobRecordStore;
import phip.coordinator.service.JobCoordinator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Background task that recovers stuck RUNNING jobs.
 *
 * Jobs can get stuck if:
 * - A worker process dies while running a simulation
 * - The worker loses its database connection before finalizing
 * - A store failure aborts the finalization write
 *
 * The reaper finds jobs that started before {@code now - deadline} and fails
 * them with a "worker timeout" error, using the version it read. If the worker
 * finalizes first the reaper's write conflicts and the job is left alone.
 */
public class StuckJobReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StuckJobReaper.class);

    private final JobRecordStore store;
    private final JobCoordinator coordinator;
    private final CoordinatorMetrics metrics;
    private final Duration deadline;
    private final Clock clock;

    public StuckJobReaper(JobRecordStore store, JobCoordinator coordinator, CoordinatorMetrics metrics,
            Duration deadline, Clock clock) {
        if (deadline == null || deadline.isNegative() || deadline.isZero()) {
            throw new IllegalArgumentException("deadline must be positive: " + deadline);
        }
        this.store = store;
        this.coordinator = coordinator;
        this.metrics = metrics;
        this.deadline = deadline;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            reapStuckJobs();
        } catch (Exception e) {
            log.error("Stuck-job reaper error", e);
        }
    }

    /**
     * Find and fail stuck RUNNING jobs.
     *
     * @return number of jobs moved to FAILED by this sweep
     */
    public int reapStuckJobs() {
        Instant cutoff = clock.instant().minus(deadline);

        List<JobRecord> stuck = store.findStuckRunning(cutoff);

        if (stuck.isEmpty()) {
            log.debug("No stuck jobs found");
            return 0;
        }

        int reaped = 0;
        int lost = 0;

        for (JobRecord job : stuck) {
            try {
                TransitionResult res = coordinator.fail(job.id(), job.version(), timeoutError(job));
                if (res.isApplied()) {
                    reaped++;
                    metrics.jobReaped(job.id());
                    log.warn("Reaped job {} (started {}, owner {})", job.id(), job.startedAt(), job.workerRef());
                } else {
                    // The worker finalized between our read and our write.
                    lost++;
                    log.info("Job {} finalized by its worker before it could be reaped (now {})",
                            job.id(), res.status());
                }
            } catch (Exception e) {
                log.error("Failed to reap job {}", job.id(), e);
            }
        }

        log.info("Stuck-job reaper: {} reaped, {} already finalized, {} total stuck",
                reaped, lost, stuck.size());

        return reaped;
    }

    public Duration deadline() {
        return deadline;
    }

    private ErrorInfo timeoutError(JobRecord job) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("deadline", deadline.toString());
        details.put("startedAt", job.startedAt());
        if (job.workerRef() != null) {
            details.put("workerRef", job.workerRef());
        }
        return ErrorInfo.workerTimeout(details);
    }
}
