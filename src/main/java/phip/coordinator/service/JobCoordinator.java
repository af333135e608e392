package phip.coordinator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import phip.coordinator.metrics.CoordinatorMetrics;
import phip.coordinator.model.ClaimResult;
import phip.coordinator.model.ErrorInfo;
import phip.coordinator.model.InvalidTransitionException;
import phip.coordinator.model.JobMutation;
import phip.coordinator.model.JobNotFoundException;
import phip.coordinator.model.JobRecord;
import phip.coordinator.model.JobStateMachine;
import phip.coordinator.model.JobStatus;
import phip.coordinator.model.TransitionResult;
import phip.coordinator.model.UpdateResult;
import phip.coordinator.repository.JobRecordStore;

import java.time.Clock;
import java.util.EnumSet;
import java.util.Set;

/**
 * Optimistic-concurrency engine for the job lifecycle.
 *
 * Every operation follows the same shape: read the row, check the caller's
 * version, validate the transition, attempt exactly one conditional write and
 * map the outcome. Nothing here retries or waits; the store's compare-and-swap
 * is the only synchronization.
 */
public class JobCoordinator {

    private static final Logger log = LoggerFactory.getLogger(JobCoordinator.class);

    private static final Set<JobStatus> FROM_PENDING = EnumSet.of(JobStatus.PENDING);
    private static final Set<JobStatus> FROM_RUNNING = EnumSet.of(JobStatus.RUNNING);
    private static final Set<JobStatus> FROM_ACTIVE = EnumSet.of(JobStatus.PENDING, JobStatus.RUNNING);

    private final JobRecordStore store;
    private final CoordinatorMetrics metrics;
    private final Clock clock;

    public JobCoordinator(JobRecordStore store) {
        this(store, CoordinatorMetrics.NOOP, Clock.systemUTC());
    }

    public JobCoordinator(JobRecordStore store, CoordinatorMetrics metrics, Clock clock) {
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Try to become the sole owner of a PENDING job.
     *
     * @return claimed with the new version for exactly one caller; lost for every
     *         other caller and for jobs that are no longer PENDING
     * @throws JobNotFoundException if the job does not exist
     */
    public ClaimResult claim(String jobId, String workerRef) {
        requireId(jobId);
        if (workerRef == null || workerRef.isBlank()) {
            throw new IllegalArgumentException("workerRef is required");
        }

        JobRecord current = store.load(jobId);
        if (current.status() != JobStatus.PENDING) {
            log.debug("Claim of job {} by {} lost: status is {}", jobId, workerRef, current.status());
            metrics.claimLost(jobId);
            return ClaimResult.lost(jobId);
        }

        TransitionResult res = transition(current, current.version(), FROM_PENDING,
                JobMutation.claim(workerRef, clock.instant()));

        if (res.isConflict()) {
            log.debug("Claim of job {} by {} lost the race at version {}", jobId, workerRef, current.version());
            metrics.claimLost(jobId);
            return ClaimResult.lost(jobId);
        }

        log.info("Job {} claimed by {} (version {})", jobId, workerRef, res.version());
        return ClaimResult.claimed(jobId, res.version(), workerRef);
    }

    /**
     * Mark a RUNNING job as COMPLETED with its result.
     *
     * @param expectedVersion version returned by the claim
     * @param result          opaque JSON result; null is stored as the JSON literal {@code null}
     * @return applied, or conflict if the caller's view of ownership was stale
     */
    public TransitionResult complete(String jobId, long expectedVersion, String result) {
        requireId(jobId);
        return finish("complete", jobId, expectedVersion, FROM_RUNNING,
                JobMutation.complete(result, clock.instant()));
    }

    /**
     * Mark a RUNNING job as FAILED.
     *
     * @param expectedVersion version returned by the claim (or read by the reaper)
     */
    public TransitionResult fail(String jobId, long expectedVersion, ErrorInfo errorInfo) {
        requireId(jobId);
        if (errorInfo == null) {
            throw new IllegalArgumentException("errorInfo is required");
        }
        return finish("fail", jobId, expectedVersion, FROM_RUNNING,
                JobMutation.fail(errorInfo.toJson(), clock.instant()));
    }

    /**
     * Cancel a PENDING or RUNNING job. Running work is not interrupted; the
     * owning worker observes the cancellation cooperatively.
     */
    public TransitionResult cancel(String jobId, long expectedVersion, String reason) {
        requireId(jobId);
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason is required");
        }
        return finish("cancel", jobId, expectedVersion, FROM_ACTIVE,
                JobMutation.cancel(reason, clock.instant()));
    }

    private TransitionResult finish(String operation, String jobId, long expectedVersion,
            Set<JobStatus> fromSet, JobMutation mutation) {
        JobRecord current = store.load(jobId);
        TransitionResult res = transition(current, expectedVersion, fromSet, mutation);

        if (res.isConflict() && res.status() == JobStatus.CANCELLED) {
            log.warn("{} of job {} at version {} lost to a cancellation (now version {}); abandoning",
                    operation, jobId, expectedVersion, res.version());
            metrics.finalizedAfterCancel(jobId, operation);
        } else if (res.isConflict()) {
            log.error("CONCURRENCY CONFLICT: {} of job {} expected version {} but found version {} ({}); "
                    + "ownership was lost, abandoning", operation, jobId, expectedVersion, res.version(),
                    res.status());
            metrics.concurrencyConflict(jobId, operation);
        } else {
            log.info("Job {} {} -> {} (version {})", jobId, current.status(), res.status(), res.version());
        }
        return res;
    }

    /**
     * The single primitive behind every lifecycle operation: version check,
     * transition validation, one conditional write.
     */
    private TransitionResult transition(JobRecord current, long expectedVersion, Set<JobStatus> fromSet,
            JobMutation mutation) {
        String jobId = current.id();
        JobStatus toState = mutation.status();

        // A stale version is a lost race even when the row has since moved to a
        // status the requested transition could never start from.
        if (current.version() != expectedVersion) {
            return TransitionResult.conflict(jobId, current.version(), current.status());
        }

        if (!fromSet.contains(current.status())) {
            log.warn("Rejected transition of job {}: {} -> {}", jobId, current.status(), toState);
            throw new InvalidTransitionException(current.status(), toState);
        }
        JobStateMachine.validateTransition(current.status(), toState);

        UpdateResult update = store.conditionalUpdate(jobId, expectedVersion, mutation);
        if (!update.applied()) {
            JobRecord observed = store.find(jobId).orElse(null);
            return observed != null
                    ? TransitionResult.conflict(jobId, observed.version(), observed.status())
                    : TransitionResult.conflict(jobId, -1L, null);
        }

        metrics.transitionApplied(jobId, toState);
        return TransitionResult.applied(jobId, update.newVersion(), toState);
    }

    private static void requireId(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId is required");
        }
    }
}
