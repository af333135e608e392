package phip.coordinator.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import phip.coordinator.model.ClaimResult;
import phip.coordinator.model.ErrorInfo;
import phip.coordinator.model.JobRecord;
import phip.coordinator.model.JobStatus;
import phip.coordinator.model.TransitionResult;
import phip.coordinator.model.WorkerRef;
import phip.coordinator.repository.JobRecordStore;
import phip.coordinator.service.JobCoordinator;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * Runs one job end to end: claim, execute the unit of work, finalize.
 *
 * For every successful claim exactly one finalization path is taken: complete
 * on normal return, fail on any throwable (including errors), or nothing when
 * the job was cancelled while running. Finalization writes use the version
 * returned by the claim, so a job reaped or cancelled in the meantime is never
 * overwritten.
 */
public class JobRunner {

    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private final JobCoordinator coordinator;
    private final JobRecordStore store;
    private final UnitOfWork unitOfWork;
    private final String workerNode;
    private final Duration cancelPollInterval;
    private final FailurePolicy failurePolicy;
    private final Clock clock;

    public JobRunner(JobCoordinator coordinator, JobRecordStore store, UnitOfWork unitOfWork,
            String workerNode, Duration cancelPollInterval, FailurePolicy failurePolicy, Clock clock) {
        this.coordinator = coordinator;
        this.store = store;
        this.unitOfWork = unitOfWork;
        this.workerNode = workerNode;
        this.cancelPollInterval = cancelPollInterval;
        this.failurePolicy = failurePolicy;
        this.clock = clock;
    }

    /**
     * Claim and run a job.
     *
     * @return how the run ended; NOT_CLAIMED when another worker owns the job
     * @throws JobExecutionException or the failing unchecked exception itself when the
     *                               policy is RETHROW and the work failed
     */
    public RunOutcome run(String jobId) {
        WorkerRef workerRef = WorkerRef.of(workerNode, newTaskId());

        ClaimResult claim = coordinator.claim(jobId, workerRef.token());
        if (!claim.claimed()) {
            return RunOutcome.NOT_CLAIMED;
        }

        long version = claim.version();
        CancellationToken token = new CancellationToken(store, jobId, cancelPollInterval, clock);

        String result = null;
        Throwable failure = null;
        boolean cancelled = false;
        long startNanos = System.nanoTime();

        try {
            JobRecord job = store.load(jobId);
            log.info("Running job {} ({}) as {}", jobId, job.modelType(), workerRef);
            result = unitOfWork.execute(job, token);
        } catch (JobCancelledException e) {
            cancelled = true;
        } catch (Throwable t) {
            failure = t;
            if (t instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
        }

        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;

        RunOutcome outcome;
        if (cancelled) {
            outcome = acknowledgeCancellation(jobId, version, workerRef, token);
        } else if (failure == null) {
            outcome = recordSuccess(jobId, version, result, elapsedMs);
        } else {
            outcome = recordFailure(jobId, version, failure, workerRef);
        }

        if (failure != null) {
            rethrowIfRequired(jobId, failure);
        }
        return outcome;
    }

    private RunOutcome recordSuccess(String jobId, long version, String result, long elapsedMs) {
        TransitionResult res = coordinator.complete(jobId, version, result);
        if (res.isApplied()) {
            log.info("Job {} completed in {}ms", jobId, elapsedMs);
            return RunOutcome.COMPLETED;
        }
        return conflictOutcome(jobId, res, "result");
    }

    private RunOutcome recordFailure(String jobId, long version, Throwable failure, WorkerRef workerRef) {
        log.warn("Job {} failed: {}", jobId, failure.toString());
        TransitionResult res = coordinator.fail(jobId, version,
                ErrorInfo.fromThrowable(failure, workerRef.token()));
        if (res.isApplied()) {
            return RunOutcome.FAILED;
        }
        return conflictOutcome(jobId, res, "failure");
    }

    private RunOutcome acknowledgeCancellation(String jobId, long version, WorkerRef workerRef,
            CancellationToken token) {
        if (token.checkNow()) {
            log.info("Job {} cancelled while running, work abandoned", jobId);
            return RunOutcome.CANCELLED;
        }
        // The work gave up without a cancel on record: keep the job from hanging in RUNNING.
        log.warn("Job {} raised a cancellation that was never requested; recording failure", jobId);
        TransitionResult res = coordinator.fail(jobId, version, ErrorInfo.of(
                "unit of work cancelled without a cancel request",
                Map.of("workerRef", workerRef.token())));
        return res.isApplied() ? RunOutcome.FAILED : conflictOutcome(jobId, res, "failure");
    }

    private RunOutcome conflictOutcome(String jobId, TransitionResult res, String what) {
        if (res.status() == JobStatus.CANCELLED) {
            log.warn("Job {} was cancelled mid-flight, {} discarded", jobId, what);
            return RunOutcome.CANCELLED;
        }
        log.error("Job {} ownership lost before the {} could be recorded (now {} at version {})",
                jobId, what, res.status(), res.version());
        return RunOutcome.CONFLICT;
    }

    private void rethrowIfRequired(String jobId, Throwable failure) {
        if (failure instanceof Error error) {
            throw error;
        }
        if (failurePolicy != FailurePolicy.RETHROW) {
            return;
        }
        if (failure instanceof RuntimeException re) {
            throw re;
        }
        throw new JobExecutionException(jobId, failure);
    }

    private static String newTaskId() {
        return "task-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
