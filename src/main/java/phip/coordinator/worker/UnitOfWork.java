package phip.coordinator.worker;

import phip.coordinator.model.JobRecord;

/**
 * The simulation itself (SEIR integration, ML forecast, ...), invoked once per
 * claimed job.
 */
@FunctionalInterface
public interface UnitOfWork {

    /**
     * Run the simulation for a claimed job.
     * Long-running implementations should call
     * {@link CancellationToken#throwIfCancelled()} between steps.
     *
     * @param job          snapshot of the job taken right after the claim
     * @param cancellation cooperative cancellation signal
     * @return opaque JSON result; null is recorded as the JSON literal {@code null}
     * @throws JobCancelledException to acknowledge a cancellation
     * @throws Exception             any failure; recorded on the job as FAILED
     */
    String execute(JobRecord job, CancellationToken cancellation) throws Exception;
}
