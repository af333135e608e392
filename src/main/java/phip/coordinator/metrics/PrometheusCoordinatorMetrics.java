package phip.coordinator.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import phip.coordinator.model.JobStatus;

import java.util.Locale;

/**
 * CoordinatorMetrics backed by Prometheus counters.
 */
public final class PrometheusCoordinatorMetrics implements CoordinatorMetrics {

    private final Counter claimsLost;
    private final Counter conflicts;
    private final Counter cancelledMidFlight;
    private final Counter transitions;
    private final Counter reaped;

    public PrometheusCoordinatorMetrics(CollectorRegistry registry) {
        this.claimsLost = Counter.build()
                .name("phip_job_claims_lost_total")
                .help("Claim attempts that lost the race to another worker")
                .register(registry);
        this.conflicts = Counter.build()
                .name("phip_job_conflicts_total")
                .help("Finalizing writes rejected because of a stale version")
                .labelNames("operation")
                .register(registry);
        this.cancelledMidFlight = Counter.build()
                .name("phip_job_finalized_after_cancel_total")
                .help("Finalizing writes rejected because the job had been cancelled")
                .labelNames("operation")
                .register(registry);
        this.transitions = Counter.build()
                .name("phip_job_transitions_total")
                .help("Successful job status transitions by target status")
                .labelNames("to")
                .register(registry);
        this.reaped = Counter.build()
                .name("phip_jobs_reaped_total")
                .help("Running jobs failed by the stuck-job reaper")
                .register(registry);
    }

    @Override
    public void claimLost(String jobId) {
        claimsLost.inc();
    }

    @Override
    public void concurrencyConflict(String jobId, String operation) {
        conflicts.labels(operation).inc();
    }

    @Override
    public void finalizedAfterCancel(String jobId, String operation) {
        cancelledMidFlight.labels(operation).inc();
    }

    @Override
    public void transitionApplied(String jobId, JobStatus to) {
        transitions.labels(to.name().toLowerCase(Locale.ROOT)).inc();
    }

    @Override
    public void jobReaped(String jobId) {
        reaped.inc();
    }

    public double claimsLost() {
        return claimsLost.get();
    }

    public double conflicts(String operation) {
        return conflicts.labels(operation).get();
    }

    public double finalizedAfterCancel(String operation) {
        return cancelledMidFlight.labels(operation).get();
    }

    public double transitions(JobStatus to) {
        return transitions.labels(to.name().toLowerCase(Locale.ROOT)).get();
    }

    public double reaped() {
        return reaped.get();
    }
}
