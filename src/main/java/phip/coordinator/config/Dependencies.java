package phip.coordinator.config;

import io.prometheus.client.CollectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import phip.coordinator.metrics.CoordinatorMetrics;
import phip.coordinator.metrics.PrometheusCoordinatorMetrics;
import phip.coordinator.repository.JobRecordStore;
import phip.coordinator.scheduler.Scheduler;
import phip.coordinator.service.JobCoordinator;
import phip.coordinator.service.SimulationJobService;
import phip.coordinator.store.Database;
import phip.coordinator.store.JdbcJobRecordStore;
import phip.coordinator.worker.JobRunner;
import phip.coordinator.worker.UnitOfWork;
import phip.coordinator.worker.WorkerPool;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv(), new SeirModel());
 * deps.startScheduler(); // stuck-job reaper
 * deps.startWorkers();
 * deps.workerPool().enqueueAll(deps.jobService().pendingJobIds(100));
 * // ...
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final Clock clock;
    private final Database database;
    private final JobRecordStore jobStore;
    private final PrometheusCoordinatorMetrics metrics;
    private final JobCoordinator coordinator;
    private final SimulationJobService jobService;
    private final JobRunner jobRunner;
    private final WorkerPool workerPool;
    private final Scheduler scheduler;

    private Dependencies(CoordinatorConfig config, UnitOfWork unitOfWork, CollectorRegistry registry) {
        this.config = config;
        this.clock = Clock.systemUTC();

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.jobStore = new JdbcJobRecordStore(database, clock);
        this.metrics = new PrometheusCoordinatorMetrics(registry);

        // Services
        this.coordinator = new JobCoordinator(jobStore, metrics, clock);
        this.jobService = new SimulationJobService(jobStore, coordinator, clock);

        // Workers
        this.jobRunner = new JobRunner(coordinator, jobStore, unitOfWork, config.workerNode(),
                config.cancelPollInterval(), config.failurePolicy(), clock);
        this.workerPool = new WorkerPool(jobRunner, config.workerThreads(), config.workerIdleWait());

        this.scheduler = new Scheduler(jobStore, coordinator, metrics, config, clock);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config, registering metrics in a private registry.
     */
    public static Dependencies create(CoordinatorConfig config, UnitOfWork unitOfWork) {
        return new Dependencies(config, unitOfWork, new CollectorRegistry());
    }

    /**
     * Create dependencies registering metrics in the given registry
     * (typically {@link CollectorRegistry#defaultRegistry} for a scrape endpoint).
     */
    public static Dependencies create(CoordinatorConfig config, UnitOfWork unitOfWork, CollectorRegistry registry) {
        return new Dependencies(config, unitOfWork, registry);
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public JobRecordStore jobStore() {
        return jobStore;
    }

    public CoordinatorMetrics metrics() {
        return metrics;
    }

    public JobCoordinator coordinator() {
        return coordinator;
    }

    public SimulationJobService jobService() {
        return jobService;
    }

    public JobRunner jobRunner() {
        return jobRunner;
    }

    public WorkerPool workerPool() {
        return workerPool;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    /**
     * Start the stuck-job reaper.
     *
     * @throws IllegalStateException if the reaper deadline or interval is not configured
     */
    public void startScheduler() {
        scheduler.start();
    }

    public void startWorkers() {
        workerPool.start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        try {
            scheduler.stop();
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        try {
            workerPool.stop();
        } catch (Exception e) {
            log.warn("Error stopping worker pool: {}", e.getMessage());
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
