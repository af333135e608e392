package phip.coordinator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import phip.coordinator.config.CoordinatorConfig;
import phip.coordinator.metrics.CoordinatorMetrics;
import phip.coordinator.repository.JobRecordStore;
import phip.coordinator.service.JobCoordinator;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Drives the stuck-job reaper on a fixed interval.
 *
 * Uses a single-threaded executor so sweeps never overlap. A scheduler is
 * single-use: once stopped it cannot be started again.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final JobRecordStore store;
    private final JobCoordinator coordinator;
    private final CoordinatorMetrics metrics;
    private final CoordinatorConfig config;
    private final Clock clock;

    private volatile StuckJobReaper reaper;
    private volatile boolean running = false;

    public Scheduler(JobRecordStore store, JobCoordinator coordinator, CoordinatorMetrics metrics,
            CoordinatorConfig config, Clock clock) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "phip-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.store = store;
        this.coordinator = coordinator;
        this.metrics = metrics;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Start the scheduler.
     *
     * @throws IllegalStateException if the reaper deadline or interval is not
     *                               configured, or the scheduler was stopped
     */
    public synchronized void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }
        if (executor.isShutdown()) {
            throw new IllegalStateException("Scheduler was stopped and cannot be restarted");
        }

        config.requireReaperSettings();
        reaper = new StuckJobReaper(store, coordinator, metrics, config.reaperDeadline(), clock);

        long intervalMs = config.reaperInterval().toMillis();
        executor.scheduleAtFixedRate(
                reaper,
                intervalMs, // initial delay
                intervalMs,
                TimeUnit.MILLISECONDS);
        running = true;

        log.info("Stuck-job reaper scheduled every {}ms (deadline {})", intervalMs, config.reaperDeadline());
    }

    /**
     * Stop the scheduler gracefully.
     */
    public synchronized void stop() {
        if (!running) {
            executor.shutdownNow();
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Get the reaper for a manual sweep; null until {@link #start()} succeeded.
     */
    public StuckJobReaper reaper() {
        return reaper;
    }
}
