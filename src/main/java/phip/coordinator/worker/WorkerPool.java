package phip.coordinator.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of worker threads draining a queue of job ids.
 * Call start() to spawn the workers, stop() to shut them all down.
 */
public final class WorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final JobRunner runner;
    private final int threads;
    private final Duration idleWait;
    private final BlockingQueue<String> queue = new LinkedBlockingQueue<>();

    private ExecutorService executor;
    private volatile boolean running;

    public WorkerPool(JobRunner runner, int threads, Duration idleWait) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be positive: " + threads);
        }
        this.runner = runner;
        this.threads = threads;
        this.idleWait = idleWait;
    }

    public void enqueue(String jobId) {
        queue.add(jobId);
    }

    public void enqueueAll(Collection<String> jobIds) {
        queue.addAll(jobIds);
    }

    public int queued() {
        return queue.size();
    }

    public synchronized void start() {
        if (running) {
            log.warn("Worker pool already running");
            return;
        }

        AtomicInteger counter = new AtomicInteger();
        executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "phip-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        running = true;

        for (int i = 0; i < threads; i++) {
            executor.submit(this::drain);
        }
        log.info("Worker pool started: {} threads", threads);
    }

    public synchronized void stop() {
        if (!running)
            return;

        running = false;
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        executor = null;
        log.info("Worker pool stopped ({} job ids left in queue)", queue.size());
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    private void drain() {
        String name = Thread.currentThread().getName();
        log.debug("{} started", name);

        while (running && !Thread.currentThread().isInterrupted()) {
            String jobId;
            try {
                jobId = queue.poll(idleWait.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (jobId == null) {
                continue;
            }

            try {
                RunOutcome outcome = runner.run(jobId);
                log.debug("{} finished job {} → {}", name, jobId, outcome);
            } catch (Exception e) {
                log.warn("{} error on job {}: {}", name, jobId, e.toString());
            } catch (Error e) {
                // The job is already FAILED; the thread keeps draining.
                log.error("{} fatal error on job {}", name, jobId, e);
            }
        }

        log.debug("{} stopped", name);
    }
}
