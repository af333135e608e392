package phip.coordinator.integration;

import org.junit.jupiter.api.*;
import phip.coordinator.api.v1.dto.JobStatusResponse;
import phip.coordinator.config.CoordinatorConfig;
import phip.coordinator.config.Dependencies;
import phip.coordinator.metrics.PrometheusCoordinatorMetrics;
import phip.coordinator.model.JobStatus;
import phip.coordinator.worker.CancellationToken;
import phip.coordinator.worker.RunOutcome;
import phip.coordinator.worker.UnitOfWork;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the full simulation lifecycle:
 * 1. Submit jobs
 * 2. Drain them through the worker pool
 * 3. Cancel a running job and check the worker honors it
 * 4. Verify status responses and metrics
 */
class FullFlowIntegrationTest {

    private Dependencies deps;

    // Runs "seir" jobs immediately; "slow" jobs spin until cancelled
    private static final UnitOfWork SIMULATION = (job, token) -> {
        if ("slow".equals(job.modelType())) {
            return spinUntilCancelled(token);
        }
        return "{\"model\":\"" + job.modelType() + "\",\"peakInfected\":1234}";
    };

    private static String spinUntilCancelled(CancellationToken token) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            token.throwIfCancelled();
            Thread.sleep(10);
        }
        return "{\"finished\":true}";
    }

    @BeforeEach
    void setUp() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-flow-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withWorkerNode("it-node")
                .withWorkerThreads(3)
                .withWorkerIdleWait(Duration.ofMillis(20))
                .withCancelPollInterval(Duration.ofMillis(10))
                .withReaperDeadline(Duration.ofHours(2))
                .withReaperInterval(Duration.ofMinutes(1));
        deps = Dependencies.create(config, SIMULATION);
    }

    @AfterEach
    void tearDown() {
        if (deps != null) {
            deps.close();
        }
    }

    @Test
    @DisplayName("Submitted jobs are each completed exactly once by the pool")
    void submittedJobsComplete() throws Exception {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            ids.add(deps.jobService().submit("run " + i, "seir", "{\"r0\":2.5}"));
        }
        assertEquals(6, deps.jobService().countByStatus(JobStatus.PENDING));

        deps.startScheduler();
        deps.startWorkers();
        deps.workerPool().enqueueAll(deps.jobService().pendingJobIds(100));

        waitFor(() -> deps.jobService().countByStatus(JobStatus.COMPLETED) == ids.size());

        for (String id : ids) {
            JobStatusResponse status = deps.jobService().getStatus(id);
            assertEquals("COMPLETED", status.status());
            assertEquals(3, status.version());
            assertTrue(status.workerRef().startsWith("it-node:"));
            assertNotNull(status.executionTimeMs());
            assertTrue(status.result().contains("peakInfected"));
        }

        PrometheusCoordinatorMetrics metrics = (PrometheusCoordinatorMetrics) deps.metrics();
        assertEquals(6.0, metrics.transitions(JobStatus.RUNNING));
        assertEquals(6.0, metrics.transitions(JobStatus.COMPLETED));
        assertEquals(0.0, metrics.conflicts("complete"));
    }

    @Test
    @DisplayName("Cancelling a running job stops its worker cooperatively")
    void cancelRunningJob() throws Exception {
        String id = deps.jobService().submit("long run", "slow", null);

        deps.startWorkers();
        deps.workerPool().enqueue(id);
        waitFor(() -> deps.jobService().getStatus(id).status().equals("RUNNING"));

        assertTrue(deps.jobService().requestCancel(id, "operator abort").isApplied());

        JobStatusResponse status = deps.jobService().getStatus(id);
        assertEquals("CANCELLED", status.status());
        assertEquals("operator abort", status.cancelReason());
        assertEquals(3, status.version());
    }

    @Test
    @DisplayName("A job already owned by another runner is not re-run")
    void directRunOfClaimedJob() {
        String id = deps.jobService().submit(null, "seir", null);
        deps.coordinator().claim(id, "other-node:task-1");

        assertEquals(RunOutcome.NOT_CLAIMED, deps.jobRunner().run(id));
        assertEquals("other-node:task-1", deps.jobService().getStatus(id).workerRef());
    }

    private static void waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("condition not reached within 10s");
            }
            Thread.sleep(20);
        }
    }
}
