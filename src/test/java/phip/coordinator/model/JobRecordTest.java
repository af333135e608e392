package phip.coordinator.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JobRecordTest {

    @Test
    void buildMinimalJob() {
        JobRecord job = JobRecord.builder()
                .id("job-1")
                .modelType("seir")
                .build();

        assertEquals("job-1", job.id());
        assertEquals("seir", job.modelType());
        assertEquals(JobStatus.PENDING, job.status());
        assertEquals(JobRecord.INITIAL_VERSION, job.version());
        assertNull(job.workerRef());
        assertNull(job.startedAt());
        assertFalse(job.isTerminal());
        assertNull(job.executionTime());
    }

    @Test
    void idIsRequired() {
        assertThrows(NullPointerException.class, () -> JobRecord.builder().build());
    }

    @Test
    void negativeVersionRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> JobRecord.builder().id("j").version(-1).build());
    }

    @Test
    void executionTimeSpansClaimToFinish() {
        Instant started = Instant.parse("2026-01-01T10:00:00Z");
        JobRecord job = JobRecord.builder()
                .id("job-2")
                .status(JobStatus.COMPLETED)
                .version(3)
                .startedAt(started)
                .completedAt(started.plusSeconds(90))
                .build();

        assertTrue(job.isTerminal());
        assertEquals(Duration.ofSeconds(90), job.executionTime());
    }

    @Test
    void equalityIsIdAndVersion() {
        JobRecord a = JobRecord.builder().id("job-3").version(2).name("a").build();
        JobRecord b = JobRecord.builder().id("job-3").version(2).name("b").build();
        JobRecord c = JobRecord.builder().id("job-3").version(3).name("a").build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
    }

    @Test
    void toBuilderCopiesEveryField() {
        Instant now = Instant.now();
        JobRecord job = JobRecord.builder()
                .id("job-4")
                .name("Flu wave")
                .modelType("seir")
                .parameters("{\"beta\":0.3}")
                .status(JobStatus.FAILED)
                .version(3)
                .workerRef("node-a:task-1")
                .createdAt(now)
                .startedAt(now)
                .completedAt(now)
                .updatedAt(now)
                .errorInfo(ErrorInfo.of("boom").toJson())
                .build();

        JobRecord copy = job.toBuilder().build();

        assertEquals(job.name(), copy.name());
        assertEquals(job.parameters(), copy.parameters());
        assertEquals(job.workerRef(), copy.workerRef());
        assertEquals(job.errorInfo(), copy.errorInfo());
        assertEquals(job.completedAt(), copy.completedAt());
        assertEquals(job, copy);
    }

    @Test
    void claimMutationSetsOwnerAndStart() {
        Instant now = Instant.parse("2026-01-01T10:00:00Z");
        JobRecord pending = JobRecord.builder().id("job-5").build();

        JobRecord running = JobMutation.claim("node-a:task-1", now).applyTo(pending, 2, now);

        assertEquals(JobStatus.RUNNING, running.status());
        assertEquals(2, running.version());
        assertEquals("node-a:task-1", running.workerRef());
        assertEquals(now, running.startedAt());
        assertEquals(now, running.updatedAt());
        // Input untouched
        assertEquals(JobStatus.PENDING, pending.status());
        assertEquals(1, pending.version());
    }

    @Test
    void finishMutationsKeepClaimFields() {
        Instant start = Instant.parse("2026-01-01T10:00:00Z");
        Instant end = start.plusSeconds(5);
        JobRecord running = JobRecord.builder()
                .id("job-6")
                .status(JobStatus.RUNNING)
                .version(2)
                .workerRef("node-a:task-1")
                .startedAt(start)
                .build();

        JobRecord completed = JobMutation.complete("{\"r0\":1.4}", end).applyTo(running, 3, end);
        assertEquals(JobStatus.COMPLETED, completed.status());
        assertEquals("{\"r0\":1.4}", completed.result());
        assertEquals("node-a:task-1", completed.workerRef());
        assertEquals(Duration.ofSeconds(5), completed.executionTime());

        JobRecord cancelled = JobMutation.cancel("user request", end).applyTo(running, 3, end);
        assertEquals(JobStatus.CANCELLED, cancelled.status());
        assertEquals("user request", cancelled.cancelReason());
        assertNull(cancelled.result());
    }

    @Test
    void completeWithoutResultWritesJsonNull() {
        Instant now = Instant.now();
        assertEquals(JobMutation.EMPTY_RESULT, JobMutation.complete(null, now).columns().get("result"));
        assertEquals("null", JobMutation.EMPTY_RESULT);
    }

    @Test
    void mutationColumnsOnlyListWrittenFields() {
        Instant now = Instant.now();
        Map<String, Object> cols = JobMutation.fail("{\"message\":\"x\"}", now).columns();

        assertEquals("FAILED", cols.get("status"));
        assertEquals("{\"message\":\"x\"}", cols.get("error_info"));
        assertEquals(now, cols.get("completed_at"));
        assertFalse(cols.containsKey("worker_ref"));
        assertFalse(cols.containsKey("result"));
        assertFalse(cols.containsKey("version"));
    }
}
