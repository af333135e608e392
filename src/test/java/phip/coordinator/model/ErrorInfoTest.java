package phip.coordinator.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ErrorInfoTest {

    @Test
    void messageOnlySerializesCompactly() {
        String json = ErrorInfo.of("solver diverged").toJson();
        assertEquals("{\"message\":\"solver diverged\"}", json);
    }

    @Test
    void fromThrowableCapturesTypeOwnerAndCause() {
        Exception error = new IllegalStateException("bad beta", new ArithmeticException("/ by zero"));

        ErrorInfo info = ErrorInfo.fromThrowable(error, "node-a:task-1");

        assertEquals("bad beta", info.message());
        assertEquals(IllegalStateException.class.getName(), info.type());
        assertEquals("node-a:task-1", info.details().get("workerRef"));
        assertTrue(String.valueOf(info.details().get("cause")).contains("/ by zero"));
    }

    @Test
    void fromThrowableWithoutMessageUsesClassName() {
        ErrorInfo info = ErrorInfo.fromThrowable(new OutOfMemoryError(), null);
        assertEquals("OutOfMemoryError", info.message());
        assertFalse(info.details().containsKey("workerRef"));
    }

    @Test
    void workerTimeoutCarriesReason() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("deadline", "PT2H");
        details.put("startedAt", Instant.parse("2026-01-01T10:00:00Z"));

        ErrorInfo info = ErrorInfo.workerTimeout(details);
        String json = info.toJson();

        assertEquals(ErrorInfo.WORKER_TIMEOUT, info.message());
        assertTrue(json.contains("\"reason\":\"worker timeout\""));
        assertTrue(json.contains("\"startedAt\":\"2026-01-01T10:00:00Z\""), json);
    }

    @Test
    void parsesStoredJson() {
        ErrorInfo info = ErrorInfo.fromJson(
                "{\"message\":\"worker timeout\",\"details\":{\"reason\":\"worker timeout\",\"deadline\":\"PT2H\"}}");

        assertEquals("worker timeout", info.message());
        assertNull(info.type());
        assertEquals("PT2H", info.details().get("deadline"));
    }

    @Test
    void rejectsInvalidJson() {
        assertThrows(IllegalArgumentException.class, () -> ErrorInfo.fromJson("not json"));
    }

    @Test
    void messageIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> ErrorInfo.of(" "));
    }
}
