package phip.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Failure payload stored on a FAILED job: a message plus optional structured
 * detail. Persisted as JSON in the {@code error_info} column.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorInfo(
        @JsonProperty("message") String message,
        @JsonProperty("type") String type,
        @JsonProperty("details") Map<String, Object> details) {

    public static final String WORKER_TIMEOUT = "worker timeout";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public ErrorInfo {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message is required");
        }
        details = details == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static ErrorInfo of(String message) {
        return new ErrorInfo(message, null, null);
    }

    public static ErrorInfo of(String message, Map<String, Object> details) {
        return new ErrorInfo(message, null, details);
    }

    /** Build from an exception thrown by a unit of work */
    public static ErrorInfo fromThrowable(Throwable error, String workerRef) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            message = error.getClass().getSimpleName();
        }
        Map<String, Object> details = new LinkedHashMap<>();
        if (workerRef != null) {
            details.put("workerRef", workerRef);
        }
        if (error.getCause() != null) {
            details.put("cause", String.valueOf(error.getCause()));
        }
        return new ErrorInfo(message, error.getClass().getName(), details);
    }

    /** Payload written by the stuck-job reaper */
    public static ErrorInfo workerTimeout(Map<String, Object> details) {
        Map<String, Object> merged = new LinkedHashMap<>();
        merged.put("reason", WORKER_TIMEOUT);
        if (details != null) {
            merged.putAll(details);
        }
        return new ErrorInfo(WORKER_TIMEOUT, null, merged);
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize error info", e);
        }
    }

    public static ErrorInfo fromJson(String json) {
        try {
            return MAPPER.readValue(json, ErrorInfo.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed error info: " + json, e);
        }
    }
}
