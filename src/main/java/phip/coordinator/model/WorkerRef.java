package phip.coordinator.model;

/**
 * Claim token identifying the worker that owns a job: worker node name plus the
 * id of the task executing on that node. Persisted as {@code node:taskId}.
 */
public record WorkerRef(String node, String taskId) {

    private static final char SEPARATOR = ':';

    public WorkerRef {
        if (node == null || node.isBlank()) {
            throw new IllegalArgumentException("node is required");
        }
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
        if (node.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException("node must not contain '" + SEPARATOR + "': " + node);
        }
    }

    public static WorkerRef of(String node, String taskId) {
        return new WorkerRef(node, taskId);
    }

    /**
     * Parse a persisted token. Everything after the first separator is the task id.
     */
    public static WorkerRef parse(String token) {
        if (token == null) {
            throw new IllegalArgumentException("token is required");
        }
        int idx = token.indexOf(SEPARATOR);
        if (idx <= 0 || idx == token.length() - 1) {
            throw new IllegalArgumentException("Malformed worker ref: " + token);
        }
        return new WorkerRef(token.substring(0, idx), token.substring(idx + 1));
    }

    public String token() {
        return node + SEPARATOR + taskId;
    }

    @Override
    public String toString() {
        return token();
    }
}
