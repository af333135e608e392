package phip.coordinator.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WorkerRefTest {

    @Test
    void tokenJoinsNodeAndTask() {
        WorkerRef ref = WorkerRef.of("node-a", "task-42");
        assertEquals("node-a:task-42", ref.token());
        assertEquals("node-a:task-42", ref.toString());
    }

    @Test
    void parseSplitsOnFirstSeparator() {
        WorkerRef ref = WorkerRef.parse("node-a:task:with:colons");
        assertEquals("node-a", ref.node());
        assertEquals("task:with:colons", ref.taskId());
    }

    @Test
    void rejectsMalformedTokens() {
        assertThrows(IllegalArgumentException.class, () -> WorkerRef.parse(null));
        assertThrows(IllegalArgumentException.class, () -> WorkerRef.parse("no-separator"));
        assertThrows(IllegalArgumentException.class, () -> WorkerRef.parse(":task"));
        assertThrows(IllegalArgumentException.class, () -> WorkerRef.parse("node:"));
    }

    @Test
    void rejectsBlankOrSeparatorInNode() {
        assertThrows(IllegalArgumentException.class, () -> WorkerRef.of(" ", "t"));
        assertThrows(IllegalArgumentException.class, () -> WorkerRef.of("n", ""));
        assertThrows(IllegalArgumentException.class, () -> WorkerRef.of("a:b", "t"));
    }
}
