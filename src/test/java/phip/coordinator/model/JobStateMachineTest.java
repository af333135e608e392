package phip.coordinator.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the job transition table.
 */
class JobStateMachineTest {

    @Test
    void legalTransitionsAreExactlyTheTable() {
        Set<String> legal = Set.of(
                "PENDING->RUNNING",
                "PENDING->CANCELLED",
                "RUNNING->COMPLETED",
                "RUNNING->FAILED",
                "RUNNING->CANCELLED");

        for (JobStatus from : JobStatus.values()) {
            for (JobStatus to : JobStatus.values()) {
                boolean expected = legal.contains(from + "->" + to);
                assertEquals(expected, JobStateMachine.isLegal(from, to), from + " -> " + to);
            }
        }
    }

    @ParameterizedTest
    @EnumSource(value = JobStatus.class, names = { "COMPLETED", "FAILED", "CANCELLED" })
    void terminalStatesHaveNoExits(JobStatus terminal) {
        assertTrue(terminal.isTerminal());
        assertTrue(JobStateMachine.targetsOf(terminal).isEmpty());
        for (JobStatus to : JobStatus.values()) {
            assertThrows(InvalidTransitionException.class,
                    () -> JobStateMachine.validateTransition(terminal, to));
        }
    }

    @Test
    void selfTransitionsAreIllegal() {
        for (JobStatus s : JobStatus.values()) {
            assertFalse(JobStateMachine.isLegal(s, s), s.name());
        }
    }

    @Test
    void validateTransitionReportsBothEnds() {
        InvalidTransitionException ex = assertThrows(InvalidTransitionException.class,
                () -> JobStateMachine.validateTransition(JobStatus.PENDING, JobStatus.COMPLETED));
        assertEquals(JobStatus.PENDING, ex.from());
        assertEquals(JobStatus.COMPLETED, ex.to());
    }

    @Test
    void nullsAreNeverLegal() {
        assertFalse(JobStateMachine.isLegal(null, JobStatus.RUNNING));
        assertFalse(JobStateMachine.isLegal(JobStatus.PENDING, null));
        assertThrows(InvalidTransitionException.class,
                () -> JobStateMachine.validateTransition(null, JobStatus.RUNNING));
    }

    @Test
    void targetsOfRunning() {
        assertEquals(EnumSet.of(JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED),
                JobStateMachine.targetsOf(JobStatus.RUNNING));
    }
}
