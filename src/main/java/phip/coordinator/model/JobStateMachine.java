package phip.coordinator.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Legal transitions of a simulation job.
 *
 * <pre>
 * PENDING -> RUNNING      worker claim
 * PENDING -> CANCELLED    cancel request before any claim
 * RUNNING -> COMPLETED    worker reports success
 * RUNNING -> FAILED       worker reports failure, or reaper timeout
 * RUNNING -> CANCELLED    cancel request honored mid-flight
 * </pre>
 *
 * Pure and stateless; never touches the store.
 */
public final class JobStateMachine {

    private static final Map<JobStatus, Set<JobStatus>> TRANSITIONS = new EnumMap<>(JobStatus.class);

    static {
        TRANSITIONS.put(JobStatus.PENDING, EnumSet.of(JobStatus.RUNNING, JobStatus.CANCELLED));
        TRANSITIONS.put(JobStatus.RUNNING,
                EnumSet.of(JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED));
        TRANSITIONS.put(JobStatus.COMPLETED, EnumSet.noneOf(JobStatus.class));
        TRANSITIONS.put(JobStatus.FAILED, EnumSet.noneOf(JobStatus.class));
        TRANSITIONS.put(JobStatus.CANCELLED, EnumSet.noneOf(JobStatus.class));
    }

    private JobStateMachine() {
    }

    /**
     * Check whether {@code current -> requested} is a legal transition.
     */
    public static boolean isLegal(JobStatus current, JobStatus requested) {
        if (current == null || requested == null) {
            return false;
        }
        return TRANSITIONS.get(current).contains(requested);
    }

    /**
     * Validate a transition request.
     *
     * @throws InvalidTransitionException if the pair is not in the transition table
     */
    public static void validateTransition(JobStatus current, JobStatus requested) {
        if (!isLegal(current, requested)) {
            throw new InvalidTransitionException(current, requested);
        }
    }

    /**
     * Statuses reachable in one step from {@code current}.
     */
    public static Set<JobStatus> targetsOf(JobStatus current) {
        return Collections.unmodifiableSet(TRANSITIONS.get(current));
    }
}
