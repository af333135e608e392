package phip.coordinator.model;

/**
 * Outcome of a single conditional update against the store.
 * {@code applied == false} means the expected version no longer matched and
 * nothing was written.
 */
public record UpdateResult(boolean applied, long newVersion) {

    private static final UpdateResult NOT_APPLIED = new UpdateResult(false, -1L);

    public static UpdateResult applied(long newVersion) {
        return new UpdateResult(true, newVersion);
    }

    public static UpdateResult notApplied() {
        return NOT_APPLIED;
    }
}
