package phip.coordinator.config;

import phip.coordinator.worker.FailurePolicy;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration holder for coordinator settings.
 *
 * Reaper deadline and sweep interval have no default: they depend on how long
 * the deployed models run and must be supplied by the operator.
 */
public final class CoordinatorConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/phip;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Worker settings
    private String workerNode = "local";
    private int workerThreads = 4;
    private Duration workerIdleWait = Duration.ofMillis(500);
    private Duration cancelPollInterval = Duration.ofSeconds(5);
    private FailurePolicy failurePolicy = FailurePolicy.SWALLOW;

    // Reaper settings
    private Duration reaperDeadline;
    private Duration reaperInterval;

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    static CoordinatorConfig fromEnv(Map<String, String> env) {
        CoordinatorConfig config = new CoordinatorConfig();

        String dbUrl = env.get("PHIP_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String poolSize = env.get("PHIP_DB_POOL_SIZE");
        if (poolSize != null && !poolSize.isBlank()) {
            config.databasePoolSize = Integer.parseInt(poolSize.trim());
        }

        String node = env.get("PHIP_WORKER_NODE");
        if (node != null && !node.isBlank()) {
            config.workerNode = node.trim();
        } else {
            String host = env.get("HOSTNAME");
            if (host != null && !host.isBlank()) {
                config.workerNode = host.trim();
            }
        }

        String threads = env.get("PHIP_WORKER_THREADS");
        if (threads != null && !threads.isBlank()) {
            config.workerThreads = Integer.parseInt(threads.trim());
        }

        String deadline = env.get("PHIP_REAPER_DEADLINE");
        if (deadline != null && !deadline.isBlank()) {
            config.reaperDeadline = parseDuration("PHIP_REAPER_DEADLINE", deadline);
        }

        String interval = env.get("PHIP_REAPER_INTERVAL");
        if (interval != null && !interval.isBlank()) {
            config.reaperInterval = parseDuration("PHIP_REAPER_INTERVAL", interval);
        }

        String cancelPoll = env.get("PHIP_CANCEL_POLL_INTERVAL");
        if (cancelPoll != null && !cancelPoll.isBlank()) {
            config.cancelPollInterval = parseDuration("PHIP_CANCEL_POLL_INTERVAL", cancelPoll);
        }

        String policy = env.get("PHIP_FAILURE_POLICY");
        if (policy != null && !policy.isBlank()) {
            config.failurePolicy = FailurePolicy.valueOf(policy.trim().toUpperCase(Locale.ROOT));
        }

        return config;
    }

    /**
     * Accepts ISO-8601 ({@code PT2H}) or a plain number of seconds.
     */
    static Duration parseDuration(String name, String raw) {
        String value = raw.trim();
        try {
            if (value.chars().allMatch(Character::isDigit)) {
                return Duration.ofSeconds(Long.parseLong(value));
            }
            return Duration.parse(value.toUpperCase(Locale.ROOT));
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new IllegalArgumentException("Invalid duration for " + name + ": " + raw, e);
        }
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public String workerNode() {
        return workerNode;
    }

    public int workerThreads() {
        return workerThreads;
    }

    public Duration workerIdleWait() {
        return workerIdleWait;
    }

    public Duration cancelPollInterval() {
        return cancelPollInterval;
    }

    public FailurePolicy failurePolicy() {
        return failurePolicy;
    }

    public Duration reaperDeadline() {
        return reaperDeadline;
    }

    public Duration reaperInterval() {
        return reaperInterval;
    }

    public boolean hasReaperSettings() {
        return reaperDeadline != null && reaperInterval != null;
    }

    /**
     * @throws IllegalStateException if the reaper deadline or interval is missing or not positive
     */
    public void requireReaperSettings() {
        if (reaperDeadline == null || reaperInterval == null) {
            throw new IllegalStateException(
                    "Reaper deadline and interval must be configured (PHIP_REAPER_DEADLINE, PHIP_REAPER_INTERVAL)");
        }
        if (reaperDeadline.isNegative() || reaperDeadline.isZero()
                || reaperInterval.isNegative() || reaperInterval.isZero()) {
            throw new IllegalStateException("Reaper deadline and interval must be positive");
        }
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withDatabasePoolSize(int poolSize) {
        this.databasePoolSize = poolSize;
        return this;
    }

    public CoordinatorConfig withWorkerNode(String node) {
        this.workerNode = node;
        return this;
    }

    public CoordinatorConfig withWorkerThreads(int threads) {
        this.workerThreads = threads;
        return this;
    }

    public CoordinatorConfig withWorkerIdleWait(Duration idleWait) {
        this.workerIdleWait = idleWait;
        return this;
    }

    public CoordinatorConfig withCancelPollInterval(Duration interval) {
        this.cancelPollInterval = interval;
        return this;
    }

    public CoordinatorConfig withFailurePolicy(FailurePolicy policy) {
        this.failurePolicy = policy;
        return this;
    }

    public CoordinatorConfig withReaperDeadline(Duration deadline) {
        this.reaperDeadline = deadline;
        return this;
    }

    public CoordinatorConfig withReaperInterval(Duration interval) {
        this.reaperInterval = interval;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", workerNode='" + workerNode + '\'' +
                ", workerThreads=" + workerThreads +
                ", reaperDeadline=" + reaperDeadline +
                ", reaperInterval=" + reaperInterval +
                ", failurePolicy=" + failurePolicy +
                '}';
    }
}
