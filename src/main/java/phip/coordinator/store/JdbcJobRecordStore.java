package phip.coordinator.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import phip.coordinator.model.JobMutation;
import phip.coordinator.model.JobRecord;
import phip.coordinator.model.JobStatus;
import phip.coordinator.model.UpdateResult;
import phip.coordinator.repository.JobRecordStore;

import java.sql.*;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of JobRecordStore.
 * Uses optimistic locking: every mutation is one
 * {@code UPDATE ... WHERE id = ? AND version = ?} statement.
 */
public class JdbcJobRecordStore implements JobRecordStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRecordStore.class);

    private final Database db;
    private final Clock clock;

    public JdbcJobRecordStore(Database db) {
        this(db, Clock.systemUTC());
    }

    public JdbcJobRecordStore(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public void insert(JobRecord record) {
        if (record.status() != JobStatus.PENDING || record.version() != JobRecord.INITIAL_VERSION) {
            throw new IllegalArgumentException(
                    "New jobs must be PENDING at version 1: " + record);
        }

        String sql = """
                    INSERT INTO simulation_jobs (id, name, model_type, parameters, status, version,
                                                 created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant createdAt = record.createdAt() != null ? record.createdAt() : clock.instant();

            ps.setString(1, record.id());
            ps.setString(2, record.name());
            ps.setString(3, record.modelType());
            ps.setString(4, record.parameters());
            ps.setString(5, record.status().name());
            ps.setLong(6, record.version());
            setTimestamp(ps, 7, createdAt);
            setTimestamp(ps, 8, createdAt);

            ps.executeUpdate();
            conn.commit();

            log.debug("Inserted job {}", record.id());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert job: " + record.id(), e);
        }
    }

    @Override
    public Optional<JobRecord> find(String jobId) {
        String sql = "SELECT * FROM simulation_jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                Optional<JobRecord> found = rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
                conn.commit();
                return found;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public UpdateResult conditionalUpdate(String jobId, long expectedVersion, JobMutation mutation) {
        Map<String, Object> columns = mutation.columns();

        StringBuilder sql = new StringBuilder("UPDATE simulation_jobs SET ");
        for (String column : columns.keySet()) {
            sql.append(column).append(" = ?, ");
        }
        sql.append("version = version + 1, updated_at = ? WHERE id = ? AND version = ?");

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
                int idx = 1;
                for (Object value : columns.values()) {
                    setValue(ps, idx++, value);
                }
                setTimestamp(ps, idx++, clock.instant());
                ps.setString(idx++, jobId);
                ps.setLong(idx, expectedVersion);

                int updated = ps.executeUpdate();
                conn.commit();

                if (updated == 0) {
                    log.debug("Conditional update of job {} at version {} affected no rows", jobId,
                            expectedVersion);
                    return UpdateResult.notApplied();
                }
                if (updated != 1) {
                    throw new SQLException("Conditional update of job " + jobId + " affected " + updated
                            + " rows (expected 1)");
                }
                return UpdateResult.applied(expectedVersion + 1);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update job: " + jobId, e);
        }
    }

    @Override
    public List<JobRecord> findStuckRunning(Instant startedBefore) {
        String sql = """
                    SELECT * FROM simulation_jobs
                    WHERE status = 'RUNNING' AND started_at < ?
                    ORDER BY started_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(startedBefore));
            List<JobRecord> rows = executeQuery(ps);
            conn.commit();
            return rows;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find stuck jobs", e);
        }
    }

    @Override
    public List<JobRecord> findByStatus(JobStatus status, int limit) {
        String sql = "SELECT * FROM simulation_jobs WHERE status = ? ORDER BY created_at LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            ps.setInt(2, limit);
            List<JobRecord> rows = executeQuery(ps);
            conn.commit();
            return rows;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find jobs by status: " + status, e);
        }
    }

    @Override
    public List<JobRecord> findRecent(int limit) {
        String sql = """
                    SELECT * FROM simulation_jobs
                    ORDER BY COALESCE(updated_at, created_at) DESC
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            List<JobRecord> rows = executeQuery(ps);
            conn.commit();
            return rows;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find recent jobs", e);
        }
    }

    @Override
    public int countByStatus(JobStatus status) {
        String sql = "SELECT COUNT(*) FROM simulation_jobs WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                int count = rs.next() ? rs.getInt(1) : 0;
                conn.commit();
                return count;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count jobs", e);
        }
    }

    // Helper methods

    private List<JobRecord> executeQuery(PreparedStatement ps) throws SQLException {
        List<JobRecord> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private JobRecord mapRow(ResultSet rs) throws SQLException {
        return JobRecord.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .modelType(rs.getString("model_type"))
                .parameters(rs.getString("parameters"))
                .status(JobStatus.valueOf(rs.getString("status")))
                .version(rs.getLong("version"))
                .workerRef(rs.getString("worker_ref"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .result(rs.getString("result"))
                .errorInfo(rs.getString("error_info"))
                .cancelReason(rs.getString("cancel_reason"))
                .build();
    }

    private static void setValue(PreparedStatement ps, int index, Object value) throws SQLException {
        if (value instanceof Instant instant) {
            setTimestamp(ps, index, instant);
        } else if (value instanceof String s) {
            ps.setString(index, s);
        } else {
            throw new SQLException("Unsupported column value type: " + value.getClass().getName());
        }
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }
}
