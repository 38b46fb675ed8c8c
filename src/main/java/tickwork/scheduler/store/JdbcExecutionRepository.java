package tickwork.scheduler.store;

import tickwork.scheduler.model.ExecutionStatus;
import tickwork.scheduler.model.ScheduleExecution;
import tickwork.scheduler.repository.ExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of ExecutionRepository.
 */
public class JdbcExecutionRepository implements ExecutionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcExecutionRepository.class);

    private final Database db;

    public JdbcExecutionRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(ScheduleExecution execution) {
        String sql = """
                    INSERT INTO schedule_executions (id, job_id, scheduled_for, started_at, completed_at, status,
                                                     manual, error_message, result_payload)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, execution.id());
            ps.setString(2, execution.jobId());
            ps.setTimestamp(3, Timestamp.from(execution.scheduledFor()));
            setTimestamp(ps, 4, execution.startedAt());
            setTimestamp(ps, 5, execution.completedAt());
            ps.setString(6, execution.status().name());
            ps.setBoolean(7, execution.manual());
            ps.setString(8, execution.errorMessage());
            ps.setString(9, execution.resultPayload());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save execution: " + execution.id(), e);
        }
    }

    @Override
    public Optional<ScheduleExecution> findById(String executionId) {
        String sql = "SELECT * FROM schedule_executions WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, executionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find execution: " + executionId, e);
        }
    }

    @Override
    public List<ScheduleExecution> findByJobId(String jobId, int limit) {
        String sql = """
                    SELECT * FROM schedule_executions
                    WHERE job_id = ?
                    ORDER BY scheduled_for DESC, started_at DESC
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find executions for job: " + jobId, e);
        }
    }

    @Override
    public boolean complete(String executionId, ExecutionStatus status, Instant completedAt, String errorMessage,
            String resultPayload) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }

        String sql = """
                    UPDATE schedule_executions
                    SET status = ?, completed_at = ?, error_message = ?, result_payload = ?
                    WHERE id = ? AND status IN ('PENDING', 'RUNNING')
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            setTimestamp(ps, 2, completedAt);
            ps.setString(3, errorMessage);
            ps.setString(4, resultPayload);
            ps.setString(5, executionId);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated == 0) {
                log.debug("Execution {} already terminal or missing, {} ignored", executionId, status);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to complete execution: " + executionId, e);
        }
    }

    @Override
    public List<ScheduleExecution> findStuckRunning(Instant startedBefore) {
        String sql = """
                    SELECT * FROM schedule_executions
                    WHERE status = 'RUNNING' AND started_at < ?
                    ORDER BY started_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(startedBefore));
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find stuck executions", e);
        }
    }

    @Override
    public int countByJobIdAndStatus(String jobId, ExecutionStatus status) {
        String sql = "SELECT COUNT(*) FROM schedule_executions WHERE job_id = ? AND status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ps.setString(2, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count executions for job: " + jobId, e);
        }
    }

    @Override
    public int deleteByJobId(String jobId) {
        String sql = "DELETE FROM schedule_executions WHERE job_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete executions for job: " + jobId, e);
        }
    }

    @Override
    public String generateId() {
        return "exec-" + UUID.randomUUID();
    }

    // --- Helpers ---

    private List<ScheduleExecution> executeQuery(PreparedStatement ps) throws SQLException {
        List<ScheduleExecution> executions = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                executions.add(mapRow(rs));
            }
        }
        return executions;
    }

    private ScheduleExecution mapRow(ResultSet rs) throws SQLException {
        return ScheduleExecution.builder()
                .id(rs.getString("id"))
                .jobId(rs.getString("job_id"))
                .scheduledFor(toInstant(rs.getTimestamp("scheduled_for")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .status(ExecutionStatus.valueOf(rs.getString("status")))
                .manual(rs.getBoolean("manual"))
                .errorMessage(rs.getString("error_message"))
                .resultPayload(rs.getString("result_payload"))
                .build();
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
