package tickwork.scheduler.store;

import tickwork.scheduler.model.MissedPolicy;
import tickwork.scheduler.model.Priority;
import tickwork.scheduler.model.ScheduleStatus;
import tickwork.scheduler.model.ScheduleType;
import tickwork.scheduler.model.ScheduledJob;
import tickwork.scheduler.repository.ScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of ScheduleRepository.
 * Updates are guarded by the version column.
 */
public class JdbcScheduleRepository implements ScheduleRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcScheduleRepository.class);

    private final Database db;

    public JdbcScheduleRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(ScheduledJob job) {
        String sql = """
                    INSERT INTO schedules (id, owner_id, name, description, job_type, job_config, schedule_type,
                                           scheduled_at, recurrence_rule, timezone, status, priority, priority_weight,
                                           next_run_at, last_run_at, run_count, max_runs, missed_policy,
                                           created_at, updated_at, version)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant now = Instant.now();
            ps.setString(1, job.id());
            ps.setString(2, job.ownerId());
            ps.setString(3, job.name());
            ps.setString(4, job.description());
            ps.setString(5, job.jobType());
            ps.setString(6, JsonColumns.writeConfig(job.jobConfig()));
            ps.setString(7, job.scheduleType().name());
            setTimestamp(ps, 8, job.scheduledAt());
            ps.setString(9, JsonColumns.writeRule(job.recurrenceRule()));
            ps.setString(10, job.timezone());
            ps.setString(11, job.status().name());
            ps.setString(12, job.priority().name());
            ps.setInt(13, job.priority().weight());
            setTimestamp(ps, 14, job.nextRunAt());
            setTimestamp(ps, 15, job.lastRunAt());
            ps.setInt(16, job.runCount());
            setIntOrNull(ps, 17, job.maxRuns());
            ps.setString(18, job.missedPolicy().name());
            setTimestamp(ps, 19, job.createdAt() != null ? job.createdAt() : now);
            setTimestamp(ps, 20, job.updatedAt() != null ? job.updatedAt() : now);
            ps.setLong(21, job.version());

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved schedule: {}", job.id());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save schedule: " + job.id(), e);
        }
    }

    @Override
    public Optional<ScheduledJob> findById(String jobId) {
        String sql = "SELECT * FROM schedules WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find schedule: " + jobId, e);
        }
    }

    @Override
    public List<ScheduledJob> findAll() {
        String sql = "SELECT * FROM schedules ORDER BY created_at DESC, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schedules", e);
        }
    }

    @Override
    public List<ScheduledJob> findByOwner(String ownerId) {
        String sql = "SELECT * FROM schedules WHERE owner_id = ? ORDER BY created_at DESC, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, ownerId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find schedules for owner: " + ownerId, e);
        }
    }

    @Override
    public List<ScheduledJob> findDue(Instant asOf, int limit) {
        String sql = """
                    SELECT * FROM schedules
                    WHERE status = 'ACTIVE' AND next_run_at IS NOT NULL AND next_run_at <= ?
                    ORDER BY priority_weight, next_run_at, id
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(asOf));
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find due schedules", e);
        }
    }

    @Override
    public boolean update(ScheduledJob job) {
        String sql = """
                    UPDATE schedules
                    SET name = ?, description = ?, job_type = ?, job_config = ?, schedule_type = ?,
                        scheduled_at = ?, recurrence_rule = ?, timezone = ?, status = ?, priority = ?,
                        priority_weight = ?, next_run_at = ?, last_run_at = ?, run_count = ?, max_runs = ?,
                        missed_policy = ?, updated_at = ?, version = version + 1
                    WHERE id = ? AND version = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, job.name());
            ps.setString(2, job.description());
            ps.setString(3, job.jobType());
            ps.setString(4, JsonColumns.writeConfig(job.jobConfig()));
            ps.setString(5, job.scheduleType().name());
            setTimestamp(ps, 6, job.scheduledAt());
            ps.setString(7, JsonColumns.writeRule(job.recurrenceRule()));
            ps.setString(8, job.timezone());
            ps.setString(9, job.status().name());
            ps.setString(10, job.priority().name());
            ps.setInt(11, job.priority().weight());
            setTimestamp(ps, 12, job.nextRunAt());
            setTimestamp(ps, 13, job.lastRunAt());
            ps.setInt(14, job.runCount());
            setIntOrNull(ps, 15, job.maxRuns());
            ps.setString(16, job.missedPolicy().name());
            setTimestamp(ps, 17, job.updatedAt() != null ? job.updatedAt() : Instant.now());
            ps.setString(18, job.id());
            ps.setLong(19, job.version());

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated == 0) {
                log.debug("Stale update rejected for schedule {} (version {})", job.id(), job.version());
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update schedule: " + job.id(), e);
        }
    }

    @Override
    public boolean delete(String jobId) {
        String sql = "DELETE FROM schedules WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete schedule: " + jobId, e);
        }
    }

    @Override
    public String generateId() {
        return "sched-" + UUID.randomUUID();
    }

    // --- Helpers ---

    private List<ScheduledJob> executeQuery(PreparedStatement ps) throws SQLException {
        List<ScheduledJob> jobs = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                jobs.add(mapRow(rs));
            }
        }
        return jobs;
    }

    private ScheduledJob mapRow(ResultSet rs) throws SQLException {
        return ScheduledJob.builder()
                .id(rs.getString("id"))
                .ownerId(rs.getString("owner_id"))
                .name(rs.getString("name"))
                .description(rs.getString("description"))
                .jobType(rs.getString("job_type"))
                .jobConfig(JsonColumns.readConfig(rs.getString("job_config")))
                .scheduleType(ScheduleType.valueOf(rs.getString("schedule_type")))
                .scheduledAt(toInstant(rs.getTimestamp("scheduled_at")))
                .recurrenceRule(JsonColumns.readRule(rs.getString("recurrence_rule")))
                .timezone(rs.getString("timezone"))
                .status(ScheduleStatus.valueOf(rs.getString("status")))
                .priority(Priority.valueOf(rs.getString("priority")))
                .nextRunAt(toInstant(rs.getTimestamp("next_run_at")))
                .lastRunAt(toInstant(rs.getTimestamp("last_run_at")))
                .runCount(rs.getInt("run_count"))
                .maxRuns(getIntOrNull(rs, "max_runs"))
                .missedPolicy(MissedPolicy.valueOf(rs.getString("missed_policy")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .version(rs.getLong("version"))
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

    private static void setIntOrNull(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value != null) {
            ps.setInt(index, value);
        } else {
            ps.setNull(index, Types.INTEGER);
        }
    }

    private static Integer getIntOrNull(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}
