package czm.timebox_be.session;

import czm.timebox_be.engine.Assignment;
import czm.timebox_be.engine.AssignmentStatus;
import org.springframework.dao.support.DataAccessUtils;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * JDBC access for persisted assignments ({@code scheduled_session}).
 */
@Repository
public class SessionDao {

    public record SessionRow(long id,
                             long workItemId,
                             String workItemName,
                             OffsetDateTime startTime,
                             OffsetDateTime endTime,
                             BigDecimal durationHours,
                             AssignmentStatus status,
                             int priority,
                             String color,
                             String externalEventId) {

        public Assignment toAssignment() {
            return new Assignment(id, workItemId, workItemName, startTime.toInstant(), endTime.toInstant(),
                    durationHours.doubleValue(), status, priority, color);
        }
    }

    private static final String SQL_SELECT_BASE =
            """
            SELECT id,
                   work_item_id,
                   work_item_name,
                   start_time,
                   end_time,
                   duration_hours,
                   status,
                   priority,
                   color,
                   external_event_id
            FROM scheduled_session
            """;

    private static final RowMapper<SessionRow> ROW_MAPPER = new RowMapper<>() {
        @Override
        public SessionRow mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new SessionRow(
                    rs.getLong("id"),
                    rs.getLong("work_item_id"),
                    rs.getString("work_item_name"),
                    rs.getObject("start_time", OffsetDateTime.class),
                    rs.getObject("end_time", OffsetDateTime.class),
                    rs.getBigDecimal("duration_hours"),
                    AssignmentStatus.valueOf(rs.getString("status")),
                    rs.getInt("priority"),
                    rs.getString("color"),
                    rs.getString("external_event_id"));
        }
    };

    private final JdbcTemplate jdbc;

    public SessionDao(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<SessionRow> listAll() {
        return jdbc.query(SQL_SELECT_BASE + " ORDER BY start_time ASC, id ASC", ROW_MAPPER);
    }

    public List<SessionRow> listNonCompleted() {
        return jdbc.query(SQL_SELECT_BASE + " WHERE status <> 'COMPLETED' ORDER BY start_time ASC, id ASC", ROW_MAPPER);
    }

    public List<SessionRow> listByWorkItem(long workItemId) {
        return jdbc.query(SQL_SELECT_BASE + " WHERE work_item_id = ? ORDER BY start_time ASC, id ASC", ROW_MAPPER, workItemId);
    }

    public Optional<SessionRow> findById(long id) {
        List<SessionRow> rows = jdbc.query(SQL_SELECT_BASE + " WHERE id = ?", ROW_MAPPER, id);
        return Optional.ofNullable(DataAccessUtils.singleResult(rows));
    }

    /**
     * Inserts a new assignment and returns the generated id.
     */
    public long insert(Assignment assignment) {
        Long id = jdbc.queryForObject("""
                INSERT INTO scheduled_session (work_item_id, work_item_name, start_time, end_time,
                                               duration_hours, status, priority, color)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                RETURNING id
                """, Long.class,
                assignment.workItemId(),
                assignment.workItemName(),
                toOffset(assignment.start()),
                toOffset(assignment.end()),
                BigDecimal.valueOf(assignment.durationHours()).setScale(4, RoundingMode.HALF_UP),
                assignment.status().name(),
                assignment.priority(),
                assignment.color());
        if (id == null) {
            throw new IllegalStateException("Insert into scheduled_session returned no id");
        }
        return id;
    }

    /**
     * Removes every assignment that is not completed. Completed sessions are history and stay.
     */
    public int deleteNonCompleted() {
        return jdbc.update("DELETE FROM scheduled_session WHERE status <> 'COMPLETED'");
    }

    public boolean updateStatus(long id, AssignmentStatus status) {
        return jdbc.update("UPDATE scheduled_session SET status = ? WHERE id = ?", status.name(), id) > 0;
    }

    /**
     * Moves a session to a new window. The remote event id is cleared because the old event no longer matches.
     */
    public boolean updateWindow(long id, Instant start, Instant end, AssignmentStatus status) {
        return jdbc.update("""
                UPDATE scheduled_session
                SET start_time        = ?,
                    end_time          = ?,
                    status            = ?,
                    external_event_id = NULL
                WHERE id = ?
                """, toOffset(start), toOffset(end), status.name(), id) > 0;
    }

    public boolean updateExternalEventId(long id, String externalEventId) {
        return jdbc.update("UPDATE scheduled_session SET external_event_id = ? WHERE id = ?", externalEventId, id) > 0;
    }

    private static OffsetDateTime toOffset(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
