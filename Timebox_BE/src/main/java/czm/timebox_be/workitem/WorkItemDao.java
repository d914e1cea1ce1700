package czm.timebox_be.workitem;

import czm.timebox_be.engine.WorkItem;
import czm.timebox_be.engine.WorkItemStatus;
import org.springframework.dao.support.DataAccessUtils;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * JDBC access for the {@code work_item} table.
 */
@Repository
public class WorkItemDao {

    public record WorkItemRow(long id,
                              String name,
                              String description,
                              BigDecimal estimatedHours,
                              int priority,
                              WorkItemStatus status,
                              OffsetDateTime createdAt,
                              OffsetDateTime updatedAt) {

        public WorkItem toWorkItem() {
            return new WorkItem(id, name, estimatedHours.doubleValue(), priority, status);
        }
    }

    private static final String SQL_SELECT_BASE =
            """
            SELECT id,
                   name,
                   description,
                   estimated_hours,
                   priority,
                   status,
                   created_at,
                   updated_at
            FROM work_item
            """;

    private static final String SQL_RETURNING =
            " RETURNING id, name, description, estimated_hours, priority, status, created_at, updated_at";

    private static final RowMapper<WorkItemRow> ROW_MAPPER = new RowMapper<>() {
        @Override
        public WorkItemRow mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new WorkItemRow(
                    rs.getLong("id"),
                    rs.getString("name"),
                    rs.getString("description"),
                    rs.getBigDecimal("estimated_hours"),
                    rs.getInt("priority"),
                    WorkItemStatus.valueOf(rs.getString("status")),
                    rs.getObject("created_at", OffsetDateTime.class),
                    rs.getObject("updated_at", OffsetDateTime.class));
        }
    };

    private final JdbcTemplate jdbc;

    public WorkItemDao(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * All work items ordered by priority; equal priorities keep creation order.
     */
    public List<WorkItemRow> listAll() {
        return jdbc.query(SQL_SELECT_BASE + " ORDER BY priority ASC, id ASC", ROW_MAPPER);
    }

    public Optional<WorkItemRow> findById(long id) {
        List<WorkItemRow> rows = jdbc.query(SQL_SELECT_BASE + " WHERE id = ?", ROW_MAPPER, id);
        return Optional.ofNullable(DataAccessUtils.singleResult(rows));
    }

    public int maxPriority() {
        Integer max = jdbc.queryForObject("SELECT COALESCE(MAX(priority), 0) FROM work_item", Integer.class);
        return max == null ? 0 : max;
    }

    public WorkItemRow insert(String name, String description, BigDecimal estimatedHours, int priority, WorkItemStatus status) {
        return jdbc.queryForObject("""
                INSERT INTO work_item (name, description, estimated_hours, priority, status)
                VALUES (?, ?, ?, ?, ?)
                """ + SQL_RETURNING, ROW_MAPPER, name, description, estimatedHours, priority, status.name());
    }

    public Optional<WorkItemRow> update(long id, String name, String description, BigDecimal estimatedHours, WorkItemStatus status) {
        List<WorkItemRow> rows = jdbc.query("""
                UPDATE work_item
                SET name            = ?,
                    description     = ?,
                    estimated_hours = ?,
                    status          = ?,
                    updated_at      = now()
                WHERE id = ?
                """ + SQL_RETURNING, ROW_MAPPER, name, description, estimatedHours, status.name(), id);
        return Optional.ofNullable(DataAccessUtils.singleResult(rows));
    }

    public boolean updatePriority(long id, int priority) {
        return jdbc.update("UPDATE work_item SET priority = ?, updated_at = now() WHERE id = ?", priority, id) > 0;
    }

    public boolean updateStatus(long id, WorkItemStatus status) {
        return jdbc.update("UPDATE work_item SET status = ?, updated_at = now() WHERE id = ? AND status <> ?",
                status.name(), id, status.name()) > 0;
    }

    public int delete(long id) {
        return jdbc.update("DELETE FROM work_item WHERE id = ?", id);
    }
}
