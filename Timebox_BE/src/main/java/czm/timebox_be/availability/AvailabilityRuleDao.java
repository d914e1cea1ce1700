package czm.timebox_be.availability;

import czm.timebox_be.engine.AvailabilityRule;
import org.springframework.dao.support.DataAccessUtils;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Time;
import java.time.LocalTime;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JDBC access for {@code availability_rule}. Weekdays are stored as a comma separated list, e.g. {@code "1,2,5"}.
 */
@Repository
public class AvailabilityRuleDao {

    private static final String SQL_SELECT_BASE =
            """
            SELECT id,
                   name,
                   weekdays,
                   start_time,
                   end_time,
                   active,
                   min_duration_minutes
            FROM availability_rule
            """;

    private static final RowMapper<AvailabilityRule> ROW_MAPPER = new RowMapper<>() {
        @Override
        public AvailabilityRule mapRow(ResultSet rs, int rowNum) throws SQLException {
            int minDuration = rs.getInt("min_duration_minutes");
            Integer minDurationMinutes = rs.wasNull() ? null : minDuration;
            return new AvailabilityRule(
                    rs.getLong("id"),
                    rs.getString("name"),
                    parseWeekdays(rs.getString("weekdays")),
                    rs.getObject("start_time", LocalTime.class),
                    rs.getObject("end_time", LocalTime.class),
                    rs.getBoolean("active"),
                    minDurationMinutes);
        }
    };

    private final JdbcTemplate jdbc;

    public AvailabilityRuleDao(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<AvailabilityRule> listAll() {
        return jdbc.query(SQL_SELECT_BASE + " ORDER BY id ASC", ROW_MAPPER);
    }

    public List<AvailabilityRule> listActive() {
        return jdbc.query(SQL_SELECT_BASE + " WHERE active = TRUE ORDER BY id ASC", ROW_MAPPER);
    }

    public Optional<AvailabilityRule> findById(long id) {
        List<AvailabilityRule> rows = jdbc.query(SQL_SELECT_BASE + " WHERE id = ?", ROW_MAPPER, id);
        return Optional.ofNullable(DataAccessUtils.singleResult(rows));
    }

    public long insert(AvailabilityRule rule) {
        Long id = jdbc.queryForObject("""
                INSERT INTO availability_rule (name, weekdays, start_time, end_time, active, min_duration_minutes)
                VALUES (?, ?, ?, ?, ?, ?)
                RETURNING id
                """, Long.class,
                rule.name(), formatWeekdays(rule.weekdays()), Time.valueOf(rule.startTime()), Time.valueOf(rule.endTime()),
                rule.active(), rule.minDurationMinutes());
        if (id == null) {
            throw new IllegalStateException("Insert into availability_rule returned no id");
        }
        return id;
    }

    public boolean update(AvailabilityRule rule) {
        return jdbc.update("""
                UPDATE availability_rule
                SET name                 = ?,
                    weekdays             = ?,
                    start_time           = ?,
                    end_time             = ?,
                    active               = ?,
                    min_duration_minutes = ?,
                    updated_at           = now()
                WHERE id = ?
                """,
                rule.name(), formatWeekdays(rule.weekdays()), Time.valueOf(rule.startTime()), Time.valueOf(rule.endTime()),
                rule.active(), rule.minDurationMinutes(), rule.id()) > 0;
    }

    public int delete(long id) {
        return jdbc.update("DELETE FROM availability_rule WHERE id = ?", id);
    }

    static Set<Integer> parseWeekdays(String value) {
        if (value == null || value.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(Integer::valueOf)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    static String formatWeekdays(Set<Integer> weekdays) {
        return weekdays.stream().sorted().map(String::valueOf).collect(Collectors.joining(","));
    }
}
