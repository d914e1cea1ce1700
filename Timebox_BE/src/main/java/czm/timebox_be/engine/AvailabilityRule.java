package czm.timebox_be.engine;

import java.time.Duration;
import java.time.LocalTime;
import java.util.Objects;
import java.util.Set;

/**
 * Recurring weekly template of an open time-of-day window.
 *
 * @param weekdays           0 = Sunday .. 6 = Saturday
 * @param minDurationMinutes optional minimum length of a generated slot
 */
public record AvailabilityRule(
        long id,
        String name,
        Set<Integer> weekdays,
        LocalTime startTime,
        LocalTime endTime,
        boolean active,
        Integer minDurationMinutes) {

    public AvailabilityRule {
        Objects.requireNonNull(startTime, "startTime");
        Objects.requireNonNull(endTime, "endTime");
        weekdays = weekdays == null ? Set.of() : Set.copyOf(weekdays);
    }

    public boolean appliesTo(int weekday) {
        return active && weekdays.contains(weekday);
    }

    /**
     * Length of one occurrence in hours; zero for windows that do not end after they start.
     */
    public double occurrenceHours() {
        if (!endTime.isAfter(startTime)) {
            return 0d;
        }
        return Duration.between(startTime, endTime).toMinutes() / 60d;
    }
}
