package czm.timebox_be.engine;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Materialises recurring weekly availability rules into dated slots.
 *
 * <p>Rule times are local clock times in the caller supplied zone. They are converted to
 * instants straight away and all ordering is done on instants.</p>
 */
public class AvailabilityModel {
    static final int ROUNDING_MINUTES = 15;

    /**
     * Generates slots for {@code horizonDays} calendar days starting with the day of {@code now}.
     *
     * <p>Slots ending at or before {@code now} are dropped, a slot straddling {@code now} starts at
     * {@code now} rounded up to the next quarter hour. The result is sorted by start; slots with
     * the same start keep the order of {@code rules}.</p>
     */
    public static List<TimeSlot> generateSlots(List<AvailabilityRule> rules, int horizonDays, Instant now, ZoneId zone) {
        List<TimeSlot> slots = new ArrayList<>();
        if (rules == null || rules.isEmpty() || horizonDays <= 0) {
            return slots;
        }
        LocalDate today = LocalDate.ofInstant(now, zone);
        for (int i = 0; i < horizonDays; i++) {
            LocalDate day = today.plusDays(i);
            int weekday = weekdayIndex(day.getDayOfWeek());
            for (AvailabilityRule rule : rules) {
                if (!rule.appliesTo(weekday) || !rule.endTime().isAfter(rule.startTime())) {
                    continue;
                }
                Instant start = day.atTime(rule.startTime()).atZone(zone).toInstant();
                Instant end = day.atTime(rule.endTime()).atZone(zone).toInstant();
                if (!end.isAfter(now)) {
                    continue;
                }
                if (start.isBefore(now)) {
                    start = roundUpToQuarterHour(now, zone);
                }
                if (!start.isBefore(end)) {
                    continue;
                }
                Integer minMinutes = rule.minDurationMinutes();
                if (minMinutes != null && Duration.between(start, end).toMinutes() < minMinutes) {
                    continue;
                }
                slots.add(new TimeSlot(start, end));
            }
        }
        // List.sort is stable, equal starts keep rule order
        slots.sort(Comparator.comparing(TimeSlot::getStart));
        return slots;
    }

    /**
     * Sum over active rules of occurrence length times the number of weekdays it covers.
     */
    public static double averageWeeklyHours(Collection<AvailabilityRule> rules) {
        double total = 0d;
        if (rules == null) {
            return total;
        }
        for (AvailabilityRule rule : rules) {
            if (rule.active()) {
                total += rule.occurrenceHours() * rule.weekdays().size();
            }
        }
        return total;
    }

    /**
     * Number of days to generate so that the outstanding hours of all open items fit.
     *
     * <p>weeks = max(minWeeks, ceil(outstanding / max(average, 1)) + marginWeeks), capped at
     * {@code maxDays}. An availability of zero therefore gives an oversized horizon that the cap bounds.</p>
     */
    public static int horizonDays(Collection<WorkItem> items, Collection<AvailabilityRule> rules,
                                  int minWeeks, int marginWeeks, int maxDays) {
        double outstanding = 0d;
        if (items != null) {
            for (WorkItem item : items) {
                if (!item.isCompleted() && item.estimatedHours() > 0) {
                    outstanding += item.estimatedHours();
                }
            }
        }
        double perWeek = Math.max(averageWeeklyHours(rules), 1d);
        long weeks = Math.max(minWeeks, (long) Math.ceil(outstanding / perWeek) + marginWeeks);
        return (int) Math.min(weeks * 7, maxDays);
    }

    /**
     * 0 = Sunday .. 6 = Saturday.
     */
    public static int weekdayIndex(DayOfWeek dayOfWeek) {
        return dayOfWeek.getValue() % 7;
    }

    static Instant roundUpToQuarterHour(Instant instant, ZoneId zone) {
        ZonedDateTime local = instant.atZone(zone);
        ZonedDateTime floor = local.truncatedTo(ChronoUnit.HOURS)
                .plusMinutes((long) (local.getMinute() / ROUNDING_MINUTES) * ROUNDING_MINUTES);
        Instant rounded = floor.toInstant();
        if (rounded.isBefore(instant)) {
            rounded = floor.plusMinutes(ROUNDING_MINUTES).toInstant();
        }
        return rounded;
    }
}
