package czm.timebox_be.engine;

import czm.timebox_be.config.SchedulingProperties;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class SchedulingEngineTest {

    private static final Instant NOW = Instant.parse("2025-06-02T08:00:00Z");
    private static final AvailabilityRule WEEKDAYS_9_TO_10 = new AvailabilityRule(1, "Mornings",
            Set.of(1, 2, 3, 4, 5), LocalTime.of(9, 0), LocalTime.of(10, 0), true, null);

    private final SchedulingProperties props = new SchedulingProperties();
    private final SchedulingEngine engine = new SchedulingEngine(props);

    @Test
    void generateScheduleBlocksBusyTimeAndAllocates() {
        BusyInterval busy = new BusyInterval(Instant.parse("2025-06-03T09:00:00Z"), Instant.parse("2025-06-03T10:00:00Z"));

        ScheduleResult result = engine.generateSchedule(
                List.of(new WorkItem(1, "Report", 3, 1, WorkItemStatus.PENDING)),
                List.of(WEEKDAYS_9_TO_10), List.of(busy), NOW, ZoneOffset.UTC);

        assertThat(result.assignments()).extracting(Assignment::start).containsExactly(
                Instant.parse("2025-06-02T09:00:00Z"),
                Instant.parse("2025-06-04T09:00:00Z"),
                Instant.parse("2025-06-05T09:00:00Z"));
    }

    @Test
    void horizonIsCappedBySafetyHorizon() {
        props.setSafetyHorizonDays(100);

        int days = engine.horizonDays(List.of(new WorkItem(1, "Huge", 10_000, 1, WorkItemStatus.PENDING)), List.of(WEEKDAYS_9_TO_10));

        assertThat(days).isEqualTo(100);
    }

    @Test
    void largeBacklogExtendsBeyondMinimumHorizon() {
        // 60h at 5h/week -> 12 weeks + 2
        int days = engine.horizonDays(List.of(new WorkItem(1, "Thesis", 60, 1, WorkItemStatus.PENDING)), List.of(WEEKDAYS_9_TO_10));

        assertThat(days).isEqualTo(98);
    }

    @Test
    void rescheduleUsesShortHorizon() {
        props.setRescheduleHorizonDays(3);
        Assignment conflicted = new Assignment(5L, 1, "Report",
                Instant.parse("2025-06-02T09:00:00Z"), Instant.parse("2025-06-02T10:00:00Z"),
                1.0, AssignmentStatus.CONFLICTED, 1, "#10B981");
        Assignment tuesday = new Assignment(6L, 1, "Report",
                Instant.parse("2025-06-03T09:00:00Z"), Instant.parse("2025-06-03T10:00:00Z"),
                1.0, AssignmentStatus.SCHEDULED, 1, "#10B981");
        Assignment wednesday = new Assignment(7L, 1, "Report",
                Instant.parse("2025-06-04T09:00:00Z"), Instant.parse("2025-06-04T10:00:00Z"),
                1.0, AssignmentStatus.SCHEDULED, 1, "#10B981");

        RescheduleResult result = engine.reschedule(List.of(conflicted, tuesday, wednesday),
                List.of(new WorkItem(1, "Report", 3, 1, WorkItemStatus.SCHEDULED)),
                List.of(WEEKDAYS_9_TO_10), List.of(), NOW, ZoneOffset.UTC);

        // Monday to Wednesday are all taken or known bad
        assertThat(result.unresolved()).extracting(Assignment::id).containsExactly(5L);
    }
}
