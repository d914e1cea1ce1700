package czm.timebox_be.recalc;

import com.fasterxml.jackson.annotation.JsonProperty;
import czm.timebox_be.calendar.CalendarSyncResult;
import czm.timebox_be.engine.UnscheduledRemainder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public class RecalculationSummary {
    @JsonProperty("sessions_created")
    public int sessionsCreated;
    @JsonProperty("sessions_removed")
    public int sessionsRemoved;
    /** Number of external busy intervals taken into account. */
    @JsonProperty("conflicts_avoided")
    public int conflictsAvoided;
    @JsonProperty("calendar_events")
    public final CalendarEvents calendarEvents = new CalendarEvents();
    @JsonProperty("unscheduled")
    public final List<Unscheduled> unscheduled = new ArrayList<>();
    @JsonProperty("duration_ms")
    public long durationMs;

    public static class CalendarEvents {
        @JsonProperty("created")
        public int created;
        @JsonProperty("failed")
        public int failed;
        @JsonProperty("deleted")
        public int deleted;
        @JsonProperty("delete_failed")
        public int deleteFailed;
    }

    public record Unscheduled(
            @JsonProperty("work_item_id") long workItemId,
            @JsonProperty("work_item_name") String workItemName,
            @JsonProperty("remaining_hours") double remainingHours) {
    }

    public RecalculationSummary addSessionsCreated(int n) { this.sessionsCreated += n; return this; }
    public RecalculationSummary addSessionsRemoved(int n) { this.sessionsRemoved += n; return this; }
    public RecalculationSummary addConflictsAvoided(int n) { this.conflictsAvoided += n; return this; }

    public RecalculationSummary addCreated(CalendarSyncResult result) {
        calendarEvents.created += result.succeeded();
        calendarEvents.failed += result.failed();
        return this;
    }

    public RecalculationSummary addDeleted(CalendarSyncResult result) {
        calendarEvents.deleted += result.succeeded();
        calendarEvents.deleteFailed += result.failed();
        return this;
    }

    public RecalculationSummary addUnscheduled(Collection<UnscheduledRemainder> remainders) {
        if (remainders == null) {
            return this;
        }
        for (UnscheduledRemainder r : remainders) {
            unscheduled.add(new Unscheduled(r.workItemId(), r.workItemName(), r.remainingHours()));
        }
        return this;
    }
}
