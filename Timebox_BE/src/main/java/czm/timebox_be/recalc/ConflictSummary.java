package czm.timebox_be.recalc;

import com.fasterxml.jackson.annotation.JsonProperty;
import czm.timebox_be.calendar.CalendarSyncResult;

import java.util.ArrayList;
import java.util.List;

public class ConflictSummary {
    /** Sessions newly relabelled as conflicted. */
    @JsonProperty("conflicted")
    public int conflicted;
    @JsonProperty("rescheduled")
    public int rescheduled;
    /** Ids of conflicted sessions for which no replacement slot was found. */
    @JsonProperty("unresolved")
    public final List<Long> unresolved = new ArrayList<>();
    /** Remote events replaced for the moved sessions. */
    @JsonProperty("calendar_events")
    public final RecalculationSummary.CalendarEvents calendarEvents = new RecalculationSummary.CalendarEvents();

    public ConflictSummary addConflicted(int n) { this.conflicted += n; return this; }
    public ConflictSummary addRescheduled(int n) { this.rescheduled += n; return this; }

    public ConflictSummary addCreated(CalendarSyncResult result) {
        calendarEvents.created += result.succeeded();
        calendarEvents.failed += result.failed();
        return this;
    }

    public ConflictSummary addDeleted(CalendarSyncResult result) {
        calendarEvents.deleted += result.succeeded();
        calendarEvents.deleteFailed += result.failed();
        return this;
    }
}
