package czm.timebox_be.calendar;

/**
 * Outcome of one batch of provider calls.
 */
public record CalendarSyncResult(int succeeded, int failed) {

    public static CalendarSyncResult empty() {
        return new CalendarSyncResult(0, 0);
    }
}
