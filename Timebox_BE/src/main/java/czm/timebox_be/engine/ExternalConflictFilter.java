package czm.timebox_be.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Blocks slots that collide with busy intervals of the external calendar.
 *
 * <p>Two ranges overlap when {@code start1 < end2 && start2 < end1}; ranges that only touch
 * do not overlap. Busy intervals without both endpoints are ignored.</p>
 */
public class ExternalConflictFilter {
    private static final Logger log = LoggerFactory.getLogger(ExternalConflictFilter.class);

    /**
     * Marks every still available slot overlapping one of {@code busy} as unavailable.
     *
     * @return number of slots blocked by this call
     */
    public static int blockConflicting(List<TimeSlot> slots, Collection<BusyInterval> busy) {
        if (slots == null || slots.isEmpty() || busy == null || busy.isEmpty()) {
            return 0;
        }
        int blocked = 0;
        for (BusyInterval interval : busy) {
            if (!interval.isComplete()) {
                continue;
            }
            for (TimeSlot slot : slots) {
                if (slot.isAvailable() && overlaps(slot.getStart(), slot.getEnd(), interval.start(), interval.end())) {
                    log.debug("Blocking slot {} - {} (busy {} - {})", slot.getStart(), slot.getEnd(), interval.start(), interval.end());
                    slot.markUnavailable();
                    blocked++;
                }
            }
        }
        return blocked;
    }

    /**
     * Blocks every available slot overlapping the given window.
     */
    public static int blockWindow(List<TimeSlot> slots, Instant start, Instant end) {
        int blocked = 0;
        for (TimeSlot slot : slots) {
            if (slot.isAvailable() && overlaps(slot.getStart(), slot.getEnd(), start, end)) {
                slot.markUnavailable();
                blocked++;
            }
        }
        return blocked;
    }

    public static boolean hasConflict(Instant start, Instant end, Collection<BusyInterval> busy) {
        if (busy == null) {
            return false;
        }
        for (BusyInterval interval : busy) {
            if (interval.isComplete() && overlaps(start, end, interval.start(), interval.end())) {
                log.debug("Window {} - {} collides with busy {} - {}", start, end, interval.start(), interval.end());
                return true;
            }
        }
        return false;
    }

    public static boolean overlaps(Instant start1, Instant end1, Instant start2, Instant end2) {
        if (start1 == null || end1 == null || start2 == null || end2 == null) {
            return false;
        }
        return start1.isBefore(end2) && start2.isBefore(end1);
    }
}
