package czm.timebox_be.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Greedy allocation of work item hours onto slots in priority order.
 *
 * <p>Items are processed by ascending priority (ties keep input order), each one walks the slots
 * from the earliest and takes the first available ones until its hours are covered. A slot is
 * used by at most one assignment per pass, even if only part of it is taken.</p>
 */
public class PriorityScheduler {
    private static final Logger log = LoggerFactory.getLogger(PriorityScheduler.class);
    static final double MILLIS_PER_HOUR = 3_600_000d;
    static final double EPSILON = 1e-9;

    public static ScheduleResult schedule(List<WorkItem> items, List<TimeSlot> slots) {
        return schedule(items, slots, List.of());
    }

    /**
     * @param slots slots sorted by start; consumed and conflicting slots are marked unavailable
     * @param busy  busy intervals re-checked for every candidate window right before it is committed
     */
    public static ScheduleResult schedule(List<WorkItem> items, List<TimeSlot> slots, Collection<BusyInterval> busy) {
        List<Assignment> assignments = new ArrayList<>();
        List<UnscheduledRemainder> unscheduled = new ArrayList<>();
        if (items == null || items.isEmpty()) {
            return new ScheduleResult(assignments, unscheduled);
        }
        List<TimeSlot> candidates = slots == null ? List.of() : slots;
        List<WorkItem> ordered = items.stream()
                .filter(item -> !item.isCompleted())
                .sorted(Comparator.comparingInt(WorkItem::priority))
                .toList();

        for (WorkItem item : ordered) {
            double remaining = Math.max(0d, item.estimatedHours());
            String color = ItemColors.forWorkItem(item.id());
            for (int i = 0; i < candidates.size() && remaining > EPSILON; i++) {
                TimeSlot slot = candidates.get(i);
                if (!slot.isAvailable()) {
                    continue;
                }
                double take = Math.min(slot.getDurationHours(), remaining);
                Instant start = slot.getStart();
                Instant end = start.plusMillis(Math.round(take * MILLIS_PER_HOUR));
                if (ExternalConflictFilter.hasConflict(start, end, busy)) {
                    log.debug("Skipping slot {} - {} for item {}: busy", start, end, item.id());
                    slot.markUnavailable();
                    continue;
                }
                assignments.add(new Assignment(null, item.id(), item.name(), start, end, take,
                        AssignmentStatus.SCHEDULED, item.priority(), color));
                remaining -= take;
                slot.markUnavailable();
            }
            if (remaining > EPSILON) {
                log.info("Item {} ({}) has {}h left without capacity", item.id(), item.name(), remaining);
                unscheduled.add(new UnscheduledRemainder(item.id(), item.name(), remaining));
            }
        }
        return new ScheduleResult(assignments, unscheduled);
    }
}
