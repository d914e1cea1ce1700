package czm.timebox_be.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Incremental recovery of assignments invalidated by newly discovered busy intervals.
 */
public class ConflictResolver {
    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    /**
     * Relabels every non-completed assignment overlapping one of {@code conflicts} as CONFLICTED.
     * Other assignments are returned unchanged, in the same order.
     */
    public static List<Assignment> resolveConflicts(List<Assignment> assignments, Collection<BusyInterval> conflicts) {
        List<Assignment> result = new ArrayList<>(assignments.size());
        for (Assignment assignment : assignments) {
            if (!assignment.isCompleted()
                    && ExternalConflictFilter.hasConflict(assignment.start(), assignment.end(), conflicts)) {
                result.add(assignment.withStatus(AssignmentStatus.CONFLICTED));
            } else {
                result.add(assignment);
            }
        }
        return result;
    }

    /**
     * Moves conflicted assignments into the earliest free slot that fits their original duration.
     *
     * <p>Slots are regenerated over {@code horizonDays}; slots overlapping a remaining assignment, a busy
     * interval or the original window of a conflicted assignment are blocked first. Conflicted
     * assignments are placed first-fit in their original order and consume the slot they land in.
     * When {@code items} is given, assignments of missing or completed items are not moved.
     * Assignments without a replacement are left out of {@link RescheduleResult#assignments()} and
     * reported in {@link RescheduleResult#unresolved()}.</p>
     */
    public static RescheduleResult reschedule(List<Assignment> assignments,
                                              Collection<WorkItem> items,
                                              List<AvailabilityRule> rules,
                                              Collection<BusyInterval> busy,
                                              Instant now,
                                              ZoneId zone,
                                              int horizonDays) {
        List<Assignment> conflicted = new ArrayList<>();
        List<Assignment> kept = new ArrayList<>();
        for (Assignment assignment : assignments) {
            if (assignment.isConflicted()) {
                conflicted.add(assignment);
            } else {
                kept.add(assignment);
            }
        }
        if (conflicted.isEmpty()) {
            return new RescheduleResult(assignments, List.of(), List.of());
        }

        List<TimeSlot> slots = AvailabilityModel.generateSlots(rules, horizonDays, now, zone);
        for (Assignment assignment : kept) {
            ExternalConflictFilter.blockWindow(slots, assignment.start(), assignment.end());
        }
        ExternalConflictFilter.blockConflicting(slots, busy);
        for (Assignment assignment : conflicted) {
            ExternalConflictFilter.blockWindow(slots, assignment.start(), assignment.end());
        }

        Map<Long, WorkItem> itemsById = new HashMap<>();
        if (items != null) {
            for (WorkItem item : items) {
                itemsById.put(item.id(), item);
            }
        }

        List<Assignment> output = new ArrayList<>(kept);
        List<Assignment> rescheduled = new ArrayList<>();
        List<Assignment> unresolved = new ArrayList<>();
        for (Assignment assignment : conflicted) {
            if (items != null) {
                WorkItem item = itemsById.get(assignment.workItemId());
                if (item == null || item.isCompleted()) {
                    log.info("Not rescheduling assignment {}: work item {} is gone or completed", assignment.id(), assignment.workItemId());
                    unresolved.add(assignment);
                    continue;
                }
            }
            // the stored window is exact, the stored duration is rounded
            Duration length = Duration.between(assignment.start(), assignment.end());
            TimeSlot slot = findFirstFit(slots, length.toMillis() / PriorityScheduler.MILLIS_PER_HOUR);
            if (slot == null) {
                log.warn("No replacement window for assignment {} ({} of item {})",
                        assignment.id(), length, assignment.workItemId());
                unresolved.add(assignment);
                continue;
            }
            Instant start = slot.getStart();
            Instant end = start.plus(length);
            Assignment replacement = assignment.movedTo(start, end);
            slot.markUnavailable();
            ExternalConflictFilter.blockWindow(slots, start, end);
            output.add(replacement);
            rescheduled.add(replacement);
        }
        output.sort(Comparator.comparing(Assignment::start));
        return new RescheduleResult(output, rescheduled, unresolved);
    }

    private static TimeSlot findFirstFit(List<TimeSlot> slots, double durationHours) {
        for (TimeSlot slot : slots) {
            if (slot.isAvailable() && slot.getDurationHours() + PriorityScheduler.EPSILON >= durationHours) {
                return slot;
            }
        }
        return null;
    }
}
