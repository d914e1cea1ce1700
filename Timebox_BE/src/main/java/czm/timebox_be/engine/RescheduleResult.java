package czm.timebox_be.engine;

import java.util.List;

/**
 * Output of {@link ConflictResolver#reschedule}. {@code unresolved} holds the conflicted
 * assignments for which no replacement window was found; they are not part of {@code assignments}.
 */
public record RescheduleResult(List<Assignment> assignments, List<Assignment> rescheduled, List<Assignment> unresolved) {

    public RescheduleResult {
        assignments = List.copyOf(assignments);
        rescheduled = List.copyOf(rescheduled);
        unresolved = List.copyOf(unresolved);
    }
}
