package czm.timebox_be.engine;

import java.time.Instant;
import java.util.Objects;

/**
 * Committed mapping of part of a work item's hours onto a concrete window.
 *
 * @param id       database id, {@code null} for assignments not persisted yet
 * @param priority priority of the work item at creation time
 */
public record Assignment(
        Long id,
        long workItemId,
        String workItemName,
        Instant start,
        Instant end,
        double durationHours,
        AssignmentStatus status,
        int priority,
        String color) {

    public Assignment {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(status, "status");
    }

    public Assignment withId(Long newId) {
        return new Assignment(newId, workItemId, workItemName, start, end, durationHours, status, priority, color);
    }

    public Assignment withStatus(AssignmentStatus newStatus) {
        return new Assignment(id, workItemId, workItemName, start, end, durationHours, newStatus, priority, color);
    }

    public Assignment movedTo(Instant newStart, Instant newEnd) {
        return new Assignment(id, workItemId, workItemName, newStart, newEnd, durationHours,
                AssignmentStatus.SCHEDULED, priority, color);
    }

    public boolean isCompleted() {
        return status == AssignmentStatus.COMPLETED;
    }

    public boolean isConflicted() {
        return status == AssignmentStatus.CONFLICTED;
    }
}
