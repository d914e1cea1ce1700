package czm.timebox_be.engine;

import java.util.Objects;

/**
 * Prioritized unit of work with a fixed hour budget. Priority 1 is the highest.
 */
public record WorkItem(long id, String name, double estimatedHours, int priority, WorkItemStatus status) {

    public WorkItem {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(status, "status");
    }

    public boolean isCompleted() {
        return status == WorkItemStatus.COMPLETED;
    }
}
