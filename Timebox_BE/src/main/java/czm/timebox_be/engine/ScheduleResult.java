package czm.timebox_be.engine;

import java.util.List;

public record ScheduleResult(List<Assignment> assignments, List<UnscheduledRemainder> unscheduled) {

    public ScheduleResult {
        assignments = List.copyOf(assignments);
        unscheduled = List.copyOf(unscheduled);
    }

    public boolean isCapacityExhausted() {
        return !unscheduled.isEmpty();
    }
}
