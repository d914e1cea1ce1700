package czm.timebox_be.engine;

/**
 * State of a committed assignment.
 *
 * <p>SCHEDULED -> COMPLETED is a user action, SCHEDULED -> CONFLICTED is done by
 * {@link ConflictResolver#resolveConflicts}, CONFLICTED -> SCHEDULED by a successful reschedule.</p>
 */
public enum AssignmentStatus {
    SCHEDULED,
    COMPLETED,
    CONFLICTED;
}
