package czm.timebox_be.engine;

/**
 * Lifecycle of a work item as stored in the database.
 */
public enum WorkItemStatus {
    PENDING,
    SCHEDULED,
    COMPLETED;
}
