package czm.timebox_be.engine;

/**
 * Hours of a work item that did not fit into the horizon.
 */
public record UnscheduledRemainder(long workItemId, String workItemName, double remainingHours) {
}
