package czm.timebox_be.workitem;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * New order of all work items, highest priority first.
 */
public record WorkItemReorderRequest(@JsonProperty("ids") List<Long> ids) {
}
