package czm.timebox_be.workitem;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * DTO used for create/update work item requests. {@code status} is optional and only honoured on update.
 */
public record WorkItemRequest(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("estimated_hours") BigDecimal estimatedHours,
        @JsonProperty("status") String status) {
}
