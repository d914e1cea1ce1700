package czm.timebox_be.workitem;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * Work item with its derived schedule window (first start and last end of its non-conflicted sessions).
 */
public record WorkItemResponse(
        @JsonProperty("id") long id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("estimated_hours") BigDecimal estimatedHours,
        @JsonProperty("priority") int priority,
        @JsonProperty("status") String status,
        @JsonProperty("color") String color,
        @JsonProperty("start_date") OffsetDateTime startDate,
        @JsonProperty("end_date") OffsetDateTime endDate,
        @JsonProperty("created_at") OffsetDateTime createdAt,
        @JsonProperty("updated_at") OffsetDateTime updatedAt) {
}
