package czm.timebox_be.session;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

public record SessionResponse(
        @JsonProperty("id") long id,
        @JsonProperty("work_item_id") long workItemId,
        @JsonProperty("work_item_name") String workItemName,
        @JsonProperty("start_time") OffsetDateTime startTime,
        @JsonProperty("end_time") OffsetDateTime endTime,
        @JsonProperty("duration_hours") BigDecimal durationHours,
        @JsonProperty("status") String status,
        @JsonProperty("priority") int priority,
        @JsonProperty("color") String color,
        @JsonProperty("external_event_id") String externalEventId) {

    static SessionResponse from(SessionDao.SessionRow row) {
        return new SessionResponse(row.id(), row.workItemId(), row.workItemName(), row.startTime(), row.endTime(),
                row.durationHours(), row.status().name(), row.priority(), row.color(), row.externalEventId());
    }
}
