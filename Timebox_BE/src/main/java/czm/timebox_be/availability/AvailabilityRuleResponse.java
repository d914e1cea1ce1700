package czm.timebox_be.availability;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AvailabilityRuleResponse(
        @JsonProperty("id") long id,
        @JsonProperty("name") String name,
        @JsonProperty("weekdays") List<Integer> weekdays,
        @JsonProperty("start_time") String startTime,
        @JsonProperty("end_time") String endTime,
        @JsonProperty("active") boolean active,
        @JsonProperty("min_duration_minutes") Integer minDurationMinutes,
        @JsonProperty("weekly_hours") double weeklyHours) {
}
