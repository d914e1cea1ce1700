package czm.timebox_be.availability;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * DTO used for create/update of availability rules. Times use the {@code HH:MM} format.
 */
public record AvailabilityRuleRequest(
        @JsonProperty("name") String name,
        @JsonProperty("weekdays") List<Integer> weekdays,
        @JsonProperty("start_time") String startTime,
        @JsonProperty("end_time") String endTime,
        @JsonProperty("active") Boolean active,
        @JsonProperty("min_duration_minutes") Integer minDurationMinutes) {
}
