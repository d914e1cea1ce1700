package czm.timebox_be.calendar;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CalendarWebhookRequest(
        @JsonProperty("type") String type,
        @JsonProperty("resource_id") String resourceId,
        @JsonProperty("resource_uri") String resourceUri) {
}
