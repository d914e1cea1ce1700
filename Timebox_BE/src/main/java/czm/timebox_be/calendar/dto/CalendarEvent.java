package czm.timebox_be.calendar.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CalendarEvent {
    public String id;
    public String status;
    public String summary;
    public String description;
    public EventDateTime start;
    public EventDateTime end;

    public boolean isCancelled() {
        return "cancelled".equalsIgnoreCase(status);
    }
}
