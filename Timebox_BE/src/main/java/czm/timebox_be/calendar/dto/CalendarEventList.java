package czm.timebox_be.calendar.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class CalendarEventList {
    public List<CalendarEvent> items;
    public String nextPageToken;
}
