package czm.timebox_be.calendar.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDate;
import java.time.OffsetDateTime;

/**
 * Start or end of a remote event. Timed events carry {@code dateTime}, all-day events only {@code date}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EventDateTime {
    public OffsetDateTime dateTime;
    public LocalDate date;
    public String timeZone;

    public EventDateTime() {
    }

    public EventDateTime(OffsetDateTime dateTime, String timeZone) {
        this.dateTime = dateTime;
        this.timeZone = timeZone;
    }
}
