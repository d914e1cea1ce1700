package czm.timebox_be.calendar;

import czm.timebox_be.calendar.dto.CalendarEvent;
import czm.timebox_be.calendar.dto.EventDateTime;
import czm.timebox_be.config.CalendarProperties;
import czm.timebox_be.engine.BusyInterval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Turns remote calendar events into busy intervals for the scheduler.
 *
 * <p>Provider failures never stop scheduling: they are logged and an empty list is returned.</p>
 */
@Service
public class BusyIntervalService {
    private static final Logger log = LoggerFactory.getLogger(BusyIntervalService.class);

    private final CalendarClient client;
    private final CalendarProperties props;

    public BusyIntervalService(CalendarClient client, CalendarProperties props) {
        this.client = client;
        this.props = props;
    }

    /**
     * Busy intervals between {@code now} and {@code now + lookahead months}.
     *
     * @param ownEventIds remote ids of the sessions this application created; those events are not busy time
     */
    public List<BusyInterval> fetchBusy(Instant now, ZoneId zone, Collection<String> ownEventIds) {
        if (!props.isEnabled()) {
            return List.of();
        }
        Instant until = now.atZone(zone).plusMonths(props.getLookaheadMonths()).toInstant();
        List<CalendarEvent> events;
        try {
            events = client.listEvents(now, until);
        } catch (RestClientException ex) {
            log.warn("Fetching calendar events failed, scheduling without busy intervals: {}", ex.getMessage());
            return List.of();
        }

        List<BusyInterval> busy = new ArrayList<>();
        int skipped = 0;
        for (CalendarEvent event : events) {
            if (event.isCancelled() || (event.id != null && ownEventIds != null && ownEventIds.contains(event.id))) {
                skipped++;
                continue;
            }
            Instant start = toInstant(event.start, zone);
            Instant end = toInstant(event.end, zone);
            if (start == null || end == null) {
                skipped++;
                continue;
            }
            busy.add(new BusyInterval(start, end));
        }
        log.info("Fetched {} calendar events, {} busy intervals, {} skipped", events.size(), busy.size(), skipped);
        return busy;
    }

    static Instant toInstant(EventDateTime value, ZoneId zone) {
        if (value == null) {
            return null;
        }
        if (value.dateTime != null) {
            return value.dateTime.toInstant();
        }
        if (value.date != null) {
            // all-day events run from midnight to midnight in the user's zone
            ZonedDateTime startOfDay = value.date.atStartOfDay(zone);
            return startOfDay.toInstant();
        }
        return null;
    }
}
