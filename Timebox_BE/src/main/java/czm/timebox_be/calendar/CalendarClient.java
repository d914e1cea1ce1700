package czm.timebox_be.calendar;

import czm.timebox_be.calendar.dto.CalendarEvent;
import czm.timebox_be.calendar.dto.CalendarEventList;
import czm.timebox_be.config.CalendarProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * REST client for the calendar provider (Google Calendar v3 resource layout).
 */
@Component
public class CalendarClient {
    private static final Logger log = LoggerFactory.getLogger(CalendarClient.class);

    private final RestTemplate restTemplate;
    private final CalendarProperties props;

    public CalendarClient(RestTemplate calendarRestTemplate, CalendarProperties props) {
        this.restTemplate = calendarRestTemplate;
        this.props = props;
    }

    /**
     * Lists single (expanded) events in {@code [timeMin, timeMax)}, following {@code nextPageToken} until exhausted.
     */
    public List<CalendarEvent> listEvents(Instant timeMin, Instant timeMax) {
        List<CalendarEvent> events = new ArrayList<>();
        String pageToken = null;
        do {
            MultiValueMap<String, String> q = new LinkedMultiValueMap<>();
            q.add("timeMin", timeMin.toString());
            q.add("timeMax", timeMax.toString());
            q.add("singleEvents", "true");
            q.add("orderBy", "startTime");
            if (pageToken != null) q.add("pageToken", pageToken);

            URI uri = UriComponentsBuilder.fromHttpUrl(props.getApi())
                    .path("/calendars/{calendarId}/events")
                    .queryParams(q)
                    .encode()
                    .buildAndExpand(Map.of("calendarId", props.getCalendarId()))
                    .toUri();
            CalendarEventList page = withRetry("GET events", () -> restTemplate.getForObject(uri, CalendarEventList.class));
            if (page == null) {
                break;
            }
            if (page.items != null) {
                events.addAll(page.items);
            }
            pageToken = page.nextPageToken;
        } while (pageToken != null && !pageToken.isEmpty());
        return events;
    }

    public CalendarEvent createEvent(CalendarEvent event) {
        URI uri = eventsUri().toUri();
        return withRetry("POST event", () -> restTemplate.postForObject(uri, event, CalendarEvent.class));
    }

    /**
     * Deletes a remote event. Returns {@code false} when the provider reports it as already gone (404/410).
     */
    public boolean deleteEvent(String eventId) {
        URI uri = UriComponentsBuilder.fromHttpUrl(props.getApi())
                .path("/calendars/{calendarId}/events/{eventId}")
                .encode()
                .buildAndExpand(Map.of("calendarId", props.getCalendarId(), "eventId", eventId))
                .toUri();
        try {
            withRetry("DELETE event", () -> {
                restTemplate.delete(uri);
                return null;
            });
            return true;
        } catch (HttpStatusCodeException ex) {
            if (ex.getStatusCode().value() == HttpStatus.NOT_FOUND.value()
                    || ex.getStatusCode().value() == HttpStatus.GONE.value()) {
                log.debug("Calendar event {} already deleted", eventId);
                return false;
            }
            throw ex;
        }
    }

    private UriComponents eventsUri() {
        return UriComponentsBuilder.fromHttpUrl(props.getApi())
                .path("/calendars/{calendarId}/events")
                .encode()
                .buildAndExpand(Map.of("calendarId", props.getCalendarId()));
    }

    private <T> T withRetry(String operation, Supplier<T> call) {
        int attempt = 0;
        while (true) {
            try {
                return call.get();
            } catch (HttpStatusCodeException ex) {
                int status = ex.getStatusCode().value();
                if ((status == 429 || status >= 500) && attempt < props.getRetryMax()) {
                    attempt++;
                    long backoff = (long) props.getRetryBackoffMs() * attempt;
                    log.warn("Calendar {} returned {}. Retrying in {}ms (attempt {}/{})", operation, status, backoff, attempt, props.getRetryMax());
                    sleep(backoff);
                    continue;
                }
                if (status != 404 && status != 410) {
                    log.warn("Calendar error {} during {} body={}", status, operation, truncate(ex.getResponseBodyAsString(), 500));
                }
                throw ex;
            }
        }
    }

    private static String truncate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }

    private static void sleep(long ms) {
        try { Thread.sleep(ms); } catch (InterruptedException ignored) { Thread.currentThread().interrupt(); }
    }
}
