package czm.timebox_be.calendar;

import czm.timebox_be.calendar.dto.CalendarEvent;
import czm.timebox_be.calendar.dto.EventDateTime;
import czm.timebox_be.config.CalendarProperties;
import czm.timebox_be.engine.BusyInterval;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BusyIntervalServiceTest {
    private static final Instant NOW = Instant.parse("2025-06-02T08:00:00Z");

    @Mock
    private CalendarClient client;

    private final CalendarProperties props = new CalendarProperties();
    private BusyIntervalService service;

    @BeforeEach
    void setUp() {
        props.setEnabled(true);
        service = new BusyIntervalService(client, props);
    }

    private static CalendarEvent timed(String id, String start, String end) {
        CalendarEvent event = new CalendarEvent();
        event.id = id;
        event.start = new EventDateTime(OffsetDateTime.parse(start), "UTC");
        event.end = new EventDateTime(OffsetDateTime.parse(end), "UTC");
        return event;
    }

    @Test
    void disabledCalendarYieldsNoBusyTime() {
        props.setEnabled(false);

        assertThat(service.fetchBusy(NOW, ZoneOffset.UTC, Set.of())).isEmpty();
        verifyNoInteractions(client);
    }

    @Test
    void requestsThreeMonthWindow() {
        when(client.listEvents(NOW, Instant.parse("2025-09-02T08:00:00Z"))).thenReturn(List.of(
                timed("a", "2025-06-03T09:00:00Z", "2025-06-03T10:00:00Z")));

        List<BusyInterval> busy = service.fetchBusy(NOW, ZoneOffset.UTC, Set.of());

        assertThat(busy).containsExactly(new BusyInterval(
                Instant.parse("2025-06-03T09:00:00Z"), Instant.parse("2025-06-03T10:00:00Z")));
    }

    @Test
    void dropsIncompleteCancelledAndOwnEvents() {
        CalendarEvent noEnd = timed("b", "2025-06-03T09:00:00Z", "2025-06-03T10:00:00Z");
        noEnd.end = null;
        CalendarEvent cancelled = timed("c", "2025-06-04T09:00:00Z", "2025-06-04T10:00:00Z");
        cancelled.status = "cancelled";
        CalendarEvent own = timed("session-evt", "2025-06-05T09:00:00Z", "2025-06-05T10:00:00Z");
        CalendarEvent real = timed("d", "2025-06-06T09:00:00Z", "2025-06-06T10:00:00Z");
        when(client.listEvents(any(), any())).thenReturn(List.of(noEnd, cancelled, own, real));

        List<BusyInterval> busy = service.fetchBusy(NOW, ZoneOffset.UTC, Set.of("session-evt"));

        assertThat(busy).extracting(BusyInterval::start).containsExactly(Instant.parse("2025-06-06T09:00:00Z"));
    }

    @Test
    void allDayEventsSpanWholeLocalDays() {
        CalendarEvent holiday = new CalendarEvent();
        holiday.id = "h";
        holiday.start = new EventDateTime();
        holiday.start.date = LocalDate.of(2025, 6, 4);
        holiday.end = new EventDateTime();
        holiday.end.date = LocalDate.of(2025, 6, 5);
        when(client.listEvents(any(), any())).thenReturn(List.of(holiday));

        List<BusyInterval> busy = service.fetchBusy(NOW, ZoneId.of("Europe/Prague"), Set.of());

        assertThat(busy).containsExactly(new BusyInterval(
                Instant.parse("2025-06-03T22:00:00Z"), Instant.parse("2025-06-04T22:00:00Z")));
    }

    @Test
    void providerFailureDegradesToNoBusyTime() {
        when(client.listEvents(any(), any())).thenThrow(new ResourceAccessException("connect timed out"));

        assertThat(service.fetchBusy(NOW, ZoneOffset.UTC, Set.of())).isEmpty();
    }
}
