package czm.timebox_be.recalc;

import czm.timebox_be.availability.AvailabilityRuleDao;
import czm.timebox_be.calendar.BusyIntervalService;
import czm.timebox_be.calendar.CalendarSyncResult;
import czm.timebox_be.calendar.CalendarSyncService;
import czm.timebox_be.config.SchedulingProperties;
import czm.timebox_be.engine.Assignment;
import czm.timebox_be.engine.AssignmentStatus;
import czm.timebox_be.engine.AvailabilityRule;
import czm.timebox_be.engine.BusyInterval;
import czm.timebox_be.engine.SchedulingEngine;
import czm.timebox_be.engine.WorkItemStatus;
import czm.timebox_be.session.SessionDao;
import czm.timebox_be.session.SessionDao.SessionRow;
import czm.timebox_be.workitem.WorkItemDao;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConflictServiceTest {
    private static final Instant NOW = Instant.parse("2025-06-02T08:00:00Z");
    private static final BusyInterval TUESDAY_MEETING = new BusyInterval(
            Instant.parse("2025-06-03T09:00:00Z"), Instant.parse("2025-06-03T10:00:00Z"));

    @Mock
    private SessionDao sessionDao;
    @Mock
    private WorkItemDao workItemDao;
    @Mock
    private AvailabilityRuleDao ruleDao;
    @Mock
    private BusyIntervalService busyIntervalService;
    @Mock
    private CalendarSyncService calendarSyncService;
    @Mock
    private PlatformTransactionManager tm;

    private ConflictService service;

    @BeforeEach
    void setUp() {
        SchedulingProperties props = new SchedulingProperties();
        service = new ConflictService(sessionDao, workItemDao, ruleDao, busyIntervalService, calendarSyncService,
                new SchedulingEngine(props), props, new ScheduleLock(), Clock.fixed(NOW, ZoneOffset.UTC), tm);
    }

    private static SessionRow session(long id, String day, String eventId) {
        OffsetDateTime start = OffsetDateTime.parse(day + "T09:00:00Z");
        return new SessionRow(id, 1, "Report", start, start.plusHours(1), BigDecimal.ONE,
                AssignmentStatus.SCHEDULED, 1, "#10B981", eventId);
    }

    private void givenPlannedWeekAndMeeting() {
        when(sessionDao.listAll()).thenReturn(List.of(
                session(11, "2025-06-02", "e1"),
                session(12, "2025-06-03", "e2"),
                session(13, "2025-06-04", "e3")));
        when(busyIntervalService.fetchBusy(eq(NOW), eq(ZoneOffset.UTC), anyCollection())).thenReturn(List.of(TUESDAY_MEETING));
    }

    @Test
    void detectMarksOverlappingSessionOnly() {
        givenPlannedWeekAndMeeting();

        ConflictSummary summary = service.detect("UTC");

        assertThat(summary.conflicted).isEqualTo(1);
        assertThat(summary.unresolved).containsExactly(12L);
        verify(sessionDao).updateStatus(12L, AssignmentStatus.CONFLICTED);
        verify(sessionDao, never()).updateStatus(11L, AssignmentStatus.CONFLICTED);
        verify(sessionDao, never()).updateWindow(anyLong(), any(), any(), any());
    }

    @Test
    void rescheduleMovesConflictedSessionAndItsEvent() {
        givenPlannedWeekAndMeeting();
        when(workItemDao.listAll()).thenReturn(List.of(new WorkItemDao.WorkItemRow(1, "Report", null, new BigDecimal("3"),
                1, WorkItemStatus.SCHEDULED, OffsetDateTime.parse("2025-06-01T10:00:00Z"), OffsetDateTime.parse("2025-06-01T10:00:00Z"))));
        when(ruleDao.listActive()).thenReturn(List.of(new AvailabilityRule(1, "Mornings", Set.of(1, 2, 3, 4, 5),
                LocalTime.of(9, 0), LocalTime.of(10, 0), true, null)));

        when(calendarSyncService.deleteEvents(List.of("e2"))).thenReturn(new CalendarSyncResult(1, 0));
        when(calendarSyncService.createEvents(anyList(), eq(ZoneOffset.UTC))).thenReturn(new CalendarSyncResult(1, 0));

        ConflictSummary summary = service.reschedule("UTC");

        assertThat(summary.conflicted).isEqualTo(1);
        assertThat(summary.rescheduled).isEqualTo(1);
        assertThat(summary.unresolved).isEmpty();
        assertThat(summary.calendarEvents.created).isEqualTo(1);
        assertThat(summary.calendarEvents.deleted).isEqualTo(1);
        verify(sessionDao).updateWindow(12L, Instant.parse("2025-06-05T09:00:00Z"), Instant.parse("2025-06-05T10:00:00Z"),
                AssignmentStatus.SCHEDULED);
        verify(calendarSyncService).deleteEvents(List.of("e2"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Assignment>> moved = ArgumentCaptor.forClass(List.class);
        verify(calendarSyncService).createEvents(moved.capture(), eq(ZoneOffset.UTC));
        assertThat(moved.getValue()).singleElement().satisfies(a -> {
            assertThat(a.id()).isEqualTo(12L);
            assertThat(a.status()).isEqualTo(AssignmentStatus.SCHEDULED);
        });
    }

    @Test
    void nothingToDoWhenCalendarIsFree() {
        when(sessionDao.listAll()).thenReturn(List.of(session(11, "2025-06-02", "e1")));
        when(busyIntervalService.fetchBusy(any(), any(), anyCollection())).thenReturn(List.of());

        ConflictSummary summary = service.detect(null);

        assertThat(summary.conflicted).isZero();
        assertThat(summary.unresolved).isEmpty();
        verify(sessionDao, never()).updateStatus(anyLong(), any());
    }

    @Test
    void failedRemoteEventForMovedSessionIsCounted() {
        givenPlannedWeekAndMeeting();
        when(workItemDao.listAll()).thenReturn(List.of(new WorkItemDao.WorkItemRow(1, "Report", null, new BigDecimal("3"),
                1, WorkItemStatus.SCHEDULED, OffsetDateTime.parse("2025-06-01T10:00:00Z"), OffsetDateTime.parse("2025-06-01T10:00:00Z"))));
        when(ruleDao.listActive()).thenReturn(List.of(new AvailabilityRule(1, "Mornings", Set.of(1, 2, 3, 4, 5),
                LocalTime.of(9, 0), LocalTime.of(10, 0), true, null)));
        when(calendarSyncService.deleteEvents(List.of("e2"))).thenReturn(new CalendarSyncResult(0, 1));
        when(calendarSyncService.createEvents(anyList(), eq(ZoneOffset.UTC))).thenReturn(new CalendarSyncResult(0, 1));

        ConflictSummary summary = service.reschedule("UTC");

        assertThat(summary.rescheduled).isEqualTo(1);
        assertThat(summary.calendarEvents.created).isZero();
        assertThat(summary.calendarEvents.failed).isEqualTo(1);
        assertThat(summary.calendarEvents.deleted).isZero();
        assertThat(summary.calendarEvents.deleteFailed).isEqualTo(1);
    }
}
