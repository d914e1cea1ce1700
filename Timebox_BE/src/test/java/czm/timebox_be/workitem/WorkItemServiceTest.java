package czm.timebox_be.workitem;

import czm.timebox_be.calendar.CalendarSyncService;
import czm.timebox_be.engine.AssignmentStatus;
import czm.timebox_be.engine.WorkItemStatus;
import czm.timebox_be.recalc.RecalculationTrigger;
import czm.timebox_be.session.SessionDao;
import czm.timebox_be.session.SessionService;
import czm.timebox_be.web.ApiException;
import czm.timebox_be.workitem.WorkItemDao.WorkItemRow;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkItemServiceTest {
    @Mock
    private WorkItemDao dao;
    @Mock
    private SessionDao sessionDao;
    @Mock
    private SessionService sessionService;
    @Mock
    private CalendarSyncService calendarSyncService;
    @Mock
    private RecalculationTrigger trigger;

    @InjectMocks
    private WorkItemService service;

    private static WorkItemRow row(long id, String name, String hours, int priority, WorkItemStatus status) {
        OffsetDateTime ts = OffsetDateTime.parse("2025-06-01T10:00:00Z");
        return new WorkItemRow(id, name, null, new BigDecimal(hours), priority, status, ts, ts);
    }

    @Test
    void createAppendsToEndOfQueueAndRequestsRecalculation() {
        when(dao.maxPriority()).thenReturn(4);
        when(dao.insert("Thesis", "Chapter 2", new BigDecimal("12.5"), 5, WorkItemStatus.PENDING))
                .thenReturn(row(9, "Thesis", "12.5", 5, WorkItemStatus.PENDING));

        WorkItemResponse response = service.create(new WorkItemRequest("  Thesis ", " Chapter 2 ", new BigDecimal("12.5"), null));

        assertEquals(9L, response.id());
        assertEquals(5, response.priority());
        assertEquals("PENDING", response.status());
        assertThat(response.startDate()).isNull();
        verify(trigger).requestRecalculation(anyString());
    }

    @Test
    void createRejectsNegativeHours() {
        ApiException ex = assertThrows(ApiException.class,
                () -> service.create(new WorkItemRequest("Thesis", null, new BigDecimal("-1"), null)));

        assertEquals("VALIDATION", ex.getCode());
        assertEquals("estimated_hours_negative", ex.getDetails());
        verify(dao, never()).insert(any(), any(), any(), anyInt(), any());
        verify(trigger, never()).requestRecalculation(anyString());
    }

    @Test
    void createRejectsBlankName() {
        ApiException ex = assertThrows(ApiException.class,
                () -> service.create(new WorkItemRequest("   ", null, BigDecimal.ONE, null)));

        assertEquals("VALIDATION", ex.getCode());
    }

    @Test
    void updateRejectsUnknownStatus() {
        when(dao.findById(3L)).thenReturn(Optional.of(row(3, "A", "2", 1, WorkItemStatus.PENDING)));

        ApiException ex = assertThrows(ApiException.class,
                () -> service.update(3L, new WorkItemRequest("A", null, BigDecimal.ONE, "archived")));

        assertEquals("work_item_status_invalid", ex.getDetails());
    }

    @Test
    void updateThrowsWhenNotFound() {
        when(dao.findById(3L)).thenReturn(Optional.empty());

        ApiException ex = assertThrows(ApiException.class,
                () -> service.update(3L, new WorkItemRequest("A", null, BigDecimal.ONE, null)));

        assertEquals("NOT_FOUND", ex.getCode());
    }

    @Test
    void updateKeepsStatusWhenNotGiven() {
        when(dao.findById(3L)).thenReturn(Optional.of(row(3, "A", "2", 1, WorkItemStatus.SCHEDULED)));
        when(dao.update(3L, "A", null, new BigDecimal("4"), WorkItemStatus.SCHEDULED))
                .thenReturn(Optional.of(row(3, "A", "4", 1, WorkItemStatus.SCHEDULED)));
        when(sessionService.windowsByWorkItem()).thenReturn(Map.of());

        WorkItemResponse response = service.update(3L, new WorkItemRequest("A", "", new BigDecimal("4"), null));

        assertEquals("SCHEDULED", response.status());
        verify(trigger).requestRecalculation(anyString());
    }

    @Test
    void reorderAssignsPositionBasedPriorities() {
        when(dao.listAll()).thenReturn(List.of(
                row(1, "A", "1", 1, WorkItemStatus.PENDING),
                row(2, "B", "1", 2, WorkItemStatus.PENDING),
                row(3, "C", "1", 3, WorkItemStatus.PENDING)));
        when(sessionService.windowsByWorkItem()).thenReturn(Map.of());

        service.reorder(new WorkItemReorderRequest(List.of(3L, 1L, 2L)));

        verify(dao).updatePriority(3L, 1);
        verify(dao).updatePriority(1L, 2);
        verify(dao).updatePriority(2L, 3);
        verify(trigger).requestRecalculation(anyString());
    }

    @Test
    void reorderRejectsIncompleteList() {
        when(dao.listAll()).thenReturn(List.of(
                row(1, "A", "1", 1, WorkItemStatus.PENDING),
                row(2, "B", "1", 2, WorkItemStatus.PENDING)));

        ApiException ex = assertThrows(ApiException.class,
                () -> service.reorder(new WorkItemReorderRequest(List.of(2L))));

        assertEquals("order_mismatch", ex.getDetails());
        verify(dao, never()).updatePriority(anyLong(), anyInt());
    }

    @Test
    void reorderRejectsDuplicates() {
        ApiException ex = assertThrows(ApiException.class,
                () -> service.reorder(new WorkItemReorderRequest(List.of(1L, 1L))));

        assertEquals("order_duplicate_id", ex.getDetails());
    }

    @Test
    void deleteRemovesRemoteEventsAfterRow() {
        when(dao.findById(4L)).thenReturn(Optional.of(row(4, "A", "3", 1, WorkItemStatus.SCHEDULED)));
        OffsetDateTime start = OffsetDateTime.parse("2025-06-02T09:00:00Z");
        when(sessionDao.listByWorkItem(4L)).thenReturn(List.of(
                new SessionDao.SessionRow(10, 4, "A", start, start.plusHours(1), BigDecimal.ONE,
                        AssignmentStatus.SCHEDULED, 1, "#EF4444", "evt-1"),
                new SessionDao.SessionRow(11, 4, "A", start.plusDays(1), start.plusDays(1).plusHours(1), BigDecimal.ONE,
                        AssignmentStatus.SCHEDULED, 1, "#EF4444", null)));
        when(dao.delete(4L)).thenReturn(1);

        service.delete(4L);

        InOrder order = inOrder(dao, calendarSyncService, trigger);
        order.verify(dao).delete(4L);
        order.verify(calendarSyncService).deleteEvents(List.of("evt-1"));
        order.verify(trigger).requestRecalculation(anyString());
    }

    @Test
    void listAddsDerivedDates() {
        OffsetDateTime start = OffsetDateTime.parse("2025-06-02T09:00:00Z");
        OffsetDateTime end = OffsetDateTime.parse("2025-06-05T10:00:00Z");
        when(dao.listAll()).thenReturn(List.of(row(1, "A", "3", 1, WorkItemStatus.SCHEDULED)));
        when(sessionService.windowsByWorkItem()).thenReturn(Map.of(1L, new SessionService.SessionWindow(start, end)));

        List<WorkItemResponse> items = service.list();

        assertThat(items).singleElement().satisfies(item -> {
            assertThat(item.startDate()).isEqualTo(start);
            assertThat(item.endDate()).isEqualTo(end);
            assertThat(item.color()).isEqualTo("#10B981");
        });
    }
}
