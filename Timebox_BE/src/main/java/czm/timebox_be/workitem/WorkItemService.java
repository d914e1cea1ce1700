package czm.timebox_be.workitem;

import czm.timebox_be.calendar.CalendarSyncService;
import czm.timebox_be.engine.ItemColors;
import czm.timebox_be.engine.WorkItemStatus;
import czm.timebox_be.recalc.RecalculationTrigger;
import czm.timebox_be.session.SessionDao;
import czm.timebox_be.session.SessionService;
import czm.timebox_be.session.SessionService.SessionWindow;
import czm.timebox_be.web.ApiException;
import czm.timebox_be.workitem.WorkItemDao.WorkItemRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Application service for work items: validation, priority bookkeeping and cleanup of sessions on delete.
 * Every mutation requests a schedule recalculation.
 */
@Service
public class WorkItemService {
    private static final Logger log = LoggerFactory.getLogger(WorkItemService.class);
    private static final int MAX_NAME_LENGTH = 200;

    private final WorkItemDao dao;
    private final SessionDao sessionDao;
    private final SessionService sessionService;
    private final CalendarSyncService calendarSyncService;
    private final RecalculationTrigger trigger;

    public WorkItemService(WorkItemDao dao,
                           SessionDao sessionDao,
                           SessionService sessionService,
                           CalendarSyncService calendarSyncService,
                           RecalculationTrigger trigger) {
        this.dao = dao;
        this.sessionDao = sessionDao;
        this.sessionService = sessionService;
        this.calendarSyncService = calendarSyncService;
        this.trigger = trigger;
    }

    public List<WorkItemResponse> list() {
        Map<Long, SessionWindow> windows = sessionService.windowsByWorkItem();
        return dao.listAll().stream()
                .map(row -> toResponse(row, windows.get(row.id())))
                .toList();
    }

    public WorkItemResponse get(long id) {
        WorkItemRow row = dao.findById(id)
                .orElseThrow(() -> ApiException.notFound("Pracovní položka nebyla nalezena.", "work_item"));
        return toResponse(row, sessionService.windowsByWorkItem().get(id));
    }

    @Transactional
    public WorkItemResponse create(WorkItemRequest request) {
        NormalizedInput input = normalize(request);
        // new items go to the end of the queue
        int priority = dao.maxPriority() + 1;
        WorkItemRow row = dao.insert(input.name(), input.description(), input.estimatedHours(), priority, WorkItemStatus.PENDING);
        log.info("Work item created id={} name={} hours={} priority={}", row.id(), row.name(), row.estimatedHours(), row.priority());
        trigger.requestRecalculation("work item " + row.id() + " created");
        return toResponse(row, null);
    }

    @Transactional
    public WorkItemResponse update(long id, WorkItemRequest request) {
        WorkItemRow existing = dao.findById(id)
                .orElseThrow(() -> ApiException.notFound("Pracovní položka nebyla nalezena.", "work_item"));
        NormalizedInput input = normalize(request);
        WorkItemStatus status = input.status() != null ? input.status() : existing.status();
        WorkItemRow updated = dao.update(id, input.name(), input.description(), input.estimatedHours(), status)
                .orElseThrow(() -> ApiException.notFound("Pracovní položka nebyla nalezena.", "work_item"));
        log.info("Work item updated id={} hours={} status={}", id, updated.estimatedHours(), updated.status());
        trigger.requestRecalculation("work item " + id + " updated");
        return toResponse(updated, sessionService.windowsByWorkItem().get(id));
    }

    /**
     * Deletes the item together with its sessions (cascade) and removes their remote calendar events.
     */
    public void delete(long id) {
        WorkItemRow existing = dao.findById(id)
                .orElseThrow(() -> ApiException.notFound("Pracovní položka nebyla nalezena.", "work_item"));
        List<String> eventIds = sessionDao.listByWorkItem(existing.id()).stream()
                .map(SessionDao.SessionRow::externalEventId)
                .filter(Objects::nonNull)
                .toList();
        int deleted = dao.delete(existing.id());
        if (deleted == 0) {
            throw ApiException.notFound("Pracovní položka nebyla nalezena.", "work_item");
        }
        calendarSyncService.deleteEvents(eventIds);
        log.info("Work item deleted id={} remoteEvents={}", id, eventIds.size());
        trigger.requestRecalculation("work item " + id + " deleted");
    }

    /**
     * Applies a new order: priority = position + 1.
     */
    @Transactional
    public List<WorkItemResponse> reorder(WorkItemReorderRequest request) {
        if (request == null || request.ids() == null || request.ids().isEmpty()) {
            throw ApiException.validation("Pořadí položek je povinné.", "order_required");
        }
        List<Long> ids = request.ids();
        Set<Long> unique = new HashSet<>(ids);
        if (unique.size() != ids.size() || unique.contains(null)) {
            throw ApiException.validation("Pořadí obsahuje duplicitní nebo prázdné ID.", "order_duplicate_id");
        }
        Set<Long> existing = dao.listAll().stream().map(WorkItemRow::id).collect(Collectors.toSet());
        if (!existing.equals(unique)) {
            throw ApiException.validation("Pořadí musí obsahovat právě všechny existující položky.", "order_mismatch");
        }
        for (int i = 0; i < ids.size(); i++) {
            dao.updatePriority(ids.get(i), i + 1);
        }
        log.info("Work items reordered count={}", ids.size());
        trigger.requestRecalculation("work items reordered");
        return list();
    }

    NormalizedInput normalize(WorkItemRequest request) {
        if (request == null) {
            throw ApiException.validation("Chybí data pracovní položky.", "work_item_body_missing");
        }
        String name = request.name() == null ? "" : request.name().trim();
        if (name.isEmpty()) {
            throw ApiException.validation("Název položky je povinný.", "work_item_name_required");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw ApiException.validation("Název položky je příliš dlouhý.", "work_item_name_too_long");
        }
        BigDecimal hours = request.estimatedHours();
        if (hours == null) {
            throw ApiException.validation("Odhad hodin je povinný.", "estimated_hours_required");
        }
        if (hours.signum() < 0) {
            throw ApiException.validation("Odhad hodin nesmí být záporný.", "estimated_hours_negative");
        }
        String description = request.description() == null || request.description().isBlank()
                ? null : request.description().trim();
        WorkItemStatus status = null;
        if (request.status() != null && !request.status().isBlank()) {
            try {
                status = WorkItemStatus.valueOf(request.status().trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw ApiException.validation("Neznámý stav položky.", "work_item_status_invalid");
            }
        }
        return new NormalizedInput(name, description, hours, status);
    }

    record NormalizedInput(String name, String description, BigDecimal estimatedHours, WorkItemStatus status) {
    }

    private static WorkItemResponse toResponse(WorkItemRow row, SessionWindow window) {
        return new WorkItemResponse(row.id(), row.name(), row.description(), row.estimatedHours(), row.priority(),
                row.status().name(), ItemColors.forWorkItem(row.id()),
                window == null ? null : window.start(),
                window == null ? null : window.end(),
                row.createdAt(), row.updatedAt());
    }
}
