package czm.timebox_be.recalc;

import czm.timebox_be.availability.AvailabilityRuleDao;
import czm.timebox_be.calendar.BusyIntervalService;
import czm.timebox_be.calendar.CalendarSyncService;
import czm.timebox_be.config.SchedulingProperties;
import czm.timebox_be.engine.Assignment;
import czm.timebox_be.engine.AssignmentStatus;
import czm.timebox_be.engine.BusyInterval;
import czm.timebox_be.engine.ConflictResolver;
import czm.timebox_be.engine.RescheduleResult;
import czm.timebox_be.engine.SchedulingEngine;
import czm.timebox_be.engine.WorkItem;
import czm.timebox_be.session.SessionDao;
import czm.timebox_be.session.SessionDao.SessionRow;
import czm.timebox_be.web.ApiException;
import czm.timebox_be.workitem.WorkItemDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Incremental path: relabel sessions hit by new busy intervals and optionally move them,
 * leaving every other session where it is.
 */
@Service
public class ConflictService {
    private static final Logger log = LoggerFactory.getLogger(ConflictService.class);

    private final SessionDao sessionDao;
    private final WorkItemDao workItemDao;
    private final AvailabilityRuleDao ruleDao;
    private final BusyIntervalService busyIntervalService;
    private final CalendarSyncService calendarSyncService;
    private final SchedulingEngine engine;
    private final SchedulingProperties props;
    private final ScheduleLock lock;
    private final Clock clock;
    private final TransactionTemplate txTemplate;

    public ConflictService(SessionDao sessionDao,
                           WorkItemDao workItemDao,
                           AvailabilityRuleDao ruleDao,
                           BusyIntervalService busyIntervalService,
                           CalendarSyncService calendarSyncService,
                           SchedulingEngine engine,
                           SchedulingProperties props,
                           ScheduleLock lock,
                           Clock clock,
                           PlatformTransactionManager tm) {
        this.sessionDao = sessionDao;
        this.workItemDao = workItemDao;
        this.ruleDao = ruleDao;
        this.busyIntervalService = busyIntervalService;
        this.calendarSyncService = calendarSyncService;
        this.engine = engine;
        this.props = props;
        this.lock = lock;
        this.clock = clock;
        this.txTemplate = new TransactionTemplate(tm);
    }

    public ConflictSummary detect(String timezone) {
        ZoneId zone = ScheduleZones.resolve(timezone, props);
        return lock.runExclusive(() -> {
            Detection detection = detectConflicts(clock.instant(), zone);
            ConflictSummary summary = new ConflictSummary().addConflicted(detection.newlyConflicted());
            for (Assignment assignment : detection.assignments()) {
                if (assignment.isConflicted()) {
                    summary.unresolved.add(assignment.id());
                }
            }
            return summary;
        });
    }

    public ConflictSummary reschedule(String timezone) {
        ZoneId zone = ScheduleZones.resolve(timezone, props);
        return lock.runExclusive(() -> doReschedule(zone));
    }

    private ConflictSummary doReschedule(ZoneId zone) {
        Instant now = clock.instant();
        Detection detection = detectConflicts(now, zone);
        ConflictSummary summary = new ConflictSummary().addConflicted(detection.newlyConflicted());

        List<WorkItem> items;
        RescheduleResult result;
        try {
            items = workItemDao.listAll().stream().map(WorkItemDao.WorkItemRow::toWorkItem).toList();
            result = engine.reschedule(detection.assignments(), items, ruleDao.listActive(), detection.busy(), now, zone);
        } catch (DataAccessException ex) {
            throw ApiException.persistence("Nepodařilo se načíst data pro přeplánování.", "reschedule_load_failed", ex);
        }

        List<String> staleEventIds = new ArrayList<>();
        for (Assignment moved : result.rescheduled()) {
            String eventId = detection.eventIds().get(moved.id());
            if (eventId != null) {
                staleEventIds.add(eventId);
            }
        }
        try {
            txTemplate.executeWithoutResult(status -> {
                for (Assignment moved : result.rescheduled()) {
                    sessionDao.updateWindow(moved.id(), moved.start(), moved.end(), AssignmentStatus.SCHEDULED);
                }
            });
        } catch (DataAccessException ex) {
            throw ApiException.persistence("Uložení přeplánovaných bloků selhalo.", "reschedule_persist_failed", ex);
        }

        summary.addDeleted(calendarSyncService.deleteEvents(staleEventIds));
        summary.addCreated(calendarSyncService.createEvents(result.rescheduled(), zone));

        summary.addRescheduled(result.rescheduled().size());
        for (Assignment assignment : result.unresolved()) {
            summary.unresolved.add(assignment.id());
        }
        log.info("Conflicts rescheduled: conflicted={} moved={} unresolved={} events created={} failed={} deleted={} delete_failed={}",
                summary.conflicted, summary.rescheduled, summary.unresolved.size(), summary.calendarEvents.created,
                summary.calendarEvents.failed, summary.calendarEvents.deleted, summary.calendarEvents.deleteFailed);
        return summary;
    }

    private Detection detectConflicts(Instant now, ZoneId zone) {
        List<SessionRow> rows;
        try {
            rows = sessionDao.listAll();
        } catch (DataAccessException ex) {
            throw ApiException.persistence("Nepodařilo se načíst naplánované bloky.", "sessions_load_failed", ex);
        }
        Map<Long, String> eventIds = new HashMap<>();
        List<Assignment> assignments = new ArrayList<>(rows.size());
        for (SessionRow row : rows) {
            assignments.add(row.toAssignment());
            if (row.externalEventId() != null && row.status() != AssignmentStatus.COMPLETED) {
                eventIds.put(row.id(), row.externalEventId());
            }
        }

        List<BusyInterval> busy = busyIntervalService.fetchBusy(now, zone, eventIds.values());
        List<Assignment> resolved = ConflictResolver.resolveConflicts(assignments, busy);

        List<Long> newlyConflicted = new ArrayList<>();
        for (int i = 0; i < resolved.size(); i++) {
            if (resolved.get(i).isConflicted() && !assignments.get(i).isConflicted()) {
                newlyConflicted.add(resolved.get(i).id());
            }
        }
        if (!newlyConflicted.isEmpty()) {
            try {
                txTemplate.executeWithoutResult(status -> {
                    for (Long id : newlyConflicted) {
                        sessionDao.updateStatus(id, AssignmentStatus.CONFLICTED);
                    }
                });
            } catch (DataAccessException ex) {
                throw ApiException.persistence("Uložení konfliktů selhalo.", "conflicts_persist_failed", ex);
            }
            log.info("Detected {} new conflicts against {} busy intervals", newlyConflicted.size(), busy.size());
        }
        return new Detection(resolved, busy, eventIds, newlyConflicted.size());
    }

    private record Detection(List<Assignment> assignments,
                             List<BusyInterval> busy,
                             Map<Long, String> eventIds,
                             int newlyConflicted) {
    }
}
