package czm.timebox_be.recalc;

import czm.timebox_be.availability.AvailabilityRuleDao;
import czm.timebox_be.calendar.BusyIntervalService;
import czm.timebox_be.calendar.CalendarSyncResult;
import czm.timebox_be.calendar.CalendarSyncService;
import czm.timebox_be.config.SchedulingProperties;
import czm.timebox_be.engine.Assignment;
import czm.timebox_be.engine.AvailabilityRule;
import czm.timebox_be.engine.BusyInterval;
import czm.timebox_be.engine.ScheduleResult;
import czm.timebox_be.engine.SchedulingEngine;
import czm.timebox_be.engine.WorkItem;
import czm.timebox_be.engine.WorkItemStatus;
import czm.timebox_be.session.SessionDao;
import czm.timebox_be.workitem.WorkItemDao;
import czm.timebox_be.web.ApiException;
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
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Full recalculation: throws away every non-completed session and schedules all open work from scratch.
 *
 * <p>Order of effects: busy intervals are fetched, the engine runs, then one transaction replaces the
 * stored sessions and updates item statuses. Only after the commit are remote events of the removed
 * sessions deleted and new ones created. A database failure therefore aborts before the calendar is
 * touched, while calendar failures are counted and never roll the database back.</p>
 */
@Service
public class RecalculationService {
    private static final Logger log = LoggerFactory.getLogger(RecalculationService.class);

    private final WorkItemDao workItemDao;
    private final AvailabilityRuleDao ruleDao;
    private final SessionDao sessionDao;
    private final BusyIntervalService busyIntervalService;
    private final CalendarSyncService calendarSyncService;
    private final SchedulingEngine engine;
    private final SchedulingProperties props;
    private final ScheduleLock lock;
    private final Clock clock;
    private final TransactionTemplate txTemplate;

    public RecalculationService(WorkItemDao workItemDao,
                                AvailabilityRuleDao ruleDao,
                                SessionDao sessionDao,
                                BusyIntervalService busyIntervalService,
                                CalendarSyncService calendarSyncService,
                                SchedulingEngine engine,
                                SchedulingProperties props,
                                ScheduleLock lock,
                                Clock clock,
                                PlatformTransactionManager tm) {
        this.workItemDao = workItemDao;
        this.ruleDao = ruleDao;
        this.sessionDao = sessionDao;
        this.busyIntervalService = busyIntervalService;
        this.calendarSyncService = calendarSyncService;
        this.engine = engine;
        this.props = props;
        this.lock = lock;
        this.clock = clock;
        this.txTemplate = new TransactionTemplate(tm);
    }

    public RecalculationSummary recalculate(String timezone) {
        ZoneId zone = ScheduleZones.resolve(timezone, props);
        return lock.runExclusive(() -> doRecalculate(zone));
    }

    private RecalculationSummary doRecalculate(ZoneId zone) {
        long started = System.currentTimeMillis();
        Instant now = clock.instant();
        RecalculationSummary summary = new RecalculationSummary();

        List<WorkItem> items;
        List<AvailabilityRule> rules;
        Set<String> ownEventIds;
        try {
            items = workItemDao.listAll().stream().map(WorkItemDao.WorkItemRow::toWorkItem).toList();
            rules = ruleDao.listActive();
            ownEventIds = externalEventIds(sessionDao.listNonCompleted());
        } catch (DataAccessException ex) {
            throw ApiException.persistence("Nepodařilo se načíst data pro přepočet rozvrhu.", "schedule_load_failed", ex);
        }
        log.info("Recalculating schedule in zone {}: {} work items, {} active rules", zone, items.size(), rules.size());

        List<BusyInterval> busy = busyIntervalService.fetchBusy(now, zone, ownEventIds);
        summary.addConflictsAvoided(busy.size());

        ScheduleResult result = engine.generateSchedule(items, rules, busy, now, zone);
        summary.addUnscheduled(result.unscheduled());
        if (result.isCapacityExhausted()) {
            log.info("Capacity exhausted: {} work items keep unscheduled hours", result.unscheduled().size());
        }

        Replacement replacement;
        try {
            replacement = txTemplate.execute(status -> replaceSessions(items, result.assignments()));
        } catch (DataAccessException ex) {
            throw ApiException.persistence("Uložení rozvrhu selhalo, kalendář nebyl změněn.", "schedule_persist_failed", ex);
        }
        Objects.requireNonNull(replacement, "replacement");
        summary.addSessionsRemoved(replacement.removed());
        summary.addSessionsCreated(replacement.persisted().size());

        CalendarSyncResult deleted = calendarSyncService.deleteEvents(replacement.staleEventIds());
        summary.addDeleted(deleted);
        CalendarSyncResult created = calendarSyncService.createEvents(replacement.persisted(), zone);
        summary.addCreated(created);

        summary.durationMs = System.currentTimeMillis() - started;
        log.info("Schedule recalculated: sessions={} removed={} busy={} unscheduled={} events created={} failed={} deleted={} ({} ms)",
                summary.sessionsCreated, summary.sessionsRemoved, summary.conflictsAvoided, summary.unscheduled.size(),
                summary.calendarEvents.created, summary.calendarEvents.failed, summary.calendarEvents.deleted, summary.durationMs);
        return summary;
    }

    private Replacement replaceSessions(List<WorkItem> items, List<Assignment> assignments) {
        Set<String> staleEventIds = externalEventIds(sessionDao.listNonCompleted());
        int removed = sessionDao.deleteNonCompleted();

        List<Assignment> persisted = new ArrayList<>(assignments.size());
        Set<Long> scheduledItems = new HashSet<>();
        for (Assignment assignment : assignments) {
            long id = sessionDao.insert(assignment);
            persisted.add(assignment.withId(id));
            scheduledItems.add(assignment.workItemId());
        }
        for (WorkItem item : items) {
            if (item.isCompleted()) {
                continue;
            }
            workItemDao.updateStatus(item.id(),
                    scheduledItems.contains(item.id()) ? WorkItemStatus.SCHEDULED : WorkItemStatus.PENDING);
        }
        return new Replacement(removed, persisted, staleEventIds);
    }

    static Set<String> externalEventIds(List<SessionDao.SessionRow> rows) {
        Set<String> ids = new HashSet<>();
        for (SessionDao.SessionRow row : rows) {
            if (row.externalEventId() != null && !row.externalEventId().isBlank()) {
                ids.add(row.externalEventId());
            }
        }
        return ids;
    }

    private record Replacement(int removed, List<Assignment> persisted, Set<String> staleEventIds) {
    }
}
