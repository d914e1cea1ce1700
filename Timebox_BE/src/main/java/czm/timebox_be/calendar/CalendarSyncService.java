package czm.timebox_be.calendar;

import czm.timebox_be.calendar.dto.CalendarEvent;
import czm.timebox_be.calendar.dto.EventDateTime;
import czm.timebox_be.config.CalendarProperties;
import czm.timebox_be.config.SchedulingProperties;
import czm.timebox_be.engine.Assignment;
import czm.timebox_be.session.SessionDao;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Mirrors sessions to the calendar provider. Every call runs as its own task on a bounded pool;
 * a failing task is logged and counted and never stops the rest of the batch.
 */
@Service
public class CalendarSyncService {
    private static final Logger log = LoggerFactory.getLogger(CalendarSyncService.class);

    private final CalendarClient client;
    private final SessionDao sessionDao;
    private final CalendarProperties props;
    private final ExecutorService executor;

    public CalendarSyncService(CalendarClient client,
                               SessionDao sessionDao,
                               CalendarProperties props,
                               SchedulingProperties schedulingProps) {
        this.client = client;
        this.sessionDao = sessionDao;
        this.props = props;
        this.executor = Executors.newFixedThreadPool(Math.max(1, schedulingProps.getSyncConcurrency()));
    }

    public boolean isEnabled() {
        return props.isEnabled();
    }

    public CalendarSyncResult deleteEvents(Collection<String> eventIds) {
        if (!props.isEnabled() || eventIds == null || eventIds.isEmpty()) {
            return CalendarSyncResult.empty();
        }
        List<Callable<Boolean>> tasks = new ArrayList<>();
        for (String eventId : eventIds) {
            if (eventId == null || eventId.isBlank()) {
                continue;
            }
            tasks.add(() -> {
                try {
                    client.deleteEvent(eventId);
                    return true;
                } catch (RuntimeException ex) {
                    log.warn("Deleting calendar event {} failed: {}", eventId, ex.getMessage());
                    return false;
                }
            });
        }
        CalendarSyncResult result = runAll(tasks);
        log.info("Calendar events deleted={} failed={}", result.succeeded(), result.failed());
        return result;
    }

    /**
     * Creates one remote event per persisted assignment and stores the returned event id on the session row.
     */
    public CalendarSyncResult createEvents(List<Assignment> assignments, ZoneId zone) {
        if (!props.isEnabled() || assignments == null || assignments.isEmpty()) {
            return CalendarSyncResult.empty();
        }
        List<Callable<Boolean>> tasks = new ArrayList<>();
        for (Assignment assignment : assignments) {
            if (assignment.id() == null) {
                continue;
            }
            tasks.add(() -> {
                CalendarEvent created;
                try {
                    created = client.createEvent(toEvent(assignment, zone));
                } catch (RuntimeException ex) {
                    log.warn("Creating calendar event for session {} failed: {}", assignment.id(), ex.getMessage());
                    return false;
                }
                if (created == null || created.id == null) {
                    return true;
                }
                try {
                    sessionDao.updateExternalEventId(assignment.id(), created.id);
                    return true;
                } catch (RuntimeException ex) {
                    log.warn("Storing event {} on session {} failed, removing the event: {}",
                            created.id, assignment.id(), ex.getMessage());
                    discardOrphan(created.id);
                    return false;
                }
            });
        }
        CalendarSyncResult result = runAll(tasks);
        log.info("Calendar events created={} failed={}", result.succeeded(), result.failed());
        return result;
    }

    private void discardOrphan(String eventId) {
        try {
            client.deleteEvent(eventId);
        } catch (RuntimeException ex) {
            log.warn("Calendar event {} is orphaned and must be removed by hand: {}", eventId, ex.getMessage());
        }
    }

    static CalendarEvent toEvent(Assignment assignment, ZoneId zone) {
        CalendarEvent event = new CalendarEvent();
        event.summary = "Work Session: " + assignment.workItemName();
        event.description = "Scheduled work session for " + assignment.workItemName()
                + " (" + formatHours(assignment.durationHours()) + " hours)";
        event.start = new EventDateTime(OffsetDateTime.ofInstant(assignment.start(), zone), zone.getId());
        event.end = new EventDateTime(OffsetDateTime.ofInstant(assignment.end(), zone), zone.getId());
        return event;
    }

    static String formatHours(double hours) {
        return BigDecimal.valueOf(hours).setScale(2, RoundingMode.HALF_UP).stripTrailingZeros().toPlainString();
    }

    private CalendarSyncResult runAll(List<Callable<Boolean>> tasks) {
        if (tasks.isEmpty()) {
            return CalendarSyncResult.empty();
        }
        int ok = 0;
        int failed = 0;
        try {
            for (Future<Boolean> future : executor.invokeAll(tasks)) {
                if (Boolean.TRUE.equals(future.get())) {
                    ok++;
                } else {
                    failed++;
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Calendar sync interrupted after {} successful calls", ok);
            failed = tasks.size() - ok;
        } catch (ExecutionException ex) {
            // tasks catch their own failures
            throw new IllegalStateException("Calendar sync task failed", ex.getCause());
        }
        return new CalendarSyncResult(ok, failed);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
