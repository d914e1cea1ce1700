package czm.timebox_be.recalc;

import czm.timebox_be.config.SchedulingProperties;
import czm.timebox_be.web.ApiException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Debounces recalculation requests from mutations and calendar notifications.
 *
 * <p>Each request restarts the quiet period; when it elapses one full recalculation runs on a
 * single background thread. Mutual exclusion with synchronous runs is handled by {@link ScheduleLock}.</p>
 */
@Service
public class RecalculationTrigger {
    private static final Logger log = LoggerFactory.getLogger(RecalculationTrigger.class);

    public static class Run {
        public volatile String status; // PENDING | RUNNING | DONE | ERROR
        public volatile String reason;
        public volatile RecalculationSummary result;
        public volatile String errorCode;
        public volatile String errorMessage;
        public volatile Long startedAt;
        public volatile Long finishedAt;
        public final AtomicInteger coalescedRequests = new AtomicInteger();
    }

    private final RecalculationService recalculationService;
    private final SchedulingProperties props;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "schedule-recalc");
        t.setDaemon(true);
        return t;
    });

    private final Object monitor = new Object();
    private ScheduledFuture<?> pending;
    private Run pendingRun;
    private volatile Run lastRun;
    /** Zone of the last successful explicit run; debounced runs use it too. */
    private volatile String lastTimezone;

    public RecalculationTrigger(RecalculationService recalculationService, SchedulingProperties props) {
        this.recalculationService = recalculationService;
        this.props = props;
    }

    /**
     * Requests an asynchronous full recalculation. Requests arriving within the debounce window are merged.
     */
    public void requestRecalculation(String reason) {
        synchronized (monitor) {
            if (pending != null && !pending.isDone() && pending.cancel(false)) {
                pendingRun.coalescedRequests.incrementAndGet();
                pendingRun.reason = reason;
            } else {
                pendingRun = new Run();
                pendingRun.status = "PENDING";
                pendingRun.reason = reason;
                pendingRun.coalescedRequests.set(1);
            }
            Run run = pendingRun;
            pending = scheduler.schedule(() -> execute(run), props.getDebounceMs(), TimeUnit.MILLISECONDS);
            log.debug("Recalculation requested ({}), {} request(s) pending", reason, run.coalescedRequests.get());
        }
    }

    /**
     * Runs a recalculation right away on the calling thread. A zone given here is kept for later debounced runs.
     */
    public RecalculationSummary runNow(String timezone) {
        Run run = new Run();
        run.reason = "manual";
        run.coalescedRequests.set(1);
        return track(run, timezone);
    }

    public Run getLastRun() {
        return lastRun;
    }

    private void execute(Run run) {
        synchronized (monitor) {
            if (pendingRun == run) {
                pending = null;
                pendingRun = null;
            }
        }
        try {
            track(run, lastTimezone);
        } catch (RuntimeException ex) {
            log.error("Scheduled recalculation ({}) failed", run.reason, ex);
        }
    }

    private RecalculationSummary track(Run run, String timezone) {
        run.status = "RUNNING";
        run.startedAt = System.currentTimeMillis();
        lastRun = run;
        try {
            RecalculationSummary summary = recalculationService.recalculate(timezone);
            if (timezone != null && !timezone.isBlank()) {
                lastTimezone = timezone;
            }
            run.result = summary;
            run.status = "DONE";
            return summary;
        } catch (RuntimeException ex) {
            run.status = "ERROR";
            run.errorCode = ex instanceof ApiException api ? api.getCode() : "UNKNOWN";
            run.errorMessage = ex.getMessage();
            throw ex;
        } finally {
            run.finishedAt = System.currentTimeMillis();
        }
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }
}
