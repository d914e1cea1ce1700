package czm.timebox_be.calendar;

import czm.timebox_be.recalc.RecalculationTrigger;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;
import java.util.Map;

/**
 * Receives calendar push notifications. Changes in the calendar may invalidate sessions,
 * so {@code push} and {@code sync} notifications request a full recalculation.
 */
@RestController
@RequestMapping("/api/calendar")
@Tag(name = "Calendar", description = "Notifikace z kalendáře")
public class CalendarWebhookController {
    private static final Logger log = LoggerFactory.getLogger(CalendarWebhookController.class);

    private final RecalculationTrigger trigger;

    public CalendarWebhookController(RecalculationTrigger trigger) {
        this.trigger = trigger;
    }

    @PostMapping("/webhook")
    @Operation(summary = "Notifikace o změně kalendáře", description = "Typy push a sync naplánují přepočet rozvrhu, test pouze potvrdí příjem.")
    public Map<String, Object> webhook(@RequestBody(required = false) CalendarWebhookRequest request) {
        String type = request == null || request.type() == null ? "" : request.type().trim().toLowerCase(Locale.ROOT);
        boolean recalculate = type.equals("push") || type.equals("sync");
        log.info("Calendar notification type={} resource={} recalculate={}",
                type, request == null ? null : request.resourceId(), recalculate);
        if (recalculate) {
            trigger.requestRecalculation("calendar " + type + " notification");
        }
        return Map.of("received", true, "recalculation_requested", recalculate);
    }
}
