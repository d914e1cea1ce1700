package czm.timebox_be.engine;

import czm.timebox_be.config.SchedulingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Collection;
import java.util.List;

/**
 * Entry point of the scheduling pipeline: rules + horizon -> slots -> blocked by busy intervals
 * -> allocated in priority order.
 *
 * <p>The engine keeps no state between calls; every input including "now" is explicit.</p>
 */
@Component
public class SchedulingEngine {
    private static final Logger log = LoggerFactory.getLogger(SchedulingEngine.class);

    private final SchedulingProperties props;

    public SchedulingEngine(SchedulingProperties props) {
        this.props = props;
    }

    public ScheduleResult generateSchedule(List<WorkItem> items,
                                           List<AvailabilityRule> rules,
                                           Collection<BusyInterval> busy,
                                           Instant now,
                                           ZoneId zone) {
        int horizonDays = horizonDays(items, rules);
        List<TimeSlot> slots = AvailabilityModel.generateSlots(rules, horizonDays, now, zone);
        int blocked = ExternalConflictFilter.blockConflicting(slots, busy);
        log.info("Generated {} slots over {} days, {} blocked by {} busy intervals",
                slots.size(), horizonDays, blocked, busy == null ? 0 : busy.size());
        ScheduleResult result = PriorityScheduler.schedule(items, slots, busy);
        log.info("Scheduled {} assignments, {} items with unscheduled hours",
                result.assignments().size(), result.unscheduled().size());
        return result;
    }

    public RescheduleResult reschedule(List<Assignment> assignments,
                                       Collection<WorkItem> items,
                                       List<AvailabilityRule> rules,
                                       Collection<BusyInterval> busy,
                                       Instant now,
                                       ZoneId zone) {
        int horizonDays = Math.min(props.getRescheduleHorizonDays(), props.getSafetyHorizonDays());
        return ConflictResolver.reschedule(assignments, items, rules, busy, now, zone, horizonDays);
    }

    public int horizonDays(Collection<WorkItem> items, Collection<AvailabilityRule> rules) {
        return AvailabilityModel.horizonDays(items, rules,
                props.getMinHorizonWeeks(), props.getHorizonMarginWeeks(), props.getSafetyHorizonDays());
    }
}
