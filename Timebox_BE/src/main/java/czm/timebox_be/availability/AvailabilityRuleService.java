package czm.timebox_be.availability;

import czm.timebox_be.engine.AvailabilityModel;
import czm.timebox_be.engine.AvailabilityRule;
import czm.timebox_be.recalc.RecalculationTrigger;
import czm.timebox_be.web.ApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * CRUD of weekly availability rules. Every change requests a schedule recalculation.
 */
@Service
public class AvailabilityRuleService {
    private static final Logger log = LoggerFactory.getLogger(AvailabilityRuleService.class);
    private static final Pattern TIME_PATTERN = Pattern.compile("^([01]\\d|2[0-3]):([0-5]\\d)$");
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private final AvailabilityRuleDao dao;
    private final RecalculationTrigger trigger;

    public AvailabilityRuleService(AvailabilityRuleDao dao, RecalculationTrigger trigger) {
        this.dao = dao;
        this.trigger = trigger;
    }

    public List<AvailabilityRuleResponse> list() {
        return dao.listAll().stream().map(AvailabilityRuleService::toResponse).toList();
    }

    @Transactional
    public AvailabilityRuleResponse create(AvailabilityRuleRequest request) {
        AvailabilityRule rule = normalize(0L, request);
        long id = dao.insert(rule);
        AvailabilityRule created = dao.findById(id)
                .orElseThrow(() -> ApiException.internal("Pravidlo bylo vytvořeno, ale nepodařilo se načíst jeho data.", "availability_rule_reload_failed"));
        log.info("Availability rule created id={} weekdays={} {}-{}", id, created.weekdays(), created.startTime(), created.endTime());
        trigger.requestRecalculation("availability rule " + id + " created");
        return toResponse(created);
    }

    @Transactional
    public AvailabilityRuleResponse update(long id, AvailabilityRuleRequest request) {
        dao.findById(id)
                .orElseThrow(() -> ApiException.notFound("Pravidlo dostupnosti nebylo nalezeno.", "availability_rule"));
        AvailabilityRule rule = normalize(id, request);
        dao.update(rule);
        log.info("Availability rule updated id={} weekdays={} {}-{} active={}", id, rule.weekdays(), rule.startTime(), rule.endTime(), rule.active());
        trigger.requestRecalculation("availability rule " + id + " updated");
        return toResponse(rule);
    }

    @Transactional
    public void delete(long id) {
        int deleted = dao.delete(id);
        if (deleted == 0) {
            throw ApiException.notFound("Pravidlo dostupnosti nebylo nalezeno.", "availability_rule");
        }
        log.info("Availability rule deleted id={}", id);
        trigger.requestRecalculation("availability rule " + id + " deleted");
    }

    AvailabilityRule normalize(long id, AvailabilityRuleRequest request) {
        if (request == null) {
            throw ApiException.validation("Chybí data pravidla.", "availability_rule_body_missing");
        }
        String name = request.name() == null ? "" : request.name().trim();
        if (name.isEmpty()) {
            throw ApiException.validation("Název pravidla je povinný.", "availability_rule_name_required");
        }
        if (request.weekdays() == null || request.weekdays().isEmpty()) {
            throw ApiException.validation("Vyberte alespoň jeden den v týdnu.", "weekdays_required");
        }
        Set<Integer> weekdays = new LinkedHashSet<>();
        for (Integer day : request.weekdays()) {
            if (day == null || day < 0 || day > 6) {
                throw ApiException.validation("Den v týdnu musí být v rozsahu 0 (neděle) až 6 (sobota).", "weekday_out_of_range");
            }
            weekdays.add(day);
        }
        LocalTime start = parseTime(request.startTime(), "start_time");
        LocalTime end = parseTime(request.endTime(), "end_time");
        if (!end.isAfter(start)) {
            throw ApiException.validation("Konec okna musí být po jeho začátku.", "end_before_start");
        }
        Integer minDuration = request.minDurationMinutes();
        if (minDuration != null && minDuration <= 0) {
            throw ApiException.validation("Minimální délka bloku musí být kladná.", "min_duration_invalid");
        }
        boolean active = request.active() == null || request.active();
        return new AvailabilityRule(id, name, weekdays, start, end, active, minDuration);
    }

    static LocalTime parseTime(String value, String field) {
        if (value == null) {
            throw ApiException.validation("Čas musí být ve formátu HH:MM.", field + "_invalid");
        }
        Matcher matcher = TIME_PATTERN.matcher(value.trim());
        if (!matcher.matches()) {
            throw ApiException.validation("Čas musí být ve formátu HH:MM.", field + "_invalid");
        }
        return LocalTime.of(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
    }

    static AvailabilityRuleResponse toResponse(AvailabilityRule rule) {
        List<Integer> weekdays = rule.weekdays().stream().sorted().toList();
        double weeklyHours = AvailabilityModel.averageWeeklyHours(List.of(rule));
        return new AvailabilityRuleResponse(rule.id(), rule.name(), weekdays,
                rule.startTime().format(TIME_FORMAT), rule.endTime().format(TIME_FORMAT),
                rule.active(), rule.minDurationMinutes(), weeklyHours);
    }
}
