package czm.timebox_be.recalc;

import czm.timebox_be.config.SchedulingProperties;
import czm.timebox_be.web.ApiException;

import java.time.DateTimeException;
import java.time.ZoneId;

final class ScheduleZones {

    private ScheduleZones() {
    }

    /**
     * Requested zone, falling back to the configured one when blank.
     */
    static ZoneId resolve(String requested, SchedulingProperties props) {
        String value = requested == null || requested.isBlank() ? props.getTimezone() : requested.trim();
        try {
            return ZoneId.of(value);
        } catch (DateTimeException ex) {
            throw ApiException.validation("Neznámé časové pásmo: " + value, "timezone_invalid");
        }
    }
}
