package czm.timebox_be.recalc;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Optional body of schedule endpoints; a blank time zone means the configured default.
 */
public record RecalculationRequest(@JsonProperty("timezone") String timezone) {
}
