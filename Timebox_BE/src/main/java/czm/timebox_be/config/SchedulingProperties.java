package czm.timebox_be.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "scheduling")
public class SchedulingProperties {
    /** Zone in which availability rule times are interpreted, e.g. Europe/Prague */
    @NotBlank
    private String timezone = "UTC";
    /** Lower bound of the slot horizon in weeks */
    @Min(1)
    private int minHorizonWeeks = 8;
    /** Weeks added on top of the estimated need */
    @Min(0)
    private int horizonMarginWeeks = 2;
    /** Horizon used when moving conflicted sessions */
    @Min(1)
    private int rescheduleHorizonDays = 30;
    /** Hard cap of any slot search */
    @Min(1)
    private int safetyHorizonDays = 365;
    /** Quiet period before a requested recalculation starts */
    @Min(0)
    private long debounceMs = 1000;
    /** Parallel calls towards the calendar provider */
    @Min(1)
    private int syncConcurrency = 4;

    public String getTimezone() { return timezone; }
    public void setTimezone(String timezone) { this.timezone = timezone; }
    public int getMinHorizonWeeks() { return minHorizonWeeks; }
    public void setMinHorizonWeeks(int minHorizonWeeks) { this.minHorizonWeeks = minHorizonWeeks; }
    public int getHorizonMarginWeeks() { return horizonMarginWeeks; }
    public void setHorizonMarginWeeks(int horizonMarginWeeks) { this.horizonMarginWeeks = horizonMarginWeeks; }
    public int getRescheduleHorizonDays() { return rescheduleHorizonDays; }
    public void setRescheduleHorizonDays(int rescheduleHorizonDays) { this.rescheduleHorizonDays = rescheduleHorizonDays; }
    public int getSafetyHorizonDays() { return safetyHorizonDays; }
    public void setSafetyHorizonDays(int safetyHorizonDays) { this.safetyHorizonDays = safetyHorizonDays; }
    public long getDebounceMs() { return debounceMs; }
    public void setDebounceMs(long debounceMs) { this.debounceMs = debounceMs; }
    public int getSyncConcurrency() { return syncConcurrency; }
    public void setSyncConcurrency(int syncConcurrency) { this.syncConcurrency = syncConcurrency; }
}
