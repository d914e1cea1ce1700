package czm.timebox_be.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "calendar")
public class CalendarProperties {
    /** Whether a calendar connection is configured at all */
    private boolean enabled = false;
    /** Base API URL, e.g. https://www.googleapis.com/calendar/v3 */
    private String api = "https://www.googleapis.com/calendar/v3";
    /** Calendar to read busy events from and write sessions to */
    private String calendarId = "primary";
    /** OAuth access token (header Authorization: Bearer) */
    private String token;
    /** Request timeout ms */
    private int timeoutMs = 10_000;
    /** Max retries on 429/5xx */
    private int retryMax = 3;
    /** Backoff in ms between retries */
    private int retryBackoffMs = 500;
    /** How far ahead busy events are fetched */
    private int lookaheadMonths = 3;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getApi() { return api; }
    public void setApi(String api) { this.api = api; }
    public String getCalendarId() { return calendarId; }
    public void setCalendarId(String calendarId) { this.calendarId = calendarId; }
    public String getToken() { return token; }
    public void setToken(String token) { this.token = token; }
    public int getTimeoutMs() { return timeoutMs; }
    public void setTimeoutMs(int timeoutMs) { this.timeoutMs = timeoutMs; }
    public int getRetryMax() { return retryMax; }
    public void setRetryMax(int retryMax) { this.retryMax = retryMax; }
    public int getRetryBackoffMs() { return retryBackoffMs; }
    public void setRetryBackoffMs(int retryBackoffMs) { this.retryBackoffMs = retryBackoffMs; }
    public int getLookaheadMonths() { return lookaheadMonths; }
    public void setLookaheadMonths(int lookaheadMonths) { this.lookaheadMonths = lookaheadMonths; }
}
