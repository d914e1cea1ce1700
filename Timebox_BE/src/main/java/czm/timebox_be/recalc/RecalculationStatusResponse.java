package czm.timebox_be.recalc;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RecalculationStatusResponse(
        @JsonProperty("status") String status,
        @JsonProperty("reason") String reason,
        @JsonProperty("coalesced_requests") int coalescedRequests,
        @JsonProperty("result") RecalculationSummary result,
        @JsonProperty("error_code") String errorCode,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("started_at") Long startedAt,
        @JsonProperty("finished_at") Long finishedAt) {

    static RecalculationStatusResponse idle() {
        return new RecalculationStatusResponse("IDLE", null, 0, null, null, null, null, null);
    }

    static RecalculationStatusResponse from(RecalculationTrigger.Run run) {
        return new RecalculationStatusResponse(run.status, run.reason, run.coalescedRequests.get(), run.result,
                run.errorCode, run.errorMessage, run.startedAt, run.finishedAt);
    }
}
