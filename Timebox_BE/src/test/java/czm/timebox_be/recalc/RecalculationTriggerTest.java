package czm.timebox_be.recalc;

import czm.timebox_be.config.SchedulingProperties;
import czm.timebox_be.web.ApiException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RecalculationTriggerTest {
    @Mock
    private RecalculationService recalculationService;

    private RecalculationTrigger trigger;

    @BeforeEach
    void setUp() {
        SchedulingProperties props = new SchedulingProperties();
        props.setDebounceMs(150);
        trigger = new RecalculationTrigger(recalculationService, props);
    }

    @AfterEach
    void tearDown() {
        trigger.shutdown();
    }

    @Test
    void rapidRequestsCoalesceIntoOneRun() {
        when(recalculationService.recalculate(null)).thenReturn(new RecalculationSummary());

        for (int i = 0; i < 5; i++) {
            trigger.requestRecalculation("item " + i + " updated");
        }

        verify(recalculationService, timeout(2000).times(1)).recalculate(null);
        verify(recalculationService, after(400).times(1)).recalculate(null);
        RecalculationTrigger.Run run = trigger.getLastRun();
        assertThat(run.status).isEqualTo("DONE");
        assertThat(run.coalescedRequests.get()).isEqualTo(5);
        assertThat(run.reason).isEqualTo("item 4 updated");
    }

    @Test
    void requestsAfterQuietPeriodRunAgain() {
        when(recalculationService.recalculate(null)).thenReturn(new RecalculationSummary());

        trigger.requestRecalculation("first");
        verify(recalculationService, timeout(2000).times(1)).recalculate(null);
        trigger.requestRecalculation("second");

        verify(recalculationService, timeout(2000).times(2)).recalculate(null);
    }

    @Test
    void runNowRecordsFailure() {
        when(recalculationService.recalculate("Europe/Prague"))
                .thenThrow(ApiException.persistence("Uložení rozvrhu selhalo.", "schedule_persist_failed", null));

        assertThrows(ApiException.class, () -> trigger.runNow("Europe/Prague"));

        RecalculationTrigger.Run run = trigger.getLastRun();
        assertThat(run.status).isEqualTo("ERROR");
        assertThat(run.errorCode).isEqualTo("PERSISTENCE");
        assertThat(run.finishedAt).isNotNull();
    }

    @Test
    void debouncedRunsKeepZoneOfLastExplicitRun() {
        when(recalculationService.recalculate("America/New_York")).thenReturn(new RecalculationSummary());

        trigger.runNow("America/New_York");
        trigger.requestRecalculation("item 1 updated");

        verify(recalculationService, timeout(2000).times(2)).recalculate("America/New_York");
        verify(recalculationService, never()).recalculate(null);
    }

    @Test
    void failedExplicitZoneIsNotReused() {
        when(recalculationService.recalculate("Mars/Olympus"))
                .thenThrow(ApiException.validation("Neznámé časové pásmo: Mars/Olympus", "timezone_invalid"));
        when(recalculationService.recalculate(null)).thenReturn(new RecalculationSummary());

        assertThrows(ApiException.class, () -> trigger.runNow("Mars/Olympus"));
        trigger.requestRecalculation("webhook push");

        verify(recalculationService, timeout(2000).times(1)).recalculate(null);
    }
}
