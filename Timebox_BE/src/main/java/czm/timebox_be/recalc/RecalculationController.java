package czm.timebox_be.recalc;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/schedule")
@Tag(name = "Schedule", description = "Přepočet rozvrhu a řešení konfliktů")
public class RecalculationController {
    private final RecalculationTrigger trigger;
    private final ConflictService conflictService;

    public RecalculationController(RecalculationTrigger trigger, ConflictService conflictService) {
        this.trigger = trigger;
        this.conflictService = conflictService;
    }

    @PostMapping("/recalculate")
    @Operation(summary = "Úplný přepočet rozvrhu",
            description = "Smaže nedokončené bloky, načte obsazené časy z kalendáře a naplánuje vše znovu podle priorit. Zadané časové pásmo se použije i pro další automatické přepočty.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Rozvrh byl přepočítán."),
            @ApiResponse(responseCode = "400", description = "Neplatné časové pásmo."),
            @ApiResponse(responseCode = "500", description = "Uložení rozvrhu selhalo; kalendář zůstal beze změny.")
    })
    public RecalculationSummary recalculate(@RequestBody(required = false) RecalculationRequest request) {
        return trigger.runNow(request == null ? null : request.timezone());
    }

    @GetMapping("/status")
    @Operation(summary = "Stav posledního přepočtu")
    public RecalculationStatusResponse status() {
        RecalculationTrigger.Run run = trigger.getLastRun();
        return run == null ? RecalculationStatusResponse.idle() : RecalculationStatusResponse.from(run);
    }

    @PostMapping("/conflicts/detect")
    @Operation(summary = "Detekce konfliktů", description = "Označí bloky, které se překrývají s událostmi v kalendáři.")
    public ConflictSummary detect(@RequestBody(required = false) RecalculationRequest request) {
        return conflictService.detect(request == null ? null : request.timezone());
    }

    @PostMapping("/conflicts/reschedule")
    @Operation(summary = "Přeplánování konfliktů",
            description = "Označí konfliktní bloky a přesune je do nejbližšího volného okna v příštích dnech.")
    public ConflictSummary reschedule(@RequestBody(required = false) RecalculationRequest request) {
        return conflictService.reschedule(request == null ? null : request.timezone());
    }
}
