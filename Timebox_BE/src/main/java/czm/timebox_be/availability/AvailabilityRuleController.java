package czm.timebox_be.availability;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/availability-rules")
@Tag(name = "Availability", description = "Týdenní okna dostupnosti")
public class AvailabilityRuleController {
    private final AvailabilityRuleService service;

    public AvailabilityRuleController(AvailabilityRuleService service) {
        this.service = service;
    }

    @GetMapping
    @Operation(summary = "Seznam pravidel dostupnosti")
    public List<AvailabilityRuleResponse> list() {
        return service.list();
    }

    @PostMapping
    @Operation(summary = "Vytvoření pravidla", description = "Přidá opakované týdenní okno a naplánuje přepočet rozvrhu.")
    @ApiResponse(responseCode = "201", description = "Pravidlo bylo vytvořeno.")
    public ResponseEntity<AvailabilityRuleResponse> create(@RequestBody AvailabilityRuleRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(service.create(request));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Úprava pravidla")
    public AvailabilityRuleResponse update(@PathVariable long id, @RequestBody AvailabilityRuleRequest request) {
        return service.update(id, request);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Smazání pravidla")
    public void delete(@PathVariable long id) {
        service.delete(id);
    }
}
