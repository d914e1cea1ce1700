package czm.timebox_be.workitem;

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
@RequestMapping("/api/work-items")
@Tag(name = "Work items", description = "Pracovní položky a jejich priority")
public class WorkItemController {
    private final WorkItemService service;

    public WorkItemController(WorkItemService service) {
        this.service = service;
    }

    @GetMapping
    @Operation(summary = "Seznam položek", description = "Vrací položky seřazené podle priority včetně odvozeného začátku a konce.")
    public List<WorkItemResponse> list() {
        return service.list();
    }

    @GetMapping("/{id}")
    @Operation(summary = "Detail položky")
    public WorkItemResponse get(@PathVariable long id) {
        return service.get(id);
    }

    @PostMapping
    @Operation(summary = "Vytvoření položky", description = "Nová položka se zařadí na konec fronty.")
    @ApiResponse(responseCode = "201", description = "Položka byla vytvořena.")
    public ResponseEntity<WorkItemResponse> create(@RequestBody WorkItemRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(service.create(request));
    }

    @PutMapping("/order")
    @Operation(summary = "Změna pořadí", description = "Nastaví prioritu podle pozice v seznamu (první = 1).")
    public List<WorkItemResponse> reorder(@RequestBody WorkItemReorderRequest request) {
        return service.reorder(request);
    }

    @PutMapping("/{id}")
    @Operation(summary = "Úprava položky")
    public WorkItemResponse update(@PathVariable long id, @RequestBody WorkItemRequest request) {
        return service.update(id, request);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Smazání položky", description = "Odebere položku, její bloky i události v kalendáři.")
    public void delete(@PathVariable long id) {
        service.delete(id);
    }
}
