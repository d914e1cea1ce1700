package czm.timebox_be.session;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/sessions")
@Tag(name = "Sessions", description = "Naplánované pracovní bloky")
public class SessionController {
    private final SessionService service;

    public SessionController(SessionService service) {
        this.service = service;
    }

    @GetMapping
    @Operation(summary = "Seznam bloků", description = "Vrací naplánované, dokončené i konfliktní bloky seřazené podle začátku.")
    public List<SessionResponse> list(@Parameter(description = "Filtr podle pracovní položky")
                                      @RequestParam(value = "workItemId", required = false) Long workItemId) {
        return service.list(workItemId);
    }

    @PostMapping("/{id}/complete")
    @Operation(summary = "Dokončení bloku", description = "Označí naplánovaný blok jako dokončený.")
    public SessionResponse complete(@PathVariable long id) {
        return service.complete(id);
    }
}
