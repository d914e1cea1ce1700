package czm.timebox_be.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@ControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String CALENDAR_DOWN = "Kalendář je teď nedostupný. Zkuste to prosím znovu.";

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiErrorResponse> handleApi(ApiException ex) {
        if (ex.getStatus().is5xxServerError()) {
            log.error("Request failed: {} ({})", ex.getMessage(), ex.getDetails(), ex);
        }
        return respond(ex.getStatus().value(), ex.getCode(), ex.getMessage(), ex.getDetails(), null);
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class,
            MethodArgumentNotValidException.class, IllegalArgumentException.class})
    public ResponseEntity<ApiErrorResponse> handleValidation(Exception ex) {
        return respond(HttpStatus.BAD_REQUEST.value(), "VALIDATION",
                "Neplatný vstup. Zkontrolujte zadané hodnoty.", ex.getMessage(), null);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiErrorResponse> handleDataAccess(DataAccessException ex) {
        log.error("Database operation failed", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR.value(), "PERSISTENCE",
                "Uložení dat selhalo. Zkuste to prosím znovu.", ex.getMostSpecificCause().getMessage(), null);
    }

    @ExceptionHandler(HttpStatusCodeException.class)
    public ResponseEntity<ApiErrorResponse> handleCalendar(HttpStatusCodeException ex) {
        int upstream = ex.getStatusCode().value();
        String requestId = ex.getResponseHeaders() != null ? ex.getResponseHeaders().getFirst("X-Request-Id") : null;
        String details = truncate(ex.getResponseBodyAsString(), 500);
        log.warn("Calendar provider answered {}: {}", upstream, details);

        if (upstream == 429) {
            return respond(503, "RATE_LIMITED",
                    "Kalendář nás dočasně omezil. Počkejte minutu a zkuste to znovu.", details, requestId);
        }
        if (upstream == 401 || upstream == 403) {
            return respond(502, "CALENDAR_UNAUTHORIZED",
                    "Přístup ke kalendáři byl odmítnut. Zkontrolujte přístupový token.", details, requestId);
        }
        if (upstream >= 500) {
            return respond(502, "CALENDAR_UNAVAILABLE", CALENDAR_DOWN, details, requestId);
        }
        return respond(400, "CALENDAR_REJECTED", "Kalendář požadavek odmítl.", details, requestId);
    }

    @ExceptionHandler(ResourceAccessException.class)
    public ResponseEntity<ApiErrorResponse> handleCalendarIo(ResourceAccessException ex) {
        log.warn("Calendar provider unreachable: {}", ex.getMessage());
        return respond(504, "TIMEOUT", CALENDAR_DOWN, ex.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(Exception ex) {
        log.error("Unhandled exception", ex);
        return respond(500, "UNKNOWN", "Nastala neočekávaná chyba. Zkuste to znovu.", ex.getMessage(), null);
    }

    private static ResponseEntity<ApiErrorResponse> respond(int status, String code, String message, String details,
                                                            String requestId) {
        return ResponseEntity.status(status).body(ApiErrorResponse.of(code, message, details, status, requestId));
    }

    private static String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
