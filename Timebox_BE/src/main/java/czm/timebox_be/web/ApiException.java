package czm.timebox_be.web;

import org.springframework.http.HttpStatus;

public class ApiException extends RuntimeException {
    private final String code;
    private final HttpStatus status;
    private final String details;

    private ApiException(String code, String message, String details, HttpStatus status, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
        this.details = details;
    }

    public static ApiException validation(String message, String details) {
        return new ApiException("VALIDATION", message, details, HttpStatus.BAD_REQUEST, null);
    }

    public static ApiException conflict(String message, String details) {
        return new ApiException("CONFLICT", message, details, HttpStatus.CONFLICT, null);
    }

    public static ApiException notFound(String message, String details) {
        return new ApiException("NOT_FOUND", message, details, HttpStatus.NOT_FOUND, null);
    }

    public static ApiException persistence(String message, String details, Throwable cause) {
        return new ApiException("PERSISTENCE", message, details, HttpStatus.INTERNAL_SERVER_ERROR, cause);
    }

    public static ApiException internal(String message, String details) {
        return new ApiException("INTERNAL", message, details, HttpStatus.INTERNAL_SERVER_ERROR, null);
    }

    public String getCode() {
        return code;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getDetails() {
        return details;
    }
}
