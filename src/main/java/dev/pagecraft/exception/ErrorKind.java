package dev.pagecraft.exception;

import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.http.HttpStatus;

/**
 * Failure categories of a single engine operation. None of them is fatal; each
 * is the normal, recoverable outcome of one call.
 */
public enum ErrorKind {

    NOT_FOUND("NotFound", HttpStatus.NOT_FOUND, "error.not_found"),
    INVALID_OPERATION("InvalidOperation", HttpStatus.UNPROCESSABLE_ENTITY, "error.invalid_operation"),
    CYCLE_DETECTED("CycleDetected", HttpStatus.CONFLICT, "error.cycle_detected"),
    SLUG_CONFLICT("SlugConflict", HttpStatus.CONFLICT, "error.slug_conflict"),
    VALIDATION_ERROR("ValidationError", HttpStatus.BAD_REQUEST, "error.validation_failed");

    private final String code;
    private final HttpStatus status;
    private final String messageKey;

    ErrorKind(String code, HttpStatus status, String messageKey) {
        this.code = code;
        this.status = status;
        this.messageKey = messageKey;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getMessageKey() {
        return messageKey;
    }
}
