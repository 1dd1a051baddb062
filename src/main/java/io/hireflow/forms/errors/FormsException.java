package io.hireflow.forms.errors;

import java.util.Map;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base type for domain rejections. Each subtype fixes the HTTP status and the stable error code
 * that {@code GlobalExceptionHandler} writes to the response body.
 */
@Getter
public abstract class FormsException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    protected FormsException(final HttpStatus status, final String code, final String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    /**
     * Extra, machine-readable context for the error body. Empty by default.
     */
    public Map<String, Object> details() {
        return Map.of();
    }
}
