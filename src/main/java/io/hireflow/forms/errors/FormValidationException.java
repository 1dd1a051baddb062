package io.hireflow.forms.errors;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.HttpStatus;

public class FormValidationException extends FormsException {

    private final Map<String, String> fieldErrors;

    public FormValidationException(final String message, final Map<String, String> fieldErrors) {
        super(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message);
        this.fieldErrors = new LinkedHashMap<>(fieldErrors);
    }

    public FormValidationException(final String field, final String message) {
        this(message, Map.of(field, message));
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("fieldErrors", fieldErrors);
    }
}
