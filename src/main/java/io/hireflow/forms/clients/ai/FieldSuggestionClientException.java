package io.hireflow.forms.clients.ai;

public class FieldSuggestionClientException extends RuntimeException {

    public FieldSuggestionClientException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
