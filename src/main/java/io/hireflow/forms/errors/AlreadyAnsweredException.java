package io.hireflow.forms.errors;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import org.springframework.http.HttpStatus;

public class AlreadyAnsweredException extends FormsException {

    private final UUID responseId;

    public AlreadyAnsweredException(final UUID responseId) {
        super(HttpStatus.CONFLICT, "ALREADY_SUBMITTED",
                "You've already submitted this form. Thank you for your response!");
        this.responseId = responseId;
    }

    public UUID getResponseId() {
        return responseId;
    }

    @Override
    public Map<String, Object> details() {
        final Map<String, Object> details = new HashMap<>();
        if (responseId != null) {
            details.put("responseId", responseId);
        }
        return details;
    }
}
