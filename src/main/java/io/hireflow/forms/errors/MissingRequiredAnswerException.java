package io.hireflow.forms.errors;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.springframework.http.HttpStatus;

public class MissingRequiredAnswerException extends FormsException {

    private final List<UUID> fieldIds;
    private final List<String> questions;

    public MissingRequiredAnswerException(final List<UUID> fieldIds, final List<String> questions) {
        super(HttpStatus.BAD_REQUEST, "MISSING_REQUIRED_ANSWER",
                "Please answer all required questions: " + String.join(", ", questions));
        this.fieldIds = List.copyOf(fieldIds);
        this.questions = List.copyOf(questions);
    }

    public List<UUID> getFieldIds() {
        return fieldIds;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("fieldIds", fieldIds, "questions", questions);
    }
}
