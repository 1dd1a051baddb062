package io.hireflow.forms.model;

import io.hireflow.forms.domain.FieldType;

import java.util.UUID;

public record AnswerView(UUID fieldId, String question, FieldType fieldType, String answer, String fileUrl) {
}
