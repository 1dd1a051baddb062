package io.hireflow.forms.model;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record AnswerRequest(@NotNull UUID fieldId, String answer, String fileUrl) {
}
