package io.hireflow.forms.model;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record SubmitRequest(@NotNull List<@Valid @NotNull AnswerRequest> answers) {
}
