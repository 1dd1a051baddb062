package io.hireflow.forms.model;

import java.util.List;
import java.util.UUID;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record BulkIssueRequest(@NotEmpty @Size(max = 100) List<@NotNull UUID> applicationIds,
                               @NotNull UUID formId,
                               @Size(max = 2000) String customMessage) {
}
