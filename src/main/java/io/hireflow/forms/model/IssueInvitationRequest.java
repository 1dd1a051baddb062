package io.hireflow.forms.model;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record IssueInvitationRequest(@NotNull UUID applicationId,
                                     @NotNull UUID formId,
                                     @Size(max = 2000) String customMessage) {
}
