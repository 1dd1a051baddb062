package io.hireflow.forms.model;

import io.hireflow.forms.domain.InvitationStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

public record InvitationResponse(UUID id,
                                 UUID applicationId,
                                 UUID formId,
                                 String formName,
                                 InvitationStatus status,
                                 OffsetDateTime expiresAt,
                                 OffsetDateTime sentAt,
                                 OffsetDateTime viewedAt,
                                 OffsetDateTime answeredAt,
                                 OffsetDateTime reminderSentAt,
                                 String customMessage,
                                 String errorMessage,
                                 UUID sentBy,
                                 OffsetDateTime createdAt) {
}
