package io.hireflow.forms.model;

import java.time.OffsetDateTime;
import java.util.UUID;

public record SubmitResponse(UUID responseId, OffsetDateTime submittedAt, String message) {
}
