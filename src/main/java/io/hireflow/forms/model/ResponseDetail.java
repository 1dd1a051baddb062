package io.hireflow.forms.model;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record ResponseDetail(UUID id,
                             UUID invitationId,
                             UUID applicationId,
                             UUID formId,
                             String formName,
                             OffsetDateTime submittedAt,
                             List<AnswerView> answers) {
}
