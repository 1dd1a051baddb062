package io.hireflow.forms.model;

import io.hireflow.forms.domain.FormSnapshot.SnapshotField;
import io.hireflow.forms.domain.InvitationStatus;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * What a candidate sees when opening a link: the frozen snapshot, never the live template.
 */
public record PublicFormView(String formName,
                             String formDescription,
                             List<SnapshotField> fields,
                             OffsetDateTime expiresAt,
                             InvitationStatus status) {
}
