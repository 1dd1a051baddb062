package io.hireflow.forms.model;

import io.hireflow.forms.domain.FieldType;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * One flattened response in an export, answers in snapshot order.
 */
public record ExportRow(UUID responseId,
                        UUID applicationId,
                        String formName,
                        OffsetDateTime submittedAt,
                        List<Item> items) {

    public record Item(String question, FieldType fieldType, String answer, String fileUrl) {
    }
}
