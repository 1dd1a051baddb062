package io.hireflow.forms.domain;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable copy of a template taken when an invitation is issued. Stored as JSON on the
 * invitation row, so later template edits or deletion do not change what the candidate sees.
 */
public record FormSnapshot(String formName, String formDescription, List<SnapshotField> fields) {

    public FormSnapshot {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public static FormSnapshot of(final FormTemplate template) {
        final List<SnapshotField> copied = template.getFields().stream()
                .map(field -> new SnapshotField(
                        field.getId(),
                        field.getType(),
                        field.getLabel(),
                        field.isRequired(),
                        field.getOptions() == null ? List.of() : List.copyOf(field.getOptions()),
                        field.getPosition()))
                .toList();
        return new FormSnapshot(template.getName(), template.getDescription(), copied);
    }

    public Optional<SnapshotField> field(final UUID fieldId) {
        return fields.stream().filter(field -> field.id().equals(fieldId)).findFirst();
    }

    public record SnapshotField(UUID id, FieldType type, String label, boolean required,
                                List<String> options, int order) {

        public SnapshotField {
            options = options == null ? List.of() : List.copyOf(options);
        }
    }
}
