package io.hireflow.forms.model;

import io.hireflow.forms.domain.FieldType;

import java.util.List;
import java.util.UUID;

public record FieldResponse(UUID id, FieldType type, String label, boolean required, List<String> options, int order) {
}
