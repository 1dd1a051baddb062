package io.hireflow.forms.model;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TemplateResponse(UUID id,
                               String name,
                               String description,
                               @JsonProperty("isPublished") boolean isPublished,
                               UUID createdBy,
                               OffsetDateTime createdAt,
                               OffsetDateTime updatedAt,
                               List<FieldResponse> fields) {
}
