package io.hireflow.forms.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Partial update. Absent properties are left alone; {@code fields}, when present, replaces the list.
 */
public record TemplateUpdateRequest(String name,
                                    String description,
                                    @JsonProperty("isPublished") Boolean isPublished,
                                    List<FieldRequest> fields) {
}
