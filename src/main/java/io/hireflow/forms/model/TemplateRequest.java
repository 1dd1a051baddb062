package io.hireflow.forms.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TemplateRequest(String name,
                              String description,
                              @JsonProperty("isPublished") Boolean isPublished,
                              List<FieldRequest> fields) {
}
