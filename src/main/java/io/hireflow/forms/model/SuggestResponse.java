package io.hireflow.forms.model;

import java.util.List;

public record SuggestResponse(List<FieldResponse> fields, String modelVersion, int discarded) {
}
