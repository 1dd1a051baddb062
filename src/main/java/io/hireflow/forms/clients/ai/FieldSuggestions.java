package io.hireflow.forms.clients.ai;

import java.util.List;

public record FieldSuggestions(List<FieldDraft> fields, String modelVersion) {

    public FieldSuggestions {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }
}
