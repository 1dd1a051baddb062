package io.hireflow.forms.clients.ai;

public interface FieldSuggestionClient {

    FieldSuggestions suggest(SuggestionContext context);
}
