package io.hireflow.forms.clients.ai;

import java.util.List;
import java.util.UUID;

public record SuggestionContext(UUID jobId, String jobDescription, List<String> goals) {

    public SuggestionContext {
        goals = goals == null ? List.of() : List.copyOf(goals);
    }
}
