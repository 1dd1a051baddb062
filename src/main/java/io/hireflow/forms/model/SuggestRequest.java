package io.hireflow.forms.model;

import java.util.List;
import java.util.UUID;

import jakarta.validation.constraints.Size;

public record SuggestRequest(UUID jobId,
                             @Size(max = 20000) String jobDescription,
                             @Size(max = 10) List<@Size(max = 200) String> goals) {
}
