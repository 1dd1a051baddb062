package io.hireflow.forms.model;

import jakarta.validation.constraints.Size;

public record ResendRequest(@Size(max = 2000) String customMessage) {
}
