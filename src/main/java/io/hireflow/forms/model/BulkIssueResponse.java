package io.hireflow.forms.model;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

public record BulkIssueResponse(List<Item> results, Map<String, Integer> summary) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Item(UUID applicationId, Outcome outcome, UUID invitationId, String message) {
    }

    public enum Outcome {
        CREATED("created"),
        DUPLICATE("duplicate"),
        UNAUTHORIZED("unauthorized"),
        SKIPPED("skipped"),
        QUOTA_EXCEEDED("quota_exceeded"),
        EMAIL_FAILED("email_failed"),
        NOT_FOUND("not_found");

        private final String wire;

        Outcome(final String wire) {
            this.wire = wire;
        }

        @JsonValue
        public String wire() {
            return wire;
        }
    }
}
