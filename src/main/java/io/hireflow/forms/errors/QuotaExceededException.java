package io.hireflow.forms.errors;

import io.hireflow.forms.quota.QuotaDecision;

import java.util.Map;

import org.springframework.http.HttpStatus;

public class QuotaExceededException extends FormsException {

    private final QuotaDecision decision;
    private final long retryAfterSeconds;

    public QuotaExceededException(final QuotaDecision decision, final long retryAfterSeconds) {
        super(HttpStatus.TOO_MANY_REQUESTS, "QUOTA_EXCEEDED",
                "Daily limit of " + decision.limit() + " reached for " + decision.kind().label()
                        + ". Try again after " + decision.resetAt() + ".");
        this.decision = decision;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public QuotaDecision getDecision() {
        return decision;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of(
                "kind", decision.kind().name(),
                "limit", decision.limit(),
                "remaining", decision.remaining(),
                "resetAt", decision.resetAt().toString(),
                "retryAfterSeconds", retryAfterSeconds
        );
    }
}
