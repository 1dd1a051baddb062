package io.hireflow.forms.errors;

import io.hireflow.forms.ratelimit.RateLimitDecision;

import java.util.Map;

import org.springframework.http.HttpStatus;

public class RateLimitExceededException extends FormsException {

    private final RateLimitDecision decision;

    public RateLimitExceededException(final RateLimitDecision decision) {
        super(HttpStatus.TOO_MANY_REQUESTS, "RATE_LIMITED", "Too many attempts. Please try again in a few minutes.");
        this.decision = decision;
    }

    public RateLimitDecision getDecision() {
        return decision;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of(
                "limit", decision.limit(),
                "remaining", decision.remaining(),
                "retryAfterSeconds", decision.retryAfterSeconds()
        );
    }
}
