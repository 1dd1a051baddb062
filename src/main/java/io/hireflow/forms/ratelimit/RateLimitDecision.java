package io.hireflow.forms.ratelimit;

public record RateLimitDecision(boolean allowed, int limit, int remaining, long retryAfterSeconds) {
}
