package io.hireflow.forms.model;

import io.hireflow.forms.quota.CounterKind;

import java.time.OffsetDateTime;

public record QuotaResponse(CounterKind kind, int used, int limit, int remaining, OffsetDateTime resetAt) {
}
