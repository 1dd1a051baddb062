package io.hireflow.forms.quota;

import java.time.OffsetDateTime;

/**
 * Outcome of a quota check. For a peek, {@code allowed} says whether one more unit is available.
 */
public record QuotaDecision(CounterKind kind,
                            boolean allowed,
                            int used,
                            int limit,
                            OffsetDateTime resetAt) {

    public int remaining() {
        return Math.max(0, limit - used);
    }
}
