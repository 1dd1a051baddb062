package io.hireflow.forms.quota;

import java.time.LocalDate;
import java.util.OptionalInt;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-local counters. Lost on restart and not shared between instances; meant for local runs
 * and single-node deployments.
 */
public class InMemoryQuotaStore implements QuotaStore {

    private final ConcurrentMap<Key, AtomicInteger> counters = new ConcurrentHashMap<>();

    @Override
    public OptionalInt tryIncrement(final UUID recruiterId, final LocalDate bucket, final CounterKind kind, final int limit) {
        if (limit <= 0) {
            return OptionalInt.empty();
        }
        final AtomicInteger counter = counters.computeIfAbsent(new Key(recruiterId, bucket, kind),
                ignored -> new AtomicInteger());
        while (true) {
            final int current = counter.get();
            if (current >= limit) {
                return OptionalInt.empty();
            }
            if (counter.compareAndSet(current, current + 1)) {
                return OptionalInt.of(current + 1);
            }
        }
    }

    @Override
    public int used(final UUID recruiterId, final LocalDate bucket, final CounterKind kind) {
        final AtomicInteger counter = counters.get(new Key(recruiterId, bucket, kind));
        return counter == null ? 0 : counter.get();
    }

    @Override
    public int evictBefore(final LocalDate cutoff) {
        final int before = counters.size();
        counters.keySet().removeIf(key -> key.bucket().isBefore(cutoff));
        return before - counters.size();
    }

    private record Key(UUID recruiterId, LocalDate bucket, CounterKind kind) {
    }
}
