package io.hireflow.forms.quota;

import java.time.LocalDate;
import java.util.OptionalInt;
import java.util.UUID;

/**
 * Storage for per-recruiter daily counters. Implementations must make
 * {@link #tryIncrement} atomic: with a limit of N, exactly N concurrent callers succeed.
 */
public interface QuotaStore {

    /**
     * Adds one to the counter if it is below {@code limit}.
     *
     * @return the new usage when the unit was granted, empty when the ceiling was already reached
     */
    OptionalInt tryIncrement(UUID recruiterId, LocalDate bucket, CounterKind kind, int limit);

    /**
     * Current usage; zero for a bucket nobody has touched.
     */
    int used(UUID recruiterId, LocalDate bucket, CounterKind kind);

    /**
     * Drops buckets older than {@code cutoff}. Durable stores keep their history and do nothing.
     *
     * @return number of buckets removed
     */
    default int evictBefore(LocalDate cutoff) {
        return 0;
    }
}
