package io.hireflow.forms.quota;

import java.time.LocalDate;
import java.util.List;
import java.util.OptionalInt;
import java.util.UUID;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/**
 * Durable counters in {@code quota_counters}. The increment is one guarded upsert, so the
 * ceiling holds across threads and instances without an explicit lock.
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcQuotaStore implements QuotaStore {

    private static final String INCREMENT_SQL = """
        INSERT INTO quota_counters (recruiter_id, bucket_date, counter_kind, used, updated_at)
        VALUES (:recruiterId, :bucket, :kind, 1, NOW())
        ON CONFLICT (recruiter_id, bucket_date, counter_kind)
        DO UPDATE SET used       = quota_counters.used + 1,
                      updated_at = NOW()
                WHERE quota_counters.used < :limit
        RETURNING used
        """;

    private static final String USED_SQL = """
        SELECT used
          FROM quota_counters
         WHERE recruiter_id = :recruiterId
           AND bucket_date  = :bucket
           AND counter_kind = :kind
        """;

    private final NamedParameterJdbcTemplate namedParameterJdbcTemplate;

    @Override
    public OptionalInt tryIncrement(final UUID recruiterId, final LocalDate bucket, final CounterKind kind, final int limit) {
        if (limit <= 0) {
            return OptionalInt.empty();
        }
        final MapSqlParameterSource parameters = params(recruiterId, bucket, kind)
                .addValue("limit", Integer.valueOf(limit));

        final List<Integer> rows = this.namedParameterJdbcTemplate.query(
                INCREMENT_SQL, parameters, (rs, rowNum) -> rs.getInt("used"));
        if (rows.isEmpty()) {
            log.debug("quota ceiling reached recruiterId={} kind={} bucket={}", recruiterId, kind, bucket);
            return OptionalInt.empty();
        }
        return OptionalInt.of(rows.get(0));
    }

    @Override
    public int used(final UUID recruiterId, final LocalDate bucket, final CounterKind kind) {
        final List<Integer> rows = this.namedParameterJdbcTemplate.query(
                USED_SQL, params(recruiterId, bucket, kind), (rs, rowNum) -> rs.getInt("used"));
        return rows.isEmpty() ? 0 : rows.get(0);
    }

    private static MapSqlParameterSource params(final UUID recruiterId, final LocalDate bucket, final CounterKind kind) {
        return new MapSqlParameterSource()
                .addValue("recruiterId", recruiterId)
                .addValue("bucket", bucket)
                .addValue("kind", kind.name());
    }
}
