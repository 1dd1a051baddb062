package io.hireflow.forms.quota;

import static io.hireflow.forms.util.TimeUtils.startOfNextDay;
import static io.hireflow.forms.util.TimeUtils.today;

import io.hireflow.forms.errors.QuotaExceededException;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.OptionalInt;
import java.util.UUID;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Per-recruiter daily allowances. A granted unit commits on its own and is never handed back,
 * even when the work it paid for fails afterwards.
 */
@Slf4j
@Service
public class QuotaLedger {

    private final QuotaStore quotaStore;
    private final QuotaProperties quotaProperties;
    private final Clock clock;

    public QuotaLedger(final QuotaStore quotaStore, final QuotaProperties quotaProperties, final Clock clock) {
        this.quotaStore = quotaStore;
        this.quotaProperties = quotaProperties;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public QuotaDecision tryConsume(final UUID recruiterId, final CounterKind kind) {
        final LocalDate bucket = today(clock, zone());
        final int limit = quotaProperties.limitFor(kind);
        final OptionalInt used = quotaStore.tryIncrement(recruiterId, bucket, kind, limit);
        if (used.isPresent()) {
            return new QuotaDecision(kind, true, used.getAsInt(), limit, resetAt(bucket));
        }
        log.info("Quota denied recruiterId={} kind={} limit={}", recruiterId, kind, limit);
        return new QuotaDecision(kind, false, Math.max(limit, quotaStore.used(recruiterId, bucket, kind)), limit,
                resetAt(bucket));
    }

    /**
     * Consumes one unit or throws {@link QuotaExceededException} carrying the reset time.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public QuotaDecision consumeOrThrow(final UUID recruiterId, final CounterKind kind) {
        final QuotaDecision decision = tryConsume(recruiterId, kind);
        if (!decision.allowed()) {
            throw new QuotaExceededException(decision, retryAfterSeconds(decision.resetAt()));
        }
        return decision;
    }

    @Transactional(readOnly = true)
    public QuotaDecision peek(final UUID recruiterId, final CounterKind kind) {
        final LocalDate bucket = today(clock, zone());
        final int limit = quotaProperties.limitFor(kind);
        final int used = quotaStore.used(recruiterId, bucket, kind);
        return new QuotaDecision(kind, used < limit, used, limit, resetAt(bucket));
    }

    /**
     * Drops day buckets older than yesterday. Yesterday is kept so a consume that read the clock
     * just before midnight still finds its counter.
     */
    @Scheduled(fixedDelayString = "${forms.quota.evict-delay-ms:3600000}")
    public void evictFinishedBuckets() {
        final int evicted = quotaStore.evictBefore(today(clock, zone()).minusDays(1));
        if (evicted > 0) {
            log.debug("Evicted {} finished quota bucket(s)", Integer.valueOf(evicted));
        }
    }

    private long retryAfterSeconds(final OffsetDateTime resetAt) {
        final long seconds = Duration.between(clock.instant(), resetAt.toInstant()).getSeconds();
        return Math.max(1L, seconds);
    }

    private OffsetDateTime resetAt(final LocalDate bucket) {
        return startOfNextDay(bucket, zone());
    }

    private ZoneId zone() {
        return ZoneId.of(quotaProperties.getZone());
    }
}
