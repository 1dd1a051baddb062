package io.hireflow.forms.quota;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.hireflow.forms.errors.QuotaExceededException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("QuotaLedger")
class QuotaLedgerTest {

    private static final UUID RECRUITER = UUID.randomUUID();
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T22:30:00Z"), ZoneOffset.UTC);

    private QuotaProperties properties;
    private InMemoryQuotaStore store;

    @BeforeEach
    void setUp() {
        properties = new QuotaProperties();
        properties.setInvitationsPerDay(2);
        properties.setAiSuggestionsPerDay(1);
        store = new InMemoryQuotaStore();
    }

    private QuotaLedger ledger(final Clock clock) {
        return new QuotaLedger(store, properties, clock);
    }

    @Test
    @DisplayName("consumes until the daily limit and reports remaining units")
    void consumes() {
        final QuotaLedger ledger = ledger(CLOCK);

        final QuotaDecision first = ledger.tryConsume(RECRUITER, CounterKind.INVITATIONS_SENT);
        final QuotaDecision second = ledger.tryConsume(RECRUITER, CounterKind.INVITATIONS_SENT);
        final QuotaDecision third = ledger.tryConsume(RECRUITER, CounterKind.INVITATIONS_SENT);

        assertThat(first.allowed()).isTrue();
        assertThat(first.remaining()).isEqualTo(1);
        assertThat(second.remaining()).isZero();
        assertThat(third.allowed()).isFalse();
        assertThat(third.used()).isEqualTo(2);
        assertThat(third.resetAt()).isEqualTo(OffsetDateTime.parse("2025-06-02T00:00:00Z"));
    }

    @Test
    @DisplayName("refusal carries the reset time and seconds until it")
    void consumeOrThrow() {
        final QuotaLedger ledger = ledger(CLOCK);
        ledger.consumeOrThrow(RECRUITER, CounterKind.AI_SUGGESTIONS);

        assertThatThrownBy(() -> ledger.consumeOrThrow(RECRUITER, CounterKind.AI_SUGGESTIONS))
                .isInstanceOfSatisfying(QuotaExceededException.class, e -> {
                    assertThat(e.getCode()).isEqualTo("QUOTA_EXCEEDED");
                    assertThat(e.getRetryAfterSeconds()).isEqualTo(90L * 60L);
                    assertThat(e.getDecision().kind()).isEqualTo(CounterKind.AI_SUGGESTIONS);
                    assertThat(e.details()).containsEntry("limit", 1);
                });
    }

    @Test
    @DisplayName("peek does not consume")
    void peek() {
        final QuotaLedger ledger = ledger(CLOCK);
        ledger.tryConsume(RECRUITER, CounterKind.INVITATIONS_SENT);

        final QuotaDecision peeked = ledger.peek(RECRUITER, CounterKind.INVITATIONS_SENT);

        assertThat(peeked.used()).isEqualTo(1);
        assertThat(peeked.allowed()).isTrue();
        assertThat(ledger.peek(RECRUITER, CounterKind.INVITATIONS_SENT).used()).isEqualTo(1);
    }

    @Test
    @DisplayName("the bucket follows the configured zone's calendar day")
    void zoneDefinesDay() {
        properties.setZone("Europe/Berlin");
        final QuotaLedger ledger = ledger(CLOCK);
        ledger.tryConsume(RECRUITER, CounterKind.INVITATIONS_SENT);
        ledger.tryConsume(RECRUITER, CounterKind.INVITATIONS_SENT);

        // 22:30 UTC is already the next day in Berlin
        final QuotaDecision decision = ledger.peek(RECRUITER, CounterKind.INVITATIONS_SENT);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.resetAt()).isEqualTo(OffsetDateTime.parse("2025-06-02T22:00:00Z"));
    }

    @Test
    @DisplayName("usage resets on the next day")
    void nextDay() {
        ledger(CLOCK).tryConsume(RECRUITER, CounterKind.INVITATIONS_SENT);
        ledger(CLOCK).tryConsume(RECRUITER, CounterKind.INVITATIONS_SENT);

        final QuotaLedger tomorrow = ledger(Clock.offset(CLOCK, Duration.ofHours(2)));

        assertThat(tomorrow.tryConsume(RECRUITER, CounterKind.INVITATIONS_SENT).allowed()).isTrue();
    }

    @Test
    @DisplayName("scheduled eviction keeps yesterday and today and drops older buckets")
    void evictsFinishedBuckets() {
        final LocalDate today = LocalDate.of(2025, 6, 1);
        store.tryIncrement(RECRUITER, today.minusDays(2), CounterKind.INVITATIONS_SENT, 5);
        store.tryIncrement(RECRUITER, today.minusDays(1), CounterKind.INVITATIONS_SENT, 5);
        store.tryIncrement(RECRUITER, today, CounterKind.INVITATIONS_SENT, 5);

        ledger(CLOCK).evictFinishedBuckets();

        assertThat(store.used(RECRUITER, today.minusDays(2), CounterKind.INVITATIONS_SENT)).isZero();
        assertThat(store.used(RECRUITER, today.minusDays(1), CounterKind.INVITATIONS_SENT)).isEqualTo(1);
        assertThat(store.used(RECRUITER, today, CounterKind.INVITATIONS_SENT)).isEqualTo(1);
    }
}
