package io.hireflow.forms.quota;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "forms.quota")
public class QuotaProperties {

    /**
     * Backing store for the daily counters, chosen once at startup.
     */
    @NotNull
    private Store store = Store.JDBC;

    /**
     * Zone whose calendar day defines a quota bucket.
     */
    @NotBlank
    private String zone = "UTC";

    @PositiveOrZero
    private int invitationsPerDay = 50;

    @PositiveOrZero
    private int aiSuggestionsPerDay = 20;

    /**
     * Fixed delay between evictions of finished day buckets, in milliseconds. Only the in-memory
     * store holds anything to evict.
     */
    @Positive
    private long evictDelayMs = 3_600_000L;

    public int limitFor(final CounterKind kind) {
        return switch (kind) {
            case INVITATIONS_SENT -> invitationsPerDay;
            case AI_SUGGESTIONS -> aiSuggestionsPerDay;
        };
    }

    public enum Store {
        JDBC,
        MEMORY
    }
}
