package io.hireflow.forms.util;

import static java.time.ZoneOffset.UTC;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;

/**
 * Time helpers centralised for reuse.
 */
public final class TimeUtils {

    private TimeUtils() {
        throw new AssertionError("No instances");
    }

    /**
     * @return current time in UTC
     */
    public static OffsetDateTime utcNow() {
        return OffsetDateTime.now(UTC);
    }

    /**
     * @return the clock's current instant as a UTC {@link OffsetDateTime}
     */
    public static OffsetDateTime utcNow(final Clock clock) {
        return OffsetDateTime.ofInstant(clock.instant(), UTC);
    }

    /**
     * Calendar day of the clock's instant as seen in {@code zone}.
     */
    public static LocalDate today(final Clock clock, final ZoneId zone) {
        return LocalDate.ofInstant(clock.instant(), zone);
    }

    /**
     * First instant of the day after {@code day} in {@code zone}, expressed in UTC.
     */
    public static OffsetDateTime startOfNextDay(final LocalDate day, final ZoneId zone) {
        return day.plusDays(1).atStartOfDay(zone).toOffsetDateTime().withOffsetSameInstant(UTC);
    }
}
