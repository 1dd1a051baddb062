package io.hireflow.forms.ratelimit;

import io.hireflow.forms.errors.RateLimitExceededException;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fixed one-minute windows keyed by client IP and endpoint. State is process local.
 */
@Slf4j
@Component
public class PublicRateLimiter {

    static final long WINDOW_MILLIS = 60_000L;

    private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();
    private final RateLimitProperties rateLimitProperties;
    private final Clock clock;

    public PublicRateLimiter(final RateLimitProperties rateLimitProperties, final Clock clock) {
        this.rateLimitProperties = rateLimitProperties;
        this.clock = clock;
    }

    public RateLimitDecision allow(final String clientIp, final String endpoint) {
        final int limit = rateLimitProperties.getRequestsPerMinute();
        if (!rateLimitProperties.isEnabled()) {
            return new RateLimitDecision(true, limit, limit, 0L);
        }
        final long now = clock.millis();
        final Window window = windows.compute(key(clientIp, endpoint), (key, current) ->
                current == null || current.isOver(now) ? new Window(now, 1) : current.increment());

        final int remaining = Math.max(0, limit - window.count());
        if (window.count() <= limit) {
            return new RateLimitDecision(true, limit, remaining, 0L);
        }
        final long retryAfterMillis = window.startMillis() + WINDOW_MILLIS - now;
        return new RateLimitDecision(false, limit, 0, Math.max(1L, (retryAfterMillis + 999L) / 1000L));
    }

    /**
     * Same as {@link #allow} but throws {@link RateLimitExceededException} on denial.
     */
    public RateLimitDecision enforce(final String clientIp, final String endpoint) {
        final RateLimitDecision decision = allow(clientIp, endpoint);
        if (!decision.allowed()) {
            log.warn("Rate limit hit ip={} endpoint={} retryAfter={}s", clientIp, endpoint, decision.retryAfterSeconds());
            throw new RateLimitExceededException(decision);
        }
        return decision;
    }

    @Scheduled(fixedDelayString = "${forms.public.rate-limit.evict-delay-ms:60000}")
    public void evictExpiredWindows() {
        final long now = clock.millis();
        final int before = windows.size();
        windows.values().removeIf(window -> window.isOver(now));
        final int evicted = before - windows.size();
        if (evicted > 0) {
            log.debug("Evicted {} finished rate limit window(s)", Integer.valueOf(evicted));
        }
    }

    int trackedWindows() {
        return windows.size();
    }

    private static String key(final String clientIp, final String endpoint) {
        return endpoint + "|" + (clientIp == null ? "unknown" : clientIp);
    }

    private record Window(long startMillis, int count) {

        boolean isOver(final long now) {
            return now - startMillis >= WINDOW_MILLIS;
        }

        Window increment() {
            return new Window(startMillis, count + 1);
        }
    }
}
