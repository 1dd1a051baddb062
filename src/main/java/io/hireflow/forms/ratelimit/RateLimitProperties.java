package io.hireflow.forms.ratelimit;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "forms.public.rate-limit")
public class RateLimitProperties {

    /**
     * Master toggle for throttling of the public form endpoints.
     */
    private boolean enabled = true;

    /**
     * Requests allowed per client IP and endpoint within one minute.
     */
    @Positive
    private int requestsPerMinute = 10;

    /**
     * Fixed delay between evictions of finished windows, in milliseconds.
     */
    @Positive
    private long evictDelayMs = 60_000L;
}
