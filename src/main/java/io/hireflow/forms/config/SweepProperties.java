package io.hireflow.forms.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "forms.invitation.sweep")
public class SweepProperties {

    /**
     * Master toggle for the expiry sweep.
     */
    private boolean enabled = true;

    /**
     * Fixed delay between sweeps in milliseconds.
     */
    private long delayMs = 900_000L;
}
