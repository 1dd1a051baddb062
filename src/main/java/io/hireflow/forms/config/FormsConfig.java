package io.hireflow.forms.config;

import io.hireflow.forms.clients.ai.FieldSuggestionClientProperties;
import io.hireflow.forms.clients.mail.InvitationMailProperties;
import io.hireflow.forms.quota.QuotaProperties;
import io.hireflow.forms.ratelimit.RateLimitProperties;
import io.hireflow.forms.storage.StorageProperties;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
        FormsProperties.class,
        SweepProperties.class,
        QuotaProperties.class,
        RateLimitProperties.class,
        InvitationMailProperties.class,
        FieldSuggestionClientProperties.class,
        StorageProperties.class
})
public class FormsConfig {
}
