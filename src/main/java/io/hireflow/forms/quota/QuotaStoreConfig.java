package io.hireflow.forms.quota;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

@Slf4j
@Configuration
public class QuotaStoreConfig {

    /**
     * Selects the quota backend once, from {@code forms.quota.store}.
     */
    @Bean
    public QuotaStore quotaStore(final QuotaProperties quotaProperties,
                                 final NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        if (quotaProperties.getStore() == QuotaProperties.Store.MEMORY) {
            log.warn("Using in-memory quota counters; usage is lost on restart and not shared across instances");
            return new InMemoryQuotaStore();
        }
        return new JdbcQuotaStore(namedParameterJdbcTemplate);
    }
}
