package io.hireflow.forms.clients.ai;

import io.hireflow.forms.http.CorrelationIdInterceptor;

import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.TimeValue;
import org.apache.hc.core5.util.Timeout;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/**
 * Wires the suggestion client only when {@code forms.ai.enabled=true}. Without it the
 * suggestion endpoint answers 503.
 */
@Configuration
@ConditionalOnProperty(prefix = "forms.ai", name = "enabled", havingValue = "true")
public class FieldSuggestionClientConfig {

    @Bean(destroyMethod = "close")
    public CloseableHttpClient suggestionHttpClient(final FieldSuggestionClientProperties props) {
        final PoolingHttpClientConnectionManager connections = PoolingHttpClientConnectionManagerBuilder.create()
                .setMaxConnTotal(props.getMaxConnections())
                .setMaxConnPerRoute(props.getMaxConnections())
                .build();
        final RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(Timeout.of(props.connectTimeout()))
                .setResponseTimeout(Timeout.of(props.readTimeout()))
                .build();
        // suggestions are billed upstream, so a timed out call is not replayed
        return HttpClients.custom()
                .setConnectionManager(connections)
                .setDefaultRequestConfig(requestConfig)
                .evictExpiredConnections()
                .evictIdleConnections(TimeValue.ofSeconds(30))
                .disableAutomaticRetries()
                .build();
    }

    @Bean
    public RestClient suggestionRestClient(final CloseableHttpClient suggestionHttpClient,
                                           final FieldSuggestionClientProperties props) {
        if (!StringUtils.hasText(props.getBaseUrl())) {
            throw new IllegalStateException("forms.ai.enabled=true requires forms.ai.base-url");
        }
        final RestClient.Builder builder = RestClient.builder()
                .baseUrl(props.getBaseUrl())
                .requestFactory(new HttpComponentsClientHttpRequestFactory(suggestionHttpClient))
                .requestInterceptor(new CorrelationIdInterceptor());
        props.getHeaders().forEach(builder::defaultHeader);
        return builder.build();
    }

    @Bean
    public FieldSuggestionClient fieldSuggestionClient(final RestClient suggestionRestClient,
                                                       final FieldSuggestionClientProperties props) {
        return new RestFieldSuggestionClient(suggestionRestClient, props);
    }
}
