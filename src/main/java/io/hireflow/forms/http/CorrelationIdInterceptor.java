package io.hireflow.forms.http;

import java.io.IOException;
import java.util.UUID;

import org.slf4j.MDC;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;

/**
 * Forwards the inbound correlation id (from the MDC) to downstream services.
 */
public class CorrelationIdInterceptor implements ClientHttpRequestInterceptor {
    public static final String HEADER = "X-Request-ID";
    public static final String MDC_KEY = "correlationId";

    @Override
    public ClientHttpResponse intercept(final HttpRequest request, final byte[] body, final ClientHttpRequestExecution execution)
            throws IOException {
        if (!request.getHeaders().containsKey(HEADER)) {
            final String current = MDC.get(MDC_KEY);
            request.getHeaders().add(HEADER, current == null || current.isBlank() ? UUID.randomUUID().toString() : current);
        }
        return execution.execute(request, body);
    }
}
