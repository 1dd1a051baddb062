package io.hireflow.forms.http;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.http.HttpMethod;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.mock.http.client.MockClientHttpRequest;

@ExtendWith(MockitoExtension.class)
class CorrelationIdInterceptorTest {

    private final CorrelationIdInterceptor interceptor = new CorrelationIdInterceptor();
    @Mock
    private ClientHttpRequestExecution execution;
    @Mock
    private ClientHttpResponse response;

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void forwardsTheInboundCorrelationId() throws IOException {
        MDC.put(CorrelationIdInterceptor.MDC_KEY, "cid-123");
        final MockClientHttpRequest request = new MockClientHttpRequest(HttpMethod.POST, URI.create("http://ai/v1/form-suggestions"));
        final byte[] body = "{}".getBytes(StandardCharsets.UTF_8);
        when(execution.execute(any(), any())).thenReturn(response);

        assertThat(interceptor.intercept(request, body, execution)).isSameAs(response);
        assertThat(request.getHeaders().getFirst(CorrelationIdInterceptor.HEADER)).isEqualTo("cid-123");
    }

    @Test
    void generatesAnIdOutsideARequest() throws IOException {
        final MockClientHttpRequest request = new MockClientHttpRequest(HttpMethod.POST, URI.create("http://ai/v1/form-suggestions"));
        when(execution.execute(any(), any())).thenReturn(response);

        interceptor.intercept(request, new byte[0], execution);

        assertThat(request.getHeaders().getFirst(CorrelationIdInterceptor.HEADER)).isNotBlank();
    }

    @Test
    void keepsAnExplicitHeader() throws IOException {
        MDC.put(CorrelationIdInterceptor.MDC_KEY, "cid-123");
        final MockClientHttpRequest request = new MockClientHttpRequest(HttpMethod.GET, URI.create("http://ai/health"));
        request.getHeaders().add(CorrelationIdInterceptor.HEADER, "explicit");
        when(execution.execute(any(), any())).thenReturn(response);

        interceptor.intercept(request, new byte[0], execution);

        assertThat(request.getHeaders().get(CorrelationIdInterceptor.HEADER)).containsExactly("explicit");
    }
}
